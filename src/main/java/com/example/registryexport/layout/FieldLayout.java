package com.example.registryexport.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offset table of a fixed-width record: an ordered head region followed by a
 * tail of repeating officer strides. Holds no record data.
 *
 * <pre>
 * | head fields ... | stride 0 | stride 1 | ... | stride max-1 | filler |
 * 0                 headEnd                                     totalWidth
 * </pre>
 */
public final class FieldLayout {

    private final int totalWidth;
    private final int maxOfficers;
    private final List<FieldSpec> headFields;
    private final List<FieldSpec> officerFields;
    private final Map<String, Integer> headOffsets = new LinkedHashMap<>();
    private final Map<String, Integer> officerOffsets = new LinkedHashMap<>();
    private final Map<String, Integer> widths = new LinkedHashMap<>();
    private final int headEnd;
    private final int strideWidth;

    private FieldLayout(int totalWidth, int maxOfficers, List<FieldSpec> headFields, List<FieldSpec> officerFields) {
        if (totalWidth <= 0) {
            throw new LayoutException("total width must be positive, was " + totalWidth);
        }
        if (maxOfficers < 0) {
            throw new LayoutException("maximum officer count must not be negative, was " + maxOfficers);
        }
        this.totalWidth = totalWidth;
        this.maxOfficers = maxOfficers;
        this.headFields = Collections.unmodifiableList(new ArrayList<>(headFields));
        this.officerFields = Collections.unmodifiableList(new ArrayList<>(officerFields));

        long pos = 0;
        for (FieldSpec field : this.headFields) {
            checkWidth(field);
            if (headOffsets.put(field.getName(), (int) pos) != null) {
                throw new LayoutException("duplicate head field '" + field.getName() + "'");
            }
            widths.put(field.getName(), field.getWidth());
            pos += field.getWidth();
            if (pos > totalWidth) {
                throw new LayoutException("head field '" + field.getName() + "' ends at " + pos
                        + ", past the record width " + totalWidth);
            }
        }
        this.headEnd = (int) pos;

        long stride = 0;
        for (FieldSpec field : this.officerFields) {
            checkWidth(field);
            if (officerOffsets.put(field.getName(), (int) stride) != null) {
                throw new LayoutException("duplicate officer field '" + field.getName() + "'");
            }
            stride += field.getWidth();
        }
        if (maxOfficers > 0 && stride == 0) {
            throw new LayoutException("officer stride is empty but up to " + maxOfficers + " officers are declared");
        }
        long end = headEnd + stride * maxOfficers;
        if (end > totalWidth) {
            throw new LayoutException("head (" + headEnd + ") plus " + maxOfficers + " officer strides of "
                    + stride + " needs " + end + " columns, record width is " + totalWidth);
        }
        this.strideWidth = (int) stride;
    }

    private static void checkWidth(FieldSpec field) {
        if (field.getName() == null || field.getName().isEmpty()) {
            throw new LayoutException("field without a name");
        }
        if (field.getWidth() <= 0) {
            throw new LayoutException("field '" + field.getName() + "' has non-positive width " + field.getWidth());
        }
    }

    public static Builder builder(int totalWidth) {
        return new Builder(totalWidth);
    }

    public int totalWidth() {
        return totalWidth;
    }

    public int maxOfficers() {
        return maxOfficers;
    }

    public int headEnd() {
        return headEnd;
    }

    public int strideWidth() {
        return strideWidth;
    }

    public List<FieldSpec> headFields() {
        return headFields;
    }

    public List<FieldSpec> officerFields() {
        return officerFields;
    }

    public boolean hasField(String name) {
        return headOffsets.containsKey(name);
    }

    public boolean hasOfficerField(String name) {
        return officerOffsets.containsKey(name);
    }

    public int offsetOf(String name) {
        Integer offset = headOffsets.get(name);
        if (offset == null) {
            throw new IllegalArgumentException("no head field '" + name + "'");
        }
        return offset;
    }

    public int widthOf(String name) {
        Integer width = widths.get(name);
        if (width == null) {
            throw new IllegalArgumentException("no head field '" + name + "'");
        }
        return width;
    }

    /** Absolute offset of officer stride {@code index}. */
    public int officerOffset(int index) {
        if (index < 0 || index >= maxOfficers) {
            throw new IndexOutOfBoundsException("officer index " + index + " outside 0.." + (maxOfficers - 1));
        }
        return headEnd + index * strideWidth;
    }

    /** Offset of an officer field relative to the start of its stride. */
    public int officerFieldOffset(String name) {
        Integer offset = officerOffsets.get(name);
        if (offset == null) {
            throw new IllegalArgumentException("no officer field '" + name + "'");
        }
        return offset;
    }

    @Override
    public String toString() {
        return "FieldLayout[width=" + totalWidth + ", head=" + headEnd + ", stride=" + strideWidth
                + " x " + maxOfficers + "]";
    }

    public static final class Builder {
        private final int totalWidth;
        private int maxOfficers;
        private final List<FieldSpec> head = new ArrayList<>();
        private final List<FieldSpec> officer = new ArrayList<>();

        private Builder(int totalWidth) {
            this.totalWidth = totalWidth;
        }

        public Builder field(String name, int width) {
            head.add(FieldSpec.of(name, width));
            return this;
        }

        public Builder officerField(String name, int width) {
            officer.add(FieldSpec.of(name, width));
            return this;
        }

        public Builder maxOfficers(int maxOfficers) {
            this.maxOfficers = maxOfficers;
            return this;
        }

        public FieldLayout build() {
            return new FieldLayout(totalWidth, maxOfficers, head, officer);
        }
    }
}
