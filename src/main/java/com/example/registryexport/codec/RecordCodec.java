package com.example.registryexport.codec;

import com.example.registryexport.layout.FieldLayout;
import com.example.registryexport.layout.FieldSpec;
import com.example.registryexport.layout.LayoutException;
import com.example.registryexport.model.Address;
import com.example.registryexport.model.Entity;
import com.example.registryexport.model.EntityStatus;
import com.example.registryexport.model.Officer;
import com.example.registryexport.model.Party;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.registryexport.layout.RecordFields.*;

/**
 * Maps one fixed-width line to an {@link Entity} and back, driven entirely by
 * a {@link FieldLayout}. Every column is read and written by the same generic
 * slice/pad routine; the only per-field code is the binding between dotted
 * column names and entity properties.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
@Slf4j
public class RecordCodec {

    public static final String DEFAULT_DATE_PATTERN = "yyyyMMdd";

    private static final Set<String> HEAD_NAMES = new HashSet<>();
    private static final Set<String> OFFICER_NAMES = new HashSet<>();

    static {
        HEAD_NAMES.addAll(Arrays.asList(DOCUMENT_NUMBER, NAME, STATUS, ENTITY_TYPE, FILE_DATE));
        for (String block : new String[]{PRINCIPAL_ADDRESS, MAILING_ADDRESS}) {
            for (String member : addressMembers()) {
                HEAD_NAMES.add(path(block, member));
            }
        }
        for (String party : new String[]{REGISTERED_AGENT, PROPERTY_MANAGER}) {
            HEAD_NAMES.add(path(party, NAME));
            HEAD_NAMES.add(path(party, TYPE));
            for (String member : addressMembers()) {
                HEAD_NAMES.add(path(party, ADDRESS, member));
            }
        }
        OFFICER_NAMES.addAll(Arrays.asList(TITLE, TYPE, NAME));
        for (String member : addressMembers()) {
            OFFICER_NAMES.add(path(ADDRESS, member));
        }
    }

    private final FieldLayout layout;
    private final DateTimeFormatter dateFormat;

    public RecordCodec(FieldLayout layout) {
        this(layout, DEFAULT_DATE_PATTERN);
    }

    public RecordCodec(FieldLayout layout, String datePattern) {
        this.layout = layout;
        this.dateFormat = strictDateFormat(datePattern);
        for (FieldSpec field : layout.headFields()) {
            if (!isFiller(field.getName()) && !HEAD_NAMES.contains(field.getName())) {
                throw new LayoutException("unknown head field '" + field.getName() + "'");
            }
        }
        for (FieldSpec field : layout.officerFields()) {
            if (!isFiller(field.getName()) && !OFFICER_NAMES.contains(field.getName())) {
                throw new LayoutException("unknown officer field '" + field.getName() + "'");
            }
        }
        if (layout.maxOfficers() > 0 && !layout.hasOfficerField(TITLE)) {
            throw new LayoutException("officer stride needs a '" + TITLE + "' field to mark its end");
        }
    }

    public FieldLayout getLayout() {
        return layout;
    }

    /**
     * Formatter for {@code pattern} that rejects dates which do not exist
     * ({@code 20210231}) instead of moving them to the end of the month.
     * Year-of-era letters become proleptic year so strict resolution works
     * without an era field.
     */
    public static DateTimeFormatter strictDateFormat(String pattern) {
        StringBuilder converted = new StringBuilder(pattern.length());
        boolean quoted = false;
        for (char c : pattern.toCharArray()) {
            if (c == '\'') {
                quoted = !quoted;
            }
            converted.append(!quoted && c == 'y' ? 'u' : c);
        }
        return DateTimeFormatter.ofPattern(converted.toString()).withResolverStyle(ResolverStyle.STRICT);
    }

    // ------------------------------------------------------------------
    // decode
    // ------------------------------------------------------------------

    /**
     * Decodes one record. The line must not carry its line separator.
     *
     * @throws RecordFormatException if the length differs from the layout width
     *                               or the date column does not parse
     */
    public Entity decode(String line) {
        if (line.length() != layout.totalWidth()) {
            throw RecordFormatException.lengthMismatch(layout.totalWidth(), line.length());
        }
        Map<String, String> head = new HashMap<>();
        int pos = 0;
        for (FieldSpec field : layout.headFields()) {
            if (!isFiller(field.getName())) {
                head.put(field.getName(), slice(line, pos, field.getWidth()));
            }
            pos += field.getWidth();
        }

        Entity.EntityBuilder entity = Entity.builder()
                .documentNumber(emptyToNull(head.get(DOCUMENT_NUMBER)))
                .name(value(head, NAME))
                .status(EntityStatus.fromCode(value(head, STATUS)))
                .entityType(value(head, ENTITY_TYPE))
                .principalAddress(address(head, PRINCIPAL_ADDRESS + "."))
                .mailingAddress(address(head, MAILING_ADDRESS + "."))
                .fileDate(parseDate(value(head, FILE_DATE)))
                .registeredAgent(party(head, REGISTERED_AGENT + "."))
                .propertyManager(party(head, PROPERTY_MANAGER + "."));

        for (int i = 0; i < layout.maxOfficers(); i++) {
            int start = layout.officerOffset(i);
            Map<String, String> stride = new HashMap<>();
            for (FieldSpec field : layout.officerFields()) {
                if (!isFiller(field.getName())) {
                    stride.put(field.getName(),
                            slice(line, start + layout.officerFieldOffset(field.getName()), field.getWidth()));
                }
            }
            // officers are never sparse: the first blank title closes the list
            if (value(stride, TITLE).trim().isEmpty()) {
                break;
            }
            entity.officer(Officer.builder()
                    .titleCode(value(stride, TITLE))
                    .type(value(stride, TYPE))
                    .name(value(stride, NAME))
                    .address(address(stride, ADDRESS + "."))
                    .build());
        }
        return entity.build();
    }

    private static String slice(String line, int offset, int width) {
        int end = offset + width;
        while (end > offset && line.charAt(end - 1) == ' ') {
            end--;
        }
        return line.substring(offset, end);
    }

    private static String value(Map<String, String> values, String key) {
        String v = values.get(key);
        return v == null ? "" : v;
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private static Address address(Map<String, String> values, String prefix) {
        return Address.builder()
                .line1(value(values, prefix + LINE1))
                .line2(value(values, prefix + LINE2))
                .city(value(values, prefix + CITY))
                .state(value(values, prefix + STATE))
                .postalCode(value(values, prefix + POSTAL_CODE))
                .country(value(values, prefix + COUNTRY))
                .build();
    }

    private static Party party(Map<String, String> values, String prefix) {
        return Party.builder()
                .name(value(values, prefix + NAME))
                .type(value(values, prefix + TYPE))
                .address(address(values, prefix + ADDRESS + "."))
                .build();
    }

    private LocalDate parseDate(String text) {
        if (text.trim().isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(text, dateFormat);
        } catch (DateTimeParseException e) {
            throw new RecordFormatException(RecordFormatException.Reason.INVALID_FIELD,
                    "field '" + FILE_DATE + "' is not a date: '" + text + "'", e);
        }
    }

    // ------------------------------------------------------------------
    // encode
    // ------------------------------------------------------------------

    /**
     * Encodes an entity into exactly {@link FieldLayout#totalWidth()} columns.
     * Longer values are cut at their column width; shorter ones are padded
     * with spaces. Never fails on content.
     */
    public String encode(Entity entity) {
        char[] record = new char[layout.totalWidth()];
        Arrays.fill(record, ' ');

        Map<String, String> head = new HashMap<>();
        head.put(DOCUMENT_NUMBER, entity.getDocumentNumber());
        head.put(NAME, entity.getName());
        head.put(STATUS, entity.getStatus() == null ? "" : entity.getStatus().getCode());
        head.put(ENTITY_TYPE, entity.getEntityType());
        head.put(FILE_DATE, entity.getFileDate() == null ? "" : entity.getFileDate().format(dateFormat));
        putAddress(head, PRINCIPAL_ADDRESS + ".", entity.getPrincipalAddress());
        putAddress(head, MAILING_ADDRESS + ".", entity.getMailingAddress());
        putParty(head, REGISTERED_AGENT + ".", entity.getRegisteredAgent());
        putParty(head, PROPERTY_MANAGER + ".", entity.getPropertyManager());

        int pos = 0;
        for (FieldSpec field : layout.headFields()) {
            if (!isFiller(field.getName())) {
                write(record, pos, field.getWidth(), head.get(field.getName()));
            }
            pos += field.getWidth();
        }

        List<Officer> officers = entity.getOfficers();
        if (officers.size() > layout.maxOfficers()) {
            log.debug("Entity {} has {} officers, keeping the first {}",
                    entity.getDocumentNumber(), officers.size(), layout.maxOfficers());
            officers = officers.subList(0, layout.maxOfficers());
        }
        for (int i = 0; i < officers.size(); i++) {
            Officer officer = officers.get(i);
            if (officer.getTitleCode() == null || officer.getTitleCode().trim().isEmpty()) {
                // a blank title ends the officer list on decode, so nothing after it can be kept
                log.debug("Entity {} has an officer without a title at position {}, dropping it and {} more",
                        entity.getDocumentNumber(), i, officers.size() - i - 1);
                break;
            }
            Map<String, String> stride = new HashMap<>();
            stride.put(TITLE, officer.getTitleCode());
            stride.put(TYPE, officer.getType());
            stride.put(NAME, officer.getName());
            putAddress(stride, ADDRESS + ".", officer.getAddress());

            int start = layout.officerOffset(i);
            for (FieldSpec field : layout.officerFields()) {
                if (!isFiller(field.getName())) {
                    write(record, start + layout.officerFieldOffset(field.getName()), field.getWidth(),
                            stride.get(field.getName()));
                }
            }
        }
        // unused strides and trailing filler stay blank
        return new String(record);
    }

    private static void write(char[] record, int offset, int width, String value) {
        if (value == null) {
            return;
        }
        int n = Math.min(width, value.length());
        value.getChars(0, n, record, offset);
    }

    private static void putAddress(Map<String, String> values, String prefix, Address address) {
        if (address == null) {
            return;
        }
        values.put(prefix + LINE1, address.getLine1());
        values.put(prefix + LINE2, address.getLine2());
        values.put(prefix + CITY, address.getCity());
        values.put(prefix + STATE, address.getState());
        values.put(prefix + POSTAL_CODE, address.getPostalCode());
        values.put(prefix + COUNTRY, address.getCountry());
    }

    private static void putParty(Map<String, String> values, String prefix, Party party) {
        if (party == null) {
            return;
        }
        values.put(prefix + NAME, party.getName());
        values.put(prefix + TYPE, party.getType());
        putAddress(values, prefix + ADDRESS + ".", party.getAddress());
    }

    private static List<String> addressMembers() {
        return new ArrayList<>(Arrays.asList(LINE1, LINE2, CITY, STATE, POSTAL_CODE, COUNTRY));
    }
}
