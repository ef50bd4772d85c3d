package com.example.registryexport.matching;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Turns an entity name into the key used for matching: ASCII upper case,
 * whitespace runs collapsed to one space, corporate suffix tokens removed
 * from the end.
 *
 * <p>Suffixes are tried in the configured order and the first one that ends
 * the name is cut, then the list is tried again until none matches. List the
 * longer form of a token before the shorter one ({@code ", INC."} before
 * {@code " INC."} before {@code " INC"}), otherwise the shorter token leaves
 * punctuation behind. Stripping repeats until no suffix matches, so
 * {@code normalize(normalize(x))} equals {@code normalize(x)}.
 */
public class NameNormalizer {

    public static final List<String> DEFAULT_SUFFIXES = Collections.unmodifiableList(Arrays.asList(
            ", INCORPORATED", " INCORPORATED",
            ", INC.", ", INC", " INC.", " INC",
            ", L.L.C.", " L.L.C.", ", LLC", " LLC",
            ", CORPORATION", " CORPORATION",
            ", CORP.", ", CORP", " CORP.", " CORP",
            ", LTD.", ", LTD", " LTD.", " LTD",
            ", CO.", " CO."
    ));

    private final List<String> suffixes;

    public NameNormalizer() {
        this(DEFAULT_SUFFIXES);
    }

    public NameNormalizer(List<String> suffixes) {
        List<String> upper = new ArrayList<>(suffixes.size());
        for (String suffix : suffixes) {
            if (suffix == null || suffix.trim().isEmpty()) {
                throw new IllegalArgumentException("blank suffix token in " + suffixes);
            }
            upper.add(upperAscii(suffix));
        }
        this.suffixes = Collections.unmodifiableList(upper);
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    public String normalize(String name) {
        if (name == null) {
            return "";
        }
        String key = collapse(upperAscii(name));
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (String suffix : suffixes) {
                if (key.length() > suffix.length() && key.endsWith(suffix)) {
                    key = collapse(key.substring(0, key.length() - suffix.length()));
                    stripped = true;
                    break;
                }
            }
        }
        return key;
    }

    // registry names are ASCII; anything else passes through untouched
    static String upperAscii(String s) {
        char[] chars = s.toCharArray();
        for (int i = 0; i < chars.length; i++) {
            char c = chars[i];
            if (c >= 'a' && c <= 'z') {
                chars[i] = (char) (c - ('a' - 'A'));
            }
        }
        return new String(chars);
    }

    private static String collapse(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
            } else {
                if (pendingSpace) {
                    sb.append(' ');
                    pendingSpace = false;
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
