package com.e2eq.obo.parser;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One content line, {@code tag: value ! comment}.
 *
 * @param comment trailing comment text, or null when the line has none
 */
public record TagValue(String tag, String value, String comment) {

    private static final Pattern TAG = Pattern.compile("[A-Za-z0-9_\\-]+");

    /**
     * Splits a line into tag, value and comment. A {@code !} starts the comment unless it is
     * escaped with a backslash or sits inside a double-quoted string. Returns empty when the
     * line has no tag.
     */
    public static Optional<TagValue> parse(String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) return Optional.empty();
        String tag = line.substring(0, colon).strip();
        if (!TAG.matcher(tag).matches()) return Optional.empty();

        String rest = line.substring(colon + 1);
        int bang = commentStart(rest);
        if (bang < 0) {
            return Optional.of(new TagValue(tag, unescape(rest.strip()), null));
        }
        return Optional.of(new TagValue(tag, unescape(rest.substring(0, bang).strip()), rest.substring(bang + 1).strip()));
    }

    private static String unescape(String value) {
        return value.replace("\\!", "!");
    }

    /**
     * Escapes {@code !} so a free-text value is not cut short at the comment marker.
     */
    public static String escape(String value) {
        return value.replace("!", "\\!");
    }

    private static int commentStart(String s) {
        boolean quoted = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '"') {
                quoted = !quoted;
            } else if (c == '!' && !quoted) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The value without a trailing {@code {...}} qualifier block.
     */
    public String unqualifiedValue() {
        String v = value;
        if (v.endsWith("}")) {
            int open = v.lastIndexOf('{');
            if (open >= 0) v = v.substring(0, open).strip();
        }
        return v;
    }

    /**
     * The first whitespace-delimited token of the unqualified value, or an empty string.
     */
    public String firstToken() {
        String v = unqualifiedValue();
        if (v.isEmpty()) return v;
        return v.split("\\s+", 2)[0];
    }
}
