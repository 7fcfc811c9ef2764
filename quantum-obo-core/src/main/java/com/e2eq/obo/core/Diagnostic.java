package com.e2eq.obo.core;

/**
 * A non-fatal issue found while parsing, building, merging or loading an ontology.
 *
 * @param line    1-based source line, or 0 when the issue has no line
 * @param subject the id, tag or line text the issue is about
 */
public record Diagnostic(Kind kind, int line, String subject, String message) {

    public enum Kind {
        MALFORMED_LINE,
        UNKNOWN_TAG,
        UNKNOWN_STANZA,
        DUPLICATE_ID,
        INVERSE_REPAIRED,
        NAME_CONFLICT,
        IMPORT_FAILED
    }

    public static Diagnostic of(Kind kind, String subject, String message) {
        return new Diagnostic(kind, 0, subject, message);
    }

    @Override
    public String toString() {
        return line > 0
                ? String.format("%s at line %d (%s): %s", kind, line, subject, message)
                : String.format("%s (%s): %s", kind, subject, message);
    }
}
