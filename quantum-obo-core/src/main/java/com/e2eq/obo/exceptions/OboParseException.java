package com.e2eq.obo.exceptions;

/**
 * Thrown when stanza text cannot be turned into a raw entity set, e.g. a stanza without an
 * {@code id} tag. The whole parse is aborted; no partial result is returned.
 */
public class OboParseException extends OboException {
    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String stanzaType;

    public OboParseException(String message, int lineNumber) {
        this(message, lineNumber, null);
    }

    public OboParseException(String message, int lineNumber, String stanzaType) {
        super(buildMessage(message, lineNumber, stanzaType));
        this.lineNumber = lineNumber;
        this.stanzaType = stanzaType;
    }

    private static String buildMessage(String message, int lineNumber, String stanzaType) {
        if (stanzaType == null) {
            return String.format("Line %d: %s", lineNumber, message);
        }
        return String.format("Line %d: %s (in [%s] stanza)", lineNumber, message, stanzaType);
    }

    /**
     * The 1-based line number the failure was reported for. For a stanza-level failure this is
     * the line of the stanza's bracketed header.
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * The stanza type ({@code Term}, {@code Typedef}) being parsed, or null for header lines.
     */
    public String getStanzaType() {
        return stanzaType;
    }
}
