package com.e2eq.obo.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A textual definition with its supporting cross references, written in stanza text as
 * {@code def: "text" [XREF:1, XREF:2]}.
 */
public record Definition(String text, List<String> xrefs) {

    public Definition {
        Objects.requireNonNull(text, "text");
        xrefs = xrefs == null ? List.of() : List.copyOf(xrefs);
    }

    public static Definition of(String text) {
        return new Definition(text, List.of());
    }

    /**
     * Parses a {@code def} value. A value that does not start with a double quote is taken as
     * plain text without xrefs.
     */
    public static Definition parse(String raw) {
        String v = raw.strip();
        if (!v.startsWith("\"")) {
            return new Definition(v, List.of());
        }
        StringBuilder text = new StringBuilder();
        int i = 1;
        boolean closed = false;
        while (i < v.length()) {
            char c = v.charAt(i);
            if (c == '\\' && i + 1 < v.length()) {
                text.append(v.charAt(i + 1));
                i += 2;
                continue;
            }
            i++;
            if (c == '"') {
                closed = true;
                break;
            }
            text.append(c);
        }
        if (!closed) {
            return new Definition(v, List.of());
        }

        List<String> xrefs = new ArrayList<>();
        String rest = v.substring(i).strip();
        if (rest.startsWith("[")) {
            int end = rest.lastIndexOf(']');
            String inner = end < 0 ? rest.substring(1) : rest.substring(1, end);
            for (String xref : inner.split(",")) {
                if (!xref.isBlank()) xrefs.add(xref.strip());
            }
        }
        return new Definition(text.toString(), xrefs);
    }

    public String toOboValue() {
        String escaped = text.replace("\\", "\\\\").replace("\"", "\\\"");
        return "\"" + escaped + "\" [" + String.join(", ", xrefs) + "]";
    }
}
