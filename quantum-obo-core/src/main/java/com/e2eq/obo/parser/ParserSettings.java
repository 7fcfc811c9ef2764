package com.e2eq.obo.parser;

import com.e2eq.obo.config.OboConfig;

/**
 * Options threaded into a {@link StanzaParser}.
 *
 * @param defaultNamespace namespace for terms when neither the term nor the header names one
 * @param strict           raise on malformed lines instead of recording diagnostics
 * @param keepUnknownTags  keep unrecognized tags as annotations
 */
public record ParserSettings(String defaultNamespace, boolean strict, boolean keepUnknownTags) {

    public ParserSettings {
        defaultNamespace = defaultNamespace == null ? "" : defaultNamespace;
    }

    public static ParserSettings defaults() {
        return new ParserSettings("", false, true);
    }

    public static ParserSettings from(OboConfig.Parser config) {
        return new ParserSettings(config.defaultNamespace().orElse(""), config.strict(), config.keepUnknownTags());
    }

    public ParserSettings withDefaultNamespace(String namespace) {
        return new ParserSettings(namespace, strict, keepUnknownTags);
    }

    public ParserSettings withStrict(boolean strict) {
        return new ParserSettings(defaultNamespace, strict, keepUnknownTags);
    }
}
