package com.e2eq.obo.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Maps the {@code obo.*} configuration properties.
 */
@ConfigMapping(prefix = "obo")
public interface OboConfig {

    Parser parser();

    Loader loader();

    interface Parser {
        /**
         * Namespace given to terms when neither the term nor the file header names one.
         * @return the fallback namespace
         */
        Optional<String> defaultNamespace();

        /**
         * Fail on malformed lines instead of recording them as diagnostics.
         * @return the strict flag
         */
        @WithDefault("false")
        boolean strict();

        /**
         * Keep tags the model has no field for as term annotations.
         * @return the keep flag
         */
        @WithDefault("true")
        boolean keepUnknownTags();
    }

    interface Loader {
        /**
         * Follow {@code import:} header entries naming local files.
         * @return the import flag
         */
        @WithDefault("true")
        boolean resolveImports();

        /**
         * How many levels of imports to follow; -1 for no limit.
         * @return the import depth
         */
        @WithDefault("-1")
        int importDepth();
    }
}
