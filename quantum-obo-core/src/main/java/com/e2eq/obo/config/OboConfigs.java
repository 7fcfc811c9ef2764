package com.e2eq.obo.config;

import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

/**
 * Builds {@link OboConfig} outside of a container, from system properties, environment variables
 * and {@code META-INF/microprofile-config.properties}.
 */
public final class OboConfigs {
    private OboConfigs() {}

    public static OboConfig load() {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .withMapping(OboConfig.class)
                .build();
        return config.getConfigMapping(OboConfig.class);
    }
}
