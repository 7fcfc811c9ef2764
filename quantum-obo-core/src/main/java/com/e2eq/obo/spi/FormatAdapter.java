package com.e2eq.obo.spi;

import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.RawEntitySet;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;

/**
 * One supported ontology text format. Every adapter parses into the same {@link RawEntitySet}
 * shape, so validation, traversal and merging never depend on the source format.
 */
public interface FormatAdapter {

    /** Short format name, e.g. {@code obo}. */
    String name();

    /** Lower-case file extensions, without the dot, this adapter handles. */
    Set<String> fileExtensions();

    RawEntitySet parse(InputStream in) throws IOException;

    byte[] serialize(Ontology ontology);

    default boolean handles(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        return fileExtensions().stream().anyMatch(ext -> lower.endsWith("." + ext));
    }
}
