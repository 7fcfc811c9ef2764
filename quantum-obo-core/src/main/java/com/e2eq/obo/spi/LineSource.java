package com.e2eq.obo.spi;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Supplies the text lines a parser consumes. Implementations decide where the text comes from;
 * the caller closes the returned reader.
 */
@FunctionalInterface
public interface LineSource {
    BufferedReader open() throws IOException;

    static LineSource of(String text) {
        return () -> new BufferedReader(new StringReader(text));
    }

    static LineSource of(Path path) {
        return () -> Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    static LineSource of(InputStream in) {
        return () -> new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
