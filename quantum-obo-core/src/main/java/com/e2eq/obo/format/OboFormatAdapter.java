package com.e2eq.obo.format;

import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.RawEntitySet;
import com.e2eq.obo.parser.ParserSettings;
import com.e2eq.obo.parser.StanzaParser;
import com.e2eq.obo.spi.FormatAdapter;
import com.e2eq.obo.spi.LineSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * The stanza text format ({@code .obo}).
 */
public final class OboFormatAdapter implements FormatAdapter {

    private final StanzaParser parser;
    private final OboSerializer serializer = new OboSerializer();

    public OboFormatAdapter() {
        this(ParserSettings.defaults());
    }

    public OboFormatAdapter(ParserSettings settings) {
        this.parser = new StanzaParser(settings);
    }

    @Override
    public String name() { return "obo"; }

    @Override
    public Set<String> fileExtensions() { return Set.of("obo"); }

    @Override
    public RawEntitySet parse(InputStream in) throws IOException {
        return parser.parse(LineSource.of(in));
    }

    public RawEntitySet parse(LineSource source) throws IOException {
        return parser.parse(source);
    }

    @Override
    public byte[] serialize(Ontology ontology) {
        return serializer.serialize(ontology).getBytes(StandardCharsets.UTF_8);
    }
}
