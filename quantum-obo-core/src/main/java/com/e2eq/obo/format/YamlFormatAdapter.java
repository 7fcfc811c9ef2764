package com.e2eq.obo.format;

import com.e2eq.obo.core.*;
import com.e2eq.obo.exceptions.OboParseException;
import com.e2eq.obo.spi.FormatAdapter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Reads and writes ontologies as YAML documents with {@code header}, {@code typedefs} and
 * {@code terms} sections. Produces the same raw entity shape as the stanza format.
 */
public final class YamlFormatAdapter implements FormatAdapter {

    // DTOs mirroring YAML
    public record YOntology(Map<String, List<String>> header, String defaultNamespace,
                            List<YTypedef> typedefs, List<YTerm> terms) {}
    public record YTypedef(String id, String name, String def, List<String> defXrefs, String inverseOf,
                           Boolean obsolete, Map<String, List<String>> annotations) {}
    public record YTerm(String id, String name, String namespace, String def, List<String> defXrefs,
                        @JsonProperty("isA") List<String> isA, Map<String, List<String>> relationships, Boolean obsolete,
                        Map<String, List<String>> annotations) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            .setSerializationInclusion(JsonInclude.Include.NON_EMPTY);

    @Override
    public String name() { return "yaml"; }

    @Override
    public Set<String> fileExtensions() { return Set.of("yaml", "yml"); }

    @Override
    public RawEntitySet parse(InputStream in) throws IOException {
        return toRaw(mapper.readValue(in, YOntology.class));
    }

    @Override
    public byte[] serialize(Ontology ontology) {
        try {
            return mapper.writeValueAsBytes(toYaml(ontology));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write ontology as YAML", e);
        }
    }

    private RawEntitySet toRaw(YOntology y) {
        OntologyHeader header = new OntologyHeader(present(y.header()));
        String namespace = y.defaultNamespace() != null ? y.defaultNamespace() : header.defaultNamespace().orElse("");

        List<Typedef> typedefs = new ArrayList<>();
        int index = 0;
        for (YTypedef t : Optional.ofNullable(y.typedefs()).orElse(List.of())) {
            index++;
            requireId(t.id(), "typedef", index);
            typedefs.add(new Typedef(t.id(), t.name(), definition(t.def(), t.defXrefs()),
                    Optional.ofNullable(t.inverseOf()), Boolean.TRUE.equals(t.obsolete()), present(t.annotations())));
        }

        List<Term> terms = new ArrayList<>();
        index = 0;
        for (YTerm t : Optional.ofNullable(y.terms()).orElse(List.of())) {
            index++;
            requireId(t.id(), "term", index);
            Map<String, Set<String>> rels = new LinkedHashMap<>();
            Optional.ofNullable(t.relationships()).orElse(Map.of())
                    .forEach((rel, targets) -> rels.put(rel, new LinkedHashSet<>(present(targets))));
            terms.add(new Term(t.id(), t.name(), t.namespace() != null ? t.namespace() : namespace,
                    definition(t.def(), t.defXrefs()),
                    new LinkedHashSet<>(present(t.isA())),
                    rels, Boolean.TRUE.equals(t.obsolete()), present(t.annotations())));
        }
        return new RawEntitySet(header, namespace, typedefs, terms, List.of());
    }

    private static void requireId(String id, String kind, int index) {
        if (id == null || id.isBlank()) {
            // YAML entries carry no line numbers once mapped; 0 marks an unknown line
            throw new OboParseException(kind + " #" + index + " is missing the required 'id'", 0);
        }
    }

    private static Optional<Definition> definition(String text, List<String> xrefs) {
        return text == null ? Optional.empty() : Optional.of(new Definition(text, present(xrefs)));
    }

    private static Map<String, List<String>> present(Map<String, List<String>> values) {
        if (values == null) return Map.of();
        Map<String, List<String>> result = new LinkedHashMap<>();
        values.forEach((key, v) -> result.put(key, present(v)));
        return result;
    }

    // YAML leaves a key with no value, or an empty list item, as null
    private static List<String> present(List<String> values) {
        if (values == null) return List.of();
        List<String> result = new ArrayList<>(values.size());
        for (String v : values) {
            if (v != null && !v.isBlank()) result.add(v);
        }
        return result;
    }

    private YOntology toYaml(Ontology ontology) {
        List<YTypedef> typedefs = new ArrayList<>();
        for (Typedef t : ontology.typedefs()) {
            typedefs.add(new YTypedef(t.id(), t.name(),
                    t.definition().map(Definition::text).orElse(null),
                    t.definition().map(Definition::xrefs).orElse(null),
                    t.inverseOf().orElse(null),
                    t.obsolete() ? Boolean.TRUE : null,
                    t.annotations()));
        }
        List<YTerm> terms = new ArrayList<>();
        for (Term t : ontology.terms()) {
            Map<String, List<String>> rels = new LinkedHashMap<>();
            t.relationships().forEach((rel, targets) -> rels.put(rel, new ArrayList<>(targets)));
            terms.add(new YTerm(t.id(), t.name(),
                    t.namespace().equals(ontology.defaultNamespace()) ? null : t.namespace(),
                    t.definition().map(Definition::text).orElse(null),
                    t.definition().map(Definition::xrefs).orElse(null),
                    new ArrayList<>(t.isA()), rels,
                    t.obsolete() ? Boolean.TRUE : null,
                    t.annotations()));
        }
        return new YOntology(ontology.header().entries(), ontology.defaultNamespace(), typedefs, terms);
    }
}
