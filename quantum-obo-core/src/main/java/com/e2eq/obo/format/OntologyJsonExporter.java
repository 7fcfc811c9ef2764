package com.e2eq.obo.format;

import com.e2eq.obo.core.Definition;
import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.Term;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exports the terms of an ontology as a JSON object keyed by term id, for tooling that does not
 * read stanza text. Header metadata is not exported and there is no importer.
 */
public final class OntologyJsonExporter {

    private final ObjectMapper mapper = new ObjectMapper();

    public ObjectNode toTree(Ontology ontology) {
        ObjectNode root = mapper.createObjectNode();
        for (Term t : ontology.terms()) {
            ObjectNode node = root.putObject(t.id());
            node.put("id", t.id());
            node.put("name", t.name());
            node.put("namespace", t.namespace());
            if (t.definition().isPresent()) {
                Definition def = t.definition().get();
                node.put("def", def.text());
                strings(node.putArray("xrefs"), def.xrefs());
            }
            node.put("obsolete", t.obsolete());
            strings(node.putArray("is_a"), t.isA());
            ObjectNode rels = node.putObject("relationships");
            for (Map.Entry<String, Set<String>> e : t.relationships().entrySet()) {
                strings(rels.putArray(e.getKey()), e.getValue());
            }
            ObjectNode annotations = node.putObject("annotations");
            for (Map.Entry<String, List<String>> e : t.annotations().entrySet()) {
                strings(annotations.putArray(e.getKey()), e.getValue());
            }
        }
        return root;
    }

    public String toJson(Ontology ontology, boolean pretty) {
        try {
            ObjectNode tree = toTree(ontology);
            return pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tree)
                    : mapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to export ontology as JSON", e);
        }
    }

    public void write(Ontology ontology, OutputStream out) throws IOException {
        mapper.writeValue(out, toTree(ontology));
    }

    private static void strings(ArrayNode array, Iterable<String> values) {
        for (String v : values) array.add(v);
    }
}
