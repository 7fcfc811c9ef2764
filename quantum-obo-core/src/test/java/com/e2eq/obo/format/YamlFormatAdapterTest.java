package com.e2eq.obo.format;

import com.e2eq.obo.core.*;
import com.e2eq.obo.exceptions.OboParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the sample literature ontology from YAML and checks it builds the same graph shape as
 * the stanza format.
 */
class YamlFormatAdapterTest {

    private final YamlFormatAdapter adapter = new YamlFormatAdapter();

    private Ontology loadResource(String resourcePath) throws Exception {
        try (InputStream in = YamlFormatAdapterTest.class.getResourceAsStream(resourcePath)) {
            assertNotNull(in, "Test ontology YAML not found at " + resourcePath);
            return GraphBuilder.build(adapter.parse(in));
        }
    }

    @Test
    void testLoadYamlAndTraverse() throws Exception {
        Ontology o = loadResource("/obo/literature.yaml");

        assertEquals(4, o.size());
        assertEquals("literature", o.defaultNamespace());
        assertEquals(Optional.of("1.2"), o.header().formatVersion());
        assertTrue(o.unresolvedReferences().isEmpty());

        Term hamlet = o.term("LIT:0000003");
        assertEquals("literature", hamlet.namespace());
        assertEquals(List.of("ISBN:0140714545"), hamlet.definition().orElseThrow().xrefs());
        assertEquals(Set.of("LIT:0000002", "LIT:0000001"),
            o.ancestors("LIT:0000003").stream().map(Term::id).collect(Collectors.toSet()));
        assertEquals(Set.of("LIT:0000003"),
            o.related("LIT:0000005", "has_written").stream().map(Term::id).collect(Collectors.toSet()));
        assertEquals(Optional.of("has_written"), o.inverseOf("written_by"));
    }

    @Test
    void testStanzaToYamlToStanzaKeepsGraph() throws Exception {
        OntologyLoader loader = new OntologyLoader();
        Ontology fromObo = loader.loadFromClasspath("/obo/literature.obo");

        byte[] yaml = adapter.serialize(fromObo);
        Ontology fromYaml = GraphBuilder.build(adapter.parse(new ByteArrayInputStream(yaml)));

        assertEquals(OntologyHasher.computeHash(fromObo), OntologyHasher.computeHash(fromYaml));
        assertEquals(fromObo.term("LIT:0000003").annotations(), fromYaml.term("LIT:0000003").annotations());
        assertEquals(new OboSerializer().serialize(fromObo), new OboSerializer().serialize(fromYaml));
    }

    @Test
    void testMissingIdFails() {
        String yaml = """
            terms:
              - id: A
              - name: nameless
            """;

        OboParseException ex = assertThrows(OboParseException.class,
            () -> adapter.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
        assertTrue(ex.getMessage().contains("term #2"));
        assertEquals(0, ex.getLineNumber());
    }

    @Test
    void testEmptyValuesAreTreatedAsAbsent() throws Exception {
        String yaml = """
            header:
              remark:
            terms:
              - id: A
              - id: B
                def: Bare.
                defXrefs: [ ~ ]
                isA: [ A, ~ ]
                relationships:
                  part_of:
                annotations:
                  synonym: [ ~ ]
            """;

        RawEntitySet raw = adapter.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        Term b = raw.terms().get(1);

        assertEquals(Set.of("A"), b.isA());
        assertTrue(b.relationships().isEmpty());
        assertTrue(b.annotations().isEmpty());
        assertEquals(List.of(), b.definition().orElseThrow().xrefs());
        assertTrue(raw.header().remarks().isEmpty());
        assertTrue(GraphBuilder.build(raw).unresolvedReferences().isEmpty());
    }

    @Test
    void testHandlesExtensions() {
        assertTrue(adapter.handles("sample.yaml"));
        assertTrue(adapter.handles("SAMPLE.YML"));
        assertFalse(adapter.handles("sample.obo"));
    }
}
