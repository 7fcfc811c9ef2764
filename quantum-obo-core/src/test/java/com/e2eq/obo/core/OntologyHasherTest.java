package com.e2eq.obo.core;

import com.e2eq.obo.parser.StanzaParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OntologyHasherTest {

    private static Ontology parse(String text) {
        return GraphBuilder.build(new StanzaParser().parse(text));
    }

    private static final String SAMPLE = """
        [Typedef]
        id: part_of
        inverse_of: has_part

        [Typedef]
        id: has_part

        [Term]
        id: A
        name: alpha

        [Term]
        id: B
        name: beta
        is_a: A
        relationship: part_of A
        """;

    @Test
    void testHashStability() {
        Ontology o = parse(SAMPLE);

        String hash1 = OntologyHasher.computeHash(o);
        String hash2 = OntologyHasher.computeHash(o);

        assertEquals(hash1, hash2, "Hash should be stable for same ontology");
        assertEquals(64, hash1.length());
    }

    @Test
    void testHashDifferentForDifferentEdges() {
        Ontology o1 = parse(SAMPLE);
        Ontology o2 = parse(SAMPLE.replace("relationship: part_of A", ""));

        assertNotEquals(OntologyHasher.computeHash(o1), OntologyHasher.computeHash(o2),
            "Different edges should give different hashes");
    }

    @Test
    void testHashIndependentOfStanzaOrderAndComments() {
        Ontology o1 = parse(SAMPLE);
        Ontology o2 = parse("""
            [Term]
            id: B
            name: beta
            relationship: part_of A ! some comment
            is_a: A ! alpha

            [Term]
            id: A
            name: alpha

            [Typedef]
            id: has_part
            inverse_of: part_of

            [Typedef]
            id: part_of
            """);

        assertEquals(OntologyHasher.computeHash(o1), OntologyHasher.computeHash(o2),
            "Hash should be independent of stanza order, tag order and comments");
    }

    @Test
    void testHashIncludesInversePairing() {
        Ontology paired = parse(SAMPLE);
        Ontology unpaired = parse(SAMPLE.replace("inverse_of: has_part", ""));

        assertNotEquals(OntologyHasher.computeHash(paired), OntologyHasher.computeHash(unpaired));
    }

    @Test
    void testHashIgnoresDefinitions() {
        Ontology plain = parse(SAMPLE);
        Ontology defined = parse(SAMPLE.replace("name: alpha", "name: alpha\ndef: \"The first.\" []"));

        assertEquals(OntologyHasher.computeHash(plain), OntologyHasher.computeHash(defined));
    }
}
