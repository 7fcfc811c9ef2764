package com.e2eq.obo.format;

import com.e2eq.obo.core.GraphBuilder;
import com.e2eq.obo.core.Ontology;
import com.e2eq.obo.core.OntologyHasher;
import com.e2eq.obo.core.OntologyMerger;
import com.e2eq.obo.parser.StanzaParser;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OboSerializerTest {

    private final OboSerializer serializer = new OboSerializer();

    private static Ontology parse(String text) {
        return GraphBuilder.build(new StanzaParser().parse(text));
    }

    private static final String SAMPLE = """
        format-version: 1.2
        default-namespace: test

        [Term]
        id: T:2
        name: Hey\\! branch
        def: "A branch." [REF:1]
        is_a: T:1 ! stale comment
        relationship: part_of T:1
        relationship: part_of T:9

        [Typedef]
        id: part_of
        name: part of
        inverse_of: has_part

        [Typedef]
        id: has_part
        name: has part

        [Term]
        id: T:1
        name: root
        """;

    @Test
    void testCanonicalOutput() {
        String expected = """
            format-version: 1.2
            default-namespace: test

            [Typedef]
            id: part_of
            name: part of
            inverse_of: has_part ! has part

            [Typedef]
            id: has_part
            name: has part
            inverse_of: part_of ! part of

            [Term]
            id: T:2
            name: Hey\\! branch
            namespace: test
            def: "A branch." [REF:1]
            is_a: T:1 ! root
            relationship: part_of T:1 ! root
            relationship: part_of T:9

            [Term]
            id: T:1
            name: root
            namespace: test
            """;

        assertEquals(expected, serializer.serialize(parse(SAMPLE)));
    }

    @Test
    void testRoundTripPreservesGraph() {
        Ontology original = parse(SAMPLE);

        String text = serializer.serialize(original);
        Ontology reparsed = parse(text);

        assertEquals(OntologyHasher.computeHash(original), OntologyHasher.computeHash(reparsed));
        assertEquals("Hey! branch", reparsed.term("T:2").name());
        assertEquals(Set.of("T:1", "T:9"), reparsed.term("T:2").targets("part_of"));
        assertEquals(original.unresolvedReferences(), reparsed.unresolvedReferences());
        assertEquals(text, serializer.serialize(reparsed));
    }

    @Test
    void testRoundTripOfSampleFile() throws IOException {
        Ontology original = new OntologyLoader().loadFromClasspath("/obo/literature.obo");

        String text = serializer.serialize(original);
        Ontology reparsed = parse(text);

        assertEquals(OntologyHasher.computeHash(original), OntologyHasher.computeHash(reparsed));
        assertEquals(original.term("LIT:0000003").annotations(), reparsed.term("LIT:0000003").annotations());
        assertEquals(original.term("LIT:0000003").definition(), reparsed.term("LIT:0000003").definition());
        assertEquals(text, serializer.serialize(reparsed));
    }

    @Test
    void testQuotedNamesWithBangRoundTrip() {
        Ontology original = parse("""
            [Term]
            id: Q
            name: "Hi" there \\! yes
            def: "Stop! Go." [REF:1]
            synonym: "Hey! you" EXACT []
            """);
        assertEquals("\"Hi\" there ! yes", original.term("Q").name());

        String text = serializer.serialize(original);
        Ontology reparsed = parse(text);

        assertTrue(text.contains("name: \"Hi\" there \\! yes\n"));
        assertEquals(original.term("Q").name(), reparsed.term("Q").name());
        assertEquals("Stop! Go.", reparsed.term("Q").definition().orElseThrow().text());
        assertEquals(original.term("Q").annotations(), reparsed.term("Q").annotations());
        assertEquals(OntologyHasher.computeHash(original), OntologyHasher.computeHash(reparsed));
    }

    @Test
    void testCommentsFollowRenamedTerms() {
        Ontology o = parse("""
            [Term]
            id: A
            name: old name

            [Term]
            id: B
            is_a: A ! old name
            """);
        Ontology renamed = OntologyMerger.merge(parse("[Term]\nid: A\nname: new name\n"), o);

        String text = serializer.serialize(renamed);

        assertTrue(text.contains("is_a: A ! new name\n"));
        assertFalse(text.contains("old name"));
    }

    @Test
    void testObsoleteAndEmptyOntology() throws IOException {
        Ontology o = parse("[Term]\nid: X\nis_obsolete: true\n");

        StringWriter out = new StringWriter();
        serializer.write(o, out);

        assertEquals("\n[Term]\nid: X\nis_obsolete: true\n", out.toString());
        assertEquals("", serializer.serialize(parse("")));
    }
}
