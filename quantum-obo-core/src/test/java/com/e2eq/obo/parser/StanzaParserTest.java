package com.e2eq.obo.parser;

import com.e2eq.obo.core.Definition;
import com.e2eq.obo.core.Diagnostic;
import com.e2eq.obo.core.RawEntitySet;
import com.e2eq.obo.core.Term;
import com.e2eq.obo.core.Typedef;
import com.e2eq.obo.exceptions.OboParseException;
import com.e2eq.obo.spi.LineSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StanzaParserTest {

    private final StanzaParser parser = new StanzaParser();

    private static List<Diagnostic> ofKind(RawEntitySet raw, Diagnostic.Kind kind) {
        return raw.diagnostics().stream().filter(d -> d.kind() == kind).collect(Collectors.toList());
    }

    @Test
    void testHeaderAndNamespaces() {
        RawEntitySet raw = parser.parse("""
            format-version: 1.2
            default-namespace: animals
            remark: first
            remark: second

            [Term]
            id: A:1
            name: animal

            [Term]
            id: A:2
            name: rock
            namespace: minerals
            """);

        assertEquals(Optional.of("1.2"), raw.header().formatVersion());
        assertEquals(List.of("first", "second"), raw.header().remarks());
        assertEquals("animals", raw.defaultNamespace());
        assertEquals("animals", raw.terms().get(0).namespace());
        assertEquals("minerals", raw.terms().get(1).namespace());
        assertTrue(raw.diagnostics().isEmpty());
    }

    @Test
    void testSettingsNamespaceAppliesWithoutHeader() {
        StanzaParser p = new StanzaParser(ParserSettings.defaults().withDefaultNamespace("fallback"));

        RawEntitySet raw = p.parse("[Term]\nid: X:1\n");

        assertEquals("fallback", raw.defaultNamespace());
        assertEquals("fallback", raw.terms().get(0).namespace());
    }

    @Test
    void testForwardReferencesAreKeptAsIds() {
        RawEntitySet raw = parser.parse("""
            [Term]
            id: B
            is_a: A ! declared later
            relationship: part_of A

            [Term]
            id: A

            [Typedef]
            id: part_of
            """);

        Term b = raw.terms().get(0);
        assertEquals(Set.of("A"), b.isA());
        assertEquals(Set.of("A"), b.targets("part_of"));
        assertEquals(List.of("part_of"), raw.typedefs().stream().map(Typedef::id).collect(Collectors.toList()));
    }

    @Test
    void testDefinitionsAndCommentsInsideQuotes() {
        RawEntitySet raw = parser.parse("""
            [Term]
            id: X:1
            name: Oh\\! Calcutta
            def: "A revue! With \\"quotes\\"." [ISBN:123, PMID:9] ! trailing
            """);

        Term t = raw.terms().get(0);
        assertEquals("Oh! Calcutta", t.name());
        assertEquals(Optional.of(new Definition("A revue! With \"quotes\".", List.of("ISBN:123", "PMID:9"))),
            t.definition());
    }

    @Test
    void testTypedefTags() {
        RawEntitySet raw = parser.parse("""
            [Typedef]
            id: has_part
            name: has part
            def: "Whole to part." []
            inverse_of: part_of ! part of
            is_obsolete: true
            """);

        Typedef td = raw.typedefs().get(0);
        assertEquals("has part", td.name());
        assertEquals(Optional.of("part_of"), td.inverseOf());
        assertTrue(td.obsolete());
        assertEquals("Whole to part.", td.definition().orElseThrow().text());
    }

    @Test
    void testRelationshipWithTrailingColonAndQualifiers() {
        RawEntitySet raw = parser.parse("""
            [Term]
            id: X:1
            relationship: part_of: X:2 {source="manual"}
            is_obsolete: true
            """);

        Term t = raw.terms().get(0);
        assertEquals(Set.of("X:2"), t.targets("part_of"));
        assertTrue(t.obsolete());
    }

    @Test
    void testMalformedLinesBecomeDiagnostics() {
        RawEntitySet raw = parser.parse("""
            [Term]
            id: X:1
            this line has no tag
            relationship: part_of
            name: kept
            """);

        List<Diagnostic> malformed = ofKind(raw, Diagnostic.Kind.MALFORMED_LINE);
        assertEquals(2, malformed.size());
        assertEquals(3, malformed.get(0).line());
        assertEquals(4, malformed.get(1).line());
        assertEquals("kept", raw.terms().get(0).name());
        assertTrue(raw.terms().get(0).relationships().isEmpty());
    }

    @Test
    void testStrictModeRaisesOnMalformedLine() {
        StanzaParser strict = new StanzaParser(ParserSettings.defaults().withStrict(true));

        OboParseException ex = assertThrows(OboParseException.class, () -> strict.parse("""
            [Term]
            id: X:1
            id: X:2
            """));
        assertEquals(3, ex.getLineNumber());
        assertEquals(StanzaParser.TERM, ex.getStanzaType());
    }

    @Test
    void testMissingIdFailsWithStanzaLine() {
        OboParseException ex = assertThrows(OboParseException.class, () -> parser.parse("""
            [Term]
            id: X:1

            [Term]
            name: nameless
            """));
        assertEquals(4, ex.getLineNumber());
        assertTrue(ex.getMessage().startsWith("Line 4:"));
    }

    @Test
    void testUnknownStanzaIsSkipped() {
        RawEntitySet raw = parser.parse("""
            [Instance]
            id: I:1
            instance_of: X:1

            [Term]
            id: X:1
            """);

        assertEquals(1, raw.terms().size());
        List<Diagnostic> unknown = ofKind(raw, Diagnostic.Kind.UNKNOWN_STANZA);
        assertEquals(1, unknown.size());
        assertEquals("Instance", unknown.get(0).subject());
        assertEquals(1, unknown.get(0).line());
    }

    @Test
    void testUnknownTagsAreKeptAsAnnotations() {
        RawEntitySet raw = parser.parse("""
            [Term]
            id: X:1
            synonym: "thing" EXACT []
            synonym: "object" RELATED []

            [Term]
            id: X:2
            synonym: "other" EXACT []
            """);

        assertEquals(List.of("\"thing\" EXACT []", "\"object\" RELATED []"),
            raw.terms().get(0).annotations().get("synonym"));
        assertEquals(1, ofKind(raw, Diagnostic.Kind.UNKNOWN_TAG).size());
    }

    @Test
    void testUnknownTagsCanBeDropped() {
        StanzaParser p = new StanzaParser(new ParserSettings("", false, false));

        RawEntitySet raw = p.parse("[Term]\nid: X:1\nsynonym: \"thing\" EXACT []\n");

        assertTrue(raw.terms().get(0).annotations().isEmpty());
        assertEquals(1, ofKind(raw, Diagnostic.Kind.UNKNOWN_TAG).size());
    }

    @Test
    void testEmptyInput() {
        RawEntitySet raw = parser.parse("");

        assertTrue(raw.terms().isEmpty());
        assertTrue(raw.typedefs().isEmpty());
        assertTrue(raw.header().entries().isEmpty());
    }

    @Test
    void testParseFromClasspath() throws IOException {
        RawEntitySet raw;
        try (InputStream in = getClass().getResourceAsStream("/obo/literature.obo")) {
            assertNotNull(in);
            raw = parser.parse(LineSource.of(in));
        }

        assertEquals("literature", raw.defaultNamespace());
        assertEquals("LIT:0000003", raw.terms().get(0).id());
        assertTrue(raw.terms().stream().allMatch(t -> "literature".equals(t.namespace())));
    }
}
