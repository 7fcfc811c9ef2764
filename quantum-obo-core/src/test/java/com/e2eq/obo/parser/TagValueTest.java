package com.e2eq.obo.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TagValueTest {

    @Test
    void testSplitsTagValueAndComment() {
        TagValue tv = TagValue.parse("is_a: LIT:0000002 ! Drama").orElseThrow();

        assertEquals("is_a", tv.tag());
        assertEquals("LIT:0000002", tv.value());
        assertEquals("Drama", tv.comment());
        assertEquals("LIT:0000002", tv.firstToken());
    }

    @Test
    void testValueWithoutComment() {
        TagValue tv = TagValue.parse("format-version: 1.2").orElseThrow();

        assertEquals("format-version", tv.tag());
        assertEquals("1.2", tv.value());
        assertNull(tv.comment());
    }

    @Test
    void testQuotedAndEscapedBangsAreNotComments() {
        TagValue quoted = TagValue.parse("def: \"Stop! Hammer time\" [] ! note").orElseThrow();
        assertEquals("\"Stop! Hammer time\" []", quoted.value());
        assertEquals("note", quoted.comment());

        TagValue escaped = TagValue.parse("name: Oh\\! Calcutta").orElseThrow();
        assertEquals("Oh! Calcutta", escaped.value());
        assertNull(escaped.comment());
    }

    @Test
    void testEscapeIsReversedByParse() {
        String value = "Hey! Ho!";
        assertEquals(value, TagValue.parse("name: " + TagValue.escape(value)).orElseThrow().value());
    }

    @Test
    void testQualifiersAreStripped() {
        TagValue tv = TagValue.parse("relationship: part_of T:1 {cardinality=\"1\"}").orElseThrow();

        assertEquals("part_of T:1", tv.unqualifiedValue());
        assertEquals("part_of", tv.firstToken());
    }

    @Test
    void testLinesWithoutTagAreRejected() {
        assertTrue(TagValue.parse("no colon here").isEmpty());
        assertTrue(TagValue.parse(": value").isEmpty());
        assertTrue(TagValue.parse("two words: value").isEmpty());
    }

    @Test
    void testEmptyValue() {
        TagValue tv = TagValue.parse("id:").orElseThrow();

        assertEquals("", tv.value());
        assertEquals("", tv.firstToken());
    }
}
