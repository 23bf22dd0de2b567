package com.proofmend.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CodeFencesTest {

    @Test
    void testLeanFenceIsRemoved() {
        assertEquals("theorem t : True := trivial",
                CodeFences.strip("```lean\ntheorem t : True := trivial\n```\n"));
    }

    @Test
    void testBareFenceIsRemoved() {
        assertEquals("a\nb", CodeFences.strip("```\na\nb\n```"));
    }

    @Test
    void testUnfencedTextIsOnlyTrimmed() {
        assertEquals("open Classical", CodeFences.strip("  open Classical \n"));
    }

    @Test
    void testUnterminatedFenceKeepsBody() {
        assertEquals("x := 1", CodeFences.strip("```lean\nx := 1\n"));
    }

    @Test
    void testNullAndFenceOnlyGiveEmpty() {
        assertEquals("", CodeFences.strip(null));
        assertEquals("", CodeFences.strip("```"));
    }
}
