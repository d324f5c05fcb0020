package com.ragmodule.chunking;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

class LineWindowChunkerTest {

    @Test
    void shouldGroupLinesWithOverlap() {
        LineWindowChunker chunker = new LineWindowChunker(3, 1);
        List<String> chunks = chunker.split("one\ntwo\nthree\nfour\nfive");

        assertEquals(List.of("one\ntwo\nthree", "three\nfour\nfive"), chunks);
    }

    @Test
    void shouldDropBlankWindows() {
        LineWindowChunker chunker = new LineWindowChunker(2, 0);
        List<String> chunks = chunker.split("alpha\nbeta\n\n\ngamma");

        assertEquals(List.of("alpha\nbeta", "gamma"), chunks);
    }

    @Test
    void shouldReturnNoChunksForBlankText() {
        LineWindowChunker chunker = new LineWindowChunker(5, 1);
        assertTrue(chunker.split("  \n ").isEmpty());
        assertTrue(chunker.split(null).isEmpty());
    }

    @Test
    void shouldRejectOverlapNotSmallerThanWindow() {
        assertThrows(IllegalArgumentException.class, () -> new LineWindowChunker(2, 2));
    }
}
