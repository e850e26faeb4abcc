package org.learningjava.ees.domain.model.embedding;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingFilterTest {

    @Test
    void defaults_and_clamping() {
        var f = new EmbeddingFilter("  ", null, null, 0, 0);
        assertNull(f.uri());
        assertEquals(UriMatch.EXACT, f.uriMatch());
        assertEquals(1, f.page());
        assertEquals(10, f.limit());

        assertEquals(100, new EmbeddingFilter(null, null, UriMatch.EXACT, 1, 5000).limit());
        assertEquals(1, new EmbeddingFilter(null, null, UriMatch.EXACT, -3, 20).page());
    }

    @Test
    void offset_isPageMinusOneTimesLimit() {
        assertEquals(0, EmbeddingFilter.byModel("m", 1, 25).offset());
        assertEquals(50, EmbeddingFilter.byModel("m", 3, 25).offset());
    }

    @Test
    void page_derivesNavigationFlags() {
        var p = EmbeddingPage.of(List.of(), 2, 10, 25);
        assertEquals(3, p.totalPages());
        assertTrue(p.hasNext());
        assertTrue(p.hasPrev());

        var last = EmbeddingPage.of(List.of(), 3, 10, 25);
        assertFalse(last.hasNext());

        var empty = EmbeddingPage.of(List.of(), 1, 10, 0);
        assertEquals(0, empty.totalPages());
        assertFalse(empty.hasNext());
        assertFalse(empty.hasPrev());
    }
}
