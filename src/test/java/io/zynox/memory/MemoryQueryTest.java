package io.zynox.memory;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryQueryTest {

    @Test
    void shouldTreatEmptyFiltersAsAbsent() {
        var query = new MemoryQuery("", "");
        assertNull(query.emotion());
        assertNull(query.keyword());
        assertTrue(query.isEmpty());
    }

    @Test
    void shouldKeepWhitespaceFilters() {
        var query = new MemoryQuery("  ", " ");
        assertEquals("  ", query.emotion());
        assertEquals(" ", query.keyword());
        assertFalse(query.isEmpty());
    }

    @Test
    void shouldReportWhichFiltersAreSet() {
        var query = new MemoryQuery("sad", null);
        assertTrue(query.hasEmotion());
        assertFalse(query.hasKeyword());
        assertFalse(query.isEmpty());
    }
}
