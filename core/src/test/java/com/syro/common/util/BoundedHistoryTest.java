package com.syro.common.util;

import com.syro.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedHistoryTest extends TestBase {

    @Test
    void testEvictsOldestFirst() {
        BoundedHistory<Integer> history = new BoundedHistory<>(3);
        for (int i = 1; i <= 5; i++) history.add(i);

        assertEquals(List.of(3, 4, 5), history.snapshot(), "Oldest entries should be evicted first");
        assertEquals(3, history.size());
        assertEquals(5, history.getTotalAppended());
        assertEquals(2, history.getEvicted());
    }

    @Test
    void testFilterKeepsNewestMatchesWithinLimit() {
        BoundedHistory<Integer> history = new BoundedHistory<>(10);
        for (int i = 1; i <= 10; i++) history.add(i);

        assertEquals(List.of(6, 8, 10), history.filter(i -> i % 2 == 0, 3));
        assertEquals(5, history.filter(i -> i % 2 == 0, 0).size(), "0 means no limit");
    }

    @Test
    void testClear() {
        BoundedHistory<String> history = new BoundedHistory<>(2);
        history.add("a");
        history.add("b");
        history.add("c");
        history.clear();

        assertTrue(history.snapshot().isEmpty());
        history.add("d");
        assertEquals(List.of("d"), history.snapshot(), "Buffer should be reusable after clear");
    }

    @Test
    void testRejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedHistory<>(0));
    }
}
