package io.blockchain.walletsync.chrono;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OldestFirstTest {

    @Test
    void rejectsEmptySequences() {
        assertThrows(IllegalArgumentException.class, () -> OldestFirst.of(List.of()));
        assertThrows(IllegalArgumentException.class, () -> NewestFirst.of(List.of()));
    }

    @Test
    void conversionReversesOrder() {
        OldestFirst<Integer> oldest = OldestFirst.of(1, 2, 3);
        NewestFirst<Integer> newest = oldest.toNewestFirst();

        assertEquals(List.of(3, 2, 1), newest.toList());
        assertEquals(3, newest.newest());
        assertEquals(1, newest.oldest());
        assertEquals(oldest, newest.toOldestFirst());
    }

    @Test
    void copiesInput() {
        ArrayList<String> items = new ArrayList<>(List.of("a", "b"));
        OldestFirst<String> seq = OldestFirst.of(items);
        items.add("c");

        assertEquals(2, seq.size());
        assertEquals("a", seq.oldest());
        assertEquals("b", seq.newest());
    }
}
