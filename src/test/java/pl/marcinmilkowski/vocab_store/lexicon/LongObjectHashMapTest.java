package pl.marcinmilkowski.vocab_store.lexicon;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LongObjectHashMapTest {

    @Test
    @DisplayName("Put replaces and returns the previous value")
    void putReplaces() {
        LongObjectHashMap<String> map = new LongObjectHashMap<>(4);
        assertNull(map.put(42L, "a"));
        assertEquals("a", map.put(42L, "b"));
        assertEquals("b", map.get(42L));
        assertEquals(1, map.size());
    }

    @Test
    @DisplayName("Grows past the initial capacity without losing entries")
    void growsOnRehash() {
        LongObjectHashMap<Long> map = new LongObjectHashMap<>(4);
        int initialCapacity = map.capacity();
        for (long k = -500; k < 500; k++) {
            map.put(k * 7919, k);
        }

        assertEquals(1000, map.size());
        assertTrue(map.capacity() > initialCapacity);
        for (long k = -500; k < 500; k++) {
            assertEquals(k, map.get(k * 7919));
        }
        assertNull(map.get(3L));
        assertFalse(map.containsKey(3L));
    }

    @Test
    @DisplayName("Iteration visits every value once")
    void iteratesAllValues() {
        LongObjectHashMap<String> map = new LongObjectHashMap<>();
        map.put(1L, "one");
        map.put(2L, "two");
        map.put(Long.MAX_VALUE, "max");

        Set<String> seen = new HashSet<>();
        for (String v : map) {
            assertTrue(seen.add(v));
        }
        assertEquals(Set.of("one", "two", "max"), seen);
    }

    @Test
    @DisplayName("Reserved key and null values are rejected")
    void rejectsReservedKey() {
        LongObjectHashMap<String> map = new LongObjectHashMap<>();
        assertThrows(IllegalArgumentException.class, () -> map.put(Long.MIN_VALUE, "x"));
        assertThrows(IllegalArgumentException.class, () -> map.put(1L, null));
        assertNull(map.get(Long.MIN_VALUE));
    }
}
