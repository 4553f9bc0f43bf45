package pl.marcinmilkowski.vocab_store.lexicon;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Primitive hash map from long -> object using open addressing.
 *
 * Backs both lexicon indices (string hash -> lexeme, orth -> lexeme).
 * Entries are never removed. Iteration follows slot order, which changes on rehash.
 */
public final class LongObjectHashMap<V> implements Iterable<V> {

    private static final long EMPTY = Long.MIN_VALUE;

    private long[] keys;
    private Object[] values;
    private int size;
    private int mask;
    private int resizeAt;

    public LongObjectHashMap(int expectedSize) {
        int cap = 1;
        int need = Math.max(4, (int) (expectedSize / 0.65) + 1);
        while (cap < need) cap <<= 1;
        init(cap);
    }

    public LongObjectHashMap() {
        this(1024);
    }

    private void init(int capacity) {
        keys = new long[capacity];
        values = new Object[capacity];
        Arrays.fill(keys, EMPTY);
        size = 0;
        mask = capacity - 1;
        resizeAt = (int) (capacity * 0.65);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @SuppressWarnings("unchecked")
    public V get(long key) {
        if (key == EMPTY) {
            return null;
        }
        int slot = mix64(key) & mask;
        while (true) {
            long k = keys[slot];
            if (k == EMPTY) {
                return null;
            }
            if (k == key) {
                return (V) values[slot];
            }
            slot = (slot + 1) & mask;
        }
    }

    public boolean containsKey(long key) {
        return get(key) != null;
    }

    /**
     * Associates {@code value} with {@code key}.
     *
     * @return the previous value, or null
     */
    @SuppressWarnings("unchecked")
    public V put(long key, V value) {
        if (key == EMPTY) {
            throw new IllegalArgumentException("Key cannot be Long.MIN_VALUE");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        if (size >= resizeAt) {
            rehash(keys.length * 2);
        }

        int slot = mix64(key) & mask;
        while (true) {
            long k = keys[slot];
            if (k == EMPTY) {
                keys[slot] = key;
                values[slot] = value;
                size++;
                return null;
            }
            if (k == key) {
                V previous = (V) values[slot];
                values[slot] = value;
                return previous;
            }
            slot = (slot + 1) & mask;
        }
    }

    @Override
    public Iterator<V> iterator() {
        return new Iterator<>() {
            private int next = advance(0);

            private int advance(int from) {
                int i = from;
                while (i < keys.length && keys[i] == EMPTY) i++;
                return i;
            }

            @Override
            public boolean hasNext() {
                return next < keys.length;
            }

            @Override
            @SuppressWarnings("unchecked")
            public V next() {
                if (next >= keys.length) {
                    throw new NoSuchElementException();
                }
                V v = (V) values[next];
                next = advance(next + 1);
                return v;
            }
        };
    }

    public int capacity() {
        return keys.length;
    }

    private void rehash(int newCapacity) {
        long[] oldKeys = keys;
        Object[] oldValues = values;

        init(newCapacity);

        for (int i = 0; i < oldKeys.length; i++) {
            long k = oldKeys[i];
            if (k == EMPTY) continue;

            int slot = mix64(k) & mask;
            while (keys[slot] != EMPTY) {
                slot = (slot + 1) & mask;
            }
            keys[slot] = k;
            values[slot] = oldValues[i];
            size++;
        }
    }

    // Murmur3 finalizer-like mix; returns int hash
    private static int mix64(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return (int) z;
    }
}
