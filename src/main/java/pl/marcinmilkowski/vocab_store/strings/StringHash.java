package pl.marcinmilkowski.vocab_store.strings;

/**
 * 64-bit string hash used as the key of the lexicon's by-string index.
 */
public final class StringHash {

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private StringHash() {
    }

    /**
     * FNV-1a over UTF-16 code units followed by a Murmur3 finalizer.
     * Never returns {@link Long#MIN_VALUE}, which the index uses as its empty-slot marker.
     */
    public static long hash64(String string) {
        long h = FNV_OFFSET;
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            h ^= (c & 0xFF);
            h *= FNV_PRIME;
            h ^= (c >>> 8);
            h *= FNV_PRIME;
        }
        h = fmix64(h);
        return h == Long.MIN_VALUE ? Long.MIN_VALUE + 1 : h;
    }

    private static long fmix64(long z) {
        z ^= (z >>> 33);
        z *= 0xff51afd7ed558ccdL;
        z ^= (z >>> 33);
        z *= 0xc4ceb9fe1a85ec53L;
        z ^= (z >>> 33);
        return z;
    }
}
