package pl.marcinmilkowski.vocab_store.config;

/**
 * Tunables of a vocabulary session.
 *
 * @param oovWarmup           below this table length every new lexeme is permanent
 * @param minOovLength        strings shorter than this are always permanent
 * @param maxVectorComponents exclusive upper bound on binary vector length
 * @param oovProb             log probability assigned by the default PROB getter
 */
public record VocabConfig(
    int oovWarmup,
    int minOovLength,
    int maxVectorComponents,
    float oovProb
) {
    public static final int DEFAULT_OOV_WARMUP = 10_000;
    public static final int DEFAULT_MIN_OOV_LENGTH = 3;
    public static final int DEFAULT_MAX_VECTOR_COMPONENTS = 100_000;
    public static final float DEFAULT_OOV_PROB = -20.0f;

    public VocabConfig {
        if (oovWarmup < 0) {
            throw new IllegalArgumentException("oov_warmup must be >= 0: " + oovWarmup);
        }
        if (minOovLength < 0) {
            throw new IllegalArgumentException("min_oov_length must be >= 0: " + minOovLength);
        }
        if (maxVectorComponents < 2) {
            throw new IllegalArgumentException("max_vector_components must be >= 2: " + maxVectorComponents);
        }
        if (Float.isNaN(oovProb)) {
            throw new IllegalArgumentException("oov_prob must be a number");
        }
    }

    public static VocabConfig defaults() {
        return new VocabConfig(DEFAULT_OOV_WARMUP, DEFAULT_MIN_OOV_LENGTH,
            DEFAULT_MAX_VECTOR_COMPONENTS, DEFAULT_OOV_PROB);
    }

    public VocabConfig withOovWarmup(int warmup) {
        return new VocabConfig(warmup, minOovLength, maxVectorComponents, oovProb);
    }
}
