package pl.marcinmilkowski.vocab_store.vectors;

/**
 * Norm and similarity helpers for word vectors.
 */
public final class VectorMath {

    private VectorMath() {
    }

    public static float l2Norm(float[] vector) {
        double sum = 0.0;
        for (float v : vector) {
            sum += (double) v * v;
        }
        return (float) Math.sqrt(sum);
    }

    public static boolean isZero(float[] vector) {
        for (float v : vector) {
            if (v != 0.0f) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cosine similarity using precomputed norms. Returns 0 if either norm is 0.
     */
    public static double cosine(float[] a, float aNorm, float[] b, float bNorm) {
        if (aNorm == 0.0f || bNorm == 0.0f) {
            return 0.0;
        }
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return dot / ((double) aNorm * bNorm);
    }
}
