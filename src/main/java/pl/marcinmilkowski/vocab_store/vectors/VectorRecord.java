package pl.marcinmilkowski.vocab_store.vectors;

/**
 * One word and its vector as read from a vector file.
 *
 * @param index  0-based line (text) or record (binary) index in the source
 * @param word   the word, " " for lines that start with whitespace
 * @param vector the components
 */
public record VectorRecord(int index, String word, float[] vector) {

    public int dimension() {
        return vector.length;
    }
}
