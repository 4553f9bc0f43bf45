package pl.marcinmilkowski.vocab_store.vectors;

import java.io.IOException;

/**
 * Malformed vector file. The message names the source and the offending
 * line or record.
 */
public class VectorReadException extends IOException {

    private final int index;

    public VectorReadException(String message, int index) {
        super(message);
        this.index = index;
    }

    public VectorReadException(String message, int index, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    /**
     * 0-based line or record index the error refers to, or -1 if not tied to one.
     */
    public int getIndex() {
        return index;
    }

    public static VectorReadException mismatchedSizes(String source, int index, int expected, int actual) {
        return new VectorReadException("Error reading word vectors from " + source
            + ": line/record " + index + " has " + actual + " components, expected " + expected, index);
    }

    public static VectorReadException badSize(String source, int index, int size, int max) {
        return new VectorReadException("Error reading word vectors from " + source
            + ": record " + index + " declares vector length " + size
            + ", which must be in [1, " + max + ")", index);
    }
}
