package pl.marcinmilkowski.vocab_store.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Allocation scope for lexemes and vector buffers that are released together.
 *
 * Each {@link Vocab} owns one permanent arena for its core vocabulary. Callers
 * that look up rare strings pass their own scratch arena; lexemes created
 * there are out-of-vocabulary and die with the arena. Memory itself is
 * managed by the JVM; the arena tracks ownership and refuses allocations
 * after it has been released.
 */
public final class Arena implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Arena.class);

    private final String name;
    private final boolean permanent;

    private long lexemeCount;
    private long floatCount;
    private boolean released;

    private Arena(String name, boolean permanent) {
        this.name = name;
        this.permanent = permanent;
    }

    static Arena permanent(String name) {
        return new Arena(name, true);
    }

    /**
     * Creates a caller-owned arena for out-of-vocabulary lookups.
     */
    public static Arena scratch(String name) {
        return new Arena(name, false);
    }

    public static Arena scratch() {
        return scratch("scratch");
    }

    public String name() {
        return name;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public boolean isReleased() {
        return released;
    }

    public long lexemeCount() {
        return lexemeCount;
    }

    /**
     * Number of vector components currently allocated from this arena.
     */
    public long floatCount() {
        return floatCount;
    }

    Lexeme allocLexeme(float[] emptyVector) {
        ensureOpen();
        lexemeCount++;
        return new Lexeme(this, emptyVector);
    }

    float[] allocVector(int length) {
        ensureOpen();
        floatCount += length;
        return new float[length];
    }

    /**
     * Returns a buffer of {@code length} floats holding the common prefix of
     * {@code old}; the tail is zero.
     */
    float[] reallocVector(float[] old, int length) {
        ensureOpen();
        floatCount += length - old.length;
        return Arrays.copyOf(old, length);
    }

    private void ensureOpen() {
        if (released) {
            throw new IllegalStateException("Arena '" + name + "' has been released");
        }
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            logger.debug("Released arena '{}': {} lexemes, {} vector components", name, lexemeCount, floatCount);
        }
    }
}
