package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Thrown when an indexed lexeme does not round-trip through the string store,
 * e.g. a hash collision in the by-string index or a lexicon file written
 * against a different strings.json.
 */
public class LexiconConsistencyException extends IllegalStateException {

    public LexiconConsistencyException(String message) {
        super(message);
    }

    public static LexiconConsistencyException mismatchedStrings(int indexedOrth, int expectedOrth, String string) {
        return new LexiconConsistencyException("Lexicon index is inconsistent with the string store for '"
            + string + "': indexed orth=" + indexedOrth + ", string store id=" + expectedOrth);
    }
}
