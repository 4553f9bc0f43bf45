package pl.marcinmilkowski.vocab_store.strings;

/**
 * Bidirectional map between strings and compact integer ids.
 *
 * Ids are assigned monotonically and never reused. Id 0 is reserved for the
 * empty string.
 */
public interface StringStore extends Iterable<String> {

    /**
     * Returns the id for the string, interning it if it is not known yet.
     */
    int idFor(String string);

    /**
     * Returns the string for a known id.
     *
     * @throws IndexOutOfBoundsException if the id was never assigned
     */
    String stringFor(int id);

    boolean contains(String string);

    /**
     * Number of assigned ids, including the reserved empty string.
     */
    int size();
}
