package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Computes one attribute of a new lexeme from its string.
 *
 * May return {@code null} (slot left at its default), a {@link String}
 * (stored as its interned id), a {@link Number} or a {@link Boolean}.
 */
@FunctionalInterface
public interface LexAttrGetter {

    Object get(String string);
}
