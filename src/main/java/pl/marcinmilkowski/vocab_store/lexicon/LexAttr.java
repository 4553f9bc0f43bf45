package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Lexeme attribute slots addressable by getters and by {@link Lexeme#getAttr}.
 */
public enum LexAttr {
    /** One bit of the flag set; the bit number is carried by {@link AttrKey}. */
    FLAG,
    ID,
    ORTH,
    LOWER,
    NORM,
    SHAPE,
    PREFIX,
    SUFFIX,
    LENGTH,
    CLUSTER,
    LANG,
    PROB,
    SENTIMENT;

    /**
     * Whether a getter may write this slot. ORTH and LENGTH are derived from the
     * string itself and ID is assigned by the table.
     */
    public boolean isWritable() {
        return this != ID && this != ORTH && this != LENGTH;
    }

    public boolean isFloat() {
        return this == PROB || this == SENTIMENT;
    }
}
