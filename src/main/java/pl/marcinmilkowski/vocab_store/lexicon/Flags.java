package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Bit positions of the built-in lexical flags. Bit 0 is never used;
 * bits 18..63 are free for {@link Vocab#addFlag}.
 */
public final class Flags {

    public static final int IS_ALPHA = 1;
    public static final int IS_ASCII = 2;
    public static final int IS_DIGIT = 3;
    public static final int IS_LOWER = 4;
    public static final int IS_PUNCT = 5;
    public static final int IS_SPACE = 6;
    public static final int IS_TITLE = 7;
    public static final int IS_UPPER = 8;
    public static final int LIKE_URL = 9;
    public static final int LIKE_NUM = 10;
    public static final int LIKE_EMAIL = 11;
    public static final int IS_STOP = 12;
    public static final int IS_OOV = 13;
    public static final int IS_BRACKET = 14;
    public static final int IS_QUOTE = 15;
    public static final int IS_LEFT_PUNCT = 16;
    public static final int IS_RIGHT_PUNCT = 17;

    public static final int MIN_BIT = 1;
    public static final int MAX_BIT = 63;

    private Flags() {
    }

    public static boolean isValidBit(int bit) {
        return bit >= MIN_BIT && bit <= MAX_BIT;
    }
}
