package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Cached per-string record: attributes, flags and word vector.
 *
 * Identity is {@link #orth()}, the interned id of the string. Instances are
 * created by {@link Vocab} only; callers hold them by reference. The vector
 * array is shared storage and must not be modified through {@link #vector()}.
 */
public final class Lexeme {

    long flags;
    int id;
    int length;
    int orth;
    int lower;
    int norm;
    int shape;
    int prefix;
    int suffix;
    int cluster;
    int lang;
    float prob;
    float sentiment;
    float l2Norm;
    float[] vector;

    final Arena owner;

    Lexeme(Arena owner, float[] vector) {
        this.owner = owner;
        this.vector = vector;
    }

    public int orth() {
        return orth;
    }

    public int length() {
        return length;
    }

    public int id() {
        return id;
    }

    public long flags() {
        return flags;
    }

    public int lower() {
        return lower;
    }

    public int norm() {
        return norm;
    }

    public int shape() {
        return shape;
    }

    public int prefix() {
        return prefix;
    }

    public int suffix() {
        return suffix;
    }

    public int cluster() {
        return cluster;
    }

    public int lang() {
        return lang;
    }

    public float prob() {
        return prob;
    }

    public float sentiment() {
        return sentiment;
    }

    public float l2Norm() {
        return l2Norm;
    }

    public float[] vector() {
        return vector;
    }

    /**
     * Arena the record was allocated from.
     */
    public Arena owner() {
        return owner;
    }

    /**
     * True for records created in a caller's scratch arena, which are never indexed.
     */
    public boolean isOov() {
        return owner != null && !owner.isPermanent();
    }

    public boolean checkFlag(int bit) {
        checkBit(bit);
        return (flags & (1L << bit)) != 0;
    }

    public void setFlag(int bit, boolean value) {
        checkBit(bit);
        if (value) {
            flags |= (1L << bit);
        } else {
            flags &= ~(1L << bit);
        }
    }

    public void setProb(float prob) {
        this.prob = prob;
    }

    public void setCluster(int cluster) {
        this.cluster = cluster;
    }

    public void setSentiment(float sentiment) {
        this.sentiment = sentiment;
    }

    /**
     * Reads any slot as a double; flags read as 1 or 0.
     */
    public double getAttr(AttrKey key) {
        switch (key.attr()) {
            case FLAG:
                return checkFlag(key.flagBit()) ? 1 : 0;
            case ID:
                return id;
            case ORTH:
                return orth;
            case LOWER:
                return lower;
            case NORM:
                return norm;
            case SHAPE:
                return shape;
            case PREFIX:
                return prefix;
            case SUFFIX:
                return suffix;
            case LENGTH:
                return length;
            case CLUSTER:
                return cluster;
            case LANG:
                return lang;
            case PROB:
                return prob;
            case SENTIMENT:
                return sentiment;
            default:
                throw new IllegalArgumentException("Unknown attribute: " + key);
        }
    }

    void setAttr(AttrKey key, Number value) {
        switch (key.attr()) {
            case FLAG:
                setFlag(key.flagBit(), value.doubleValue() != 0);
                break;
            case LOWER:
                lower = value.intValue();
                break;
            case NORM:
                norm = value.intValue();
                break;
            case SHAPE:
                shape = value.intValue();
                break;
            case PREFIX:
                prefix = value.intValue();
                break;
            case SUFFIX:
                suffix = value.intValue();
                break;
            case CLUSTER:
                cluster = value.intValue();
                break;
            case LANG:
                lang = value.intValue();
                break;
            case PROB:
                prob = value.floatValue();
                break;
            case SENTIMENT:
                sentiment = value.floatValue();
                break;
            default:
                throw new IllegalArgumentException("Attribute is not writable: " + key);
        }
    }

    private static void checkBit(int bit) {
        if (!Flags.isValidBit(bit)) {
            throw new IllegalArgumentException("Flag bit out of range [1,63]: " + bit);
        }
    }

    @Override
    public String toString() {
        return "Lexeme{orth=" + orth + ", id=" + id + ", length=" + length
            + ", prob=" + prob + ", flags=0x" + Long.toHexString(flags) + "}";
    }
}
