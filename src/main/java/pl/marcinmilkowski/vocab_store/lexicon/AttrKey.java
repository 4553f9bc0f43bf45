package pl.marcinmilkowski.vocab_store.lexicon;

/**
 * Target of an attribute getter: either a named slot or a single flag bit.
 *
 * @param attr    the slot; {@link LexAttr#FLAG} for flag keys
 * @param flagBit the bit in [1,63] for flag keys, 0 otherwise
 */
public record AttrKey(LexAttr attr, int flagBit) {

    public AttrKey {
        if (attr == null) {
            throw new IllegalArgumentException("attr must not be null");
        }
        if (attr == LexAttr.FLAG) {
            if (!Flags.isValidBit(flagBit)) {
                throw new IllegalArgumentException("Invalid value for flag id: " + flagBit
                    + ". Flag ids must be between " + Flags.MIN_BIT + " and " + Flags.MAX_BIT + " (inclusive)");
            }
        } else if (flagBit != 0) {
            throw new IllegalArgumentException("flagBit is only meaningful for FLAG keys: " + attr);
        }
    }

    public static AttrKey of(LexAttr attr) {
        return new AttrKey(attr, 0);
    }

    public static AttrKey flag(int bit) {
        return new AttrKey(LexAttr.FLAG, bit);
    }

    public boolean isFlag() {
        return attr == LexAttr.FLAG;
    }

    @Override
    public String toString() {
        return isFlag() ? "FLAG" + flagBit : attr.name();
    }
}
