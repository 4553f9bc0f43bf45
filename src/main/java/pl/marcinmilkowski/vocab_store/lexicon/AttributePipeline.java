package pl.marcinmilkowski.vocab_store.lexicon;

import pl.marcinmilkowski.vocab_store.strings.StringStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered registry of attribute getters run once for every new lexeme.
 */
public final class AttributePipeline {

    private final List<Entry> entries = new ArrayList<>();

    /**
     * A registered getter and the slot it writes.
     */
    public record Entry(AttrKey key, LexAttrGetter getter) {
    }

    /**
     * Registers a getter. A getter already registered for the same key is
     * replaced and keeps its position.
     */
    public void register(AttrKey key, LexAttrGetter getter) {
        if (key == null || getter == null) {
            throw new IllegalArgumentException("key and getter must not be null");
        }
        if (!key.attr().isWritable()) {
            throw new IllegalArgumentException("Attribute " + key + " is assigned by the vocab and cannot have a getter");
        }
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).key().equals(key)) {
                entries.set(i, new Entry(key, getter));
                return;
            }
        }
        entries.add(new Entry(key, getter));
    }

    public boolean isRegistered(AttrKey key) {
        for (Entry e : entries) {
            if (e.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Lowest flag bit in [1,63] with no registered getter, or -1 if all are taken.
     */
    public int lowestFreeFlagBit() {
        for (int bit = Flags.MIN_BIT; bit <= Flags.MAX_BIT; bit++) {
            if (!isRegistered(AttrKey.flag(bit))) {
                return bit;
            }
        }
        return -1;
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Runs every getter in registration order against {@code string} and stores
     * the results on {@code lexeme}.
     */
    void apply(Lexeme lexeme, String string, StringStore strings) {
        for (Entry e : entries) {
            Object value = e.getter().get(string);
            if (value == null) {
                continue;
            }
            lexeme.setAttr(e.key(), toNumber(e.key(), value, strings));
        }
    }

    static Number toNumber(AttrKey key, Object value, StringStore strings) {
        if (value instanceof Number) {
            return (Number) value;
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? 1 : 0;
        }
        if (value instanceof String) {
            return strings.idFor((String) value);
        }
        throw new IllegalArgumentException("Getter for " + key + " returned unsupported type "
            + value.getClass().getName());
    }
}
