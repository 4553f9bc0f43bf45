package pl.marcinmilkowski.vocab_store.strings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Heap-backed {@link StringStore}. Not thread-safe.
 */
public class InMemoryStringStore implements StringStore {

    private final List<String> byId = new ArrayList<>();
    private final Map<String, Integer> idByString = new HashMap<>();

    public InMemoryStringStore() {
        byId.add("");
        idByString.put("", 0);
    }

    @Override
    public int idFor(String string) {
        String key = string != null ? string : "";
        Integer existing = idByString.get(key);
        if (existing != null) {
            return existing;
        }
        int id = byId.size();
        byId.add(key);
        idByString.put(key, id);
        return id;
    }

    @Override
    public String stringFor(int id) {
        if (id < 0 || id >= byId.size()) {
            throw new IndexOutOfBoundsException("Unknown string id: " + id + " (store has " + byId.size() + " ids)");
        }
        return byId.get(id);
    }

    @Override
    public boolean contains(String string) {
        return idByString.containsKey(string);
    }

    @Override
    public int size() {
        return byId.size();
    }

    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableList(byId).iterator();
    }
}
