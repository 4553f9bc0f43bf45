package pl.marcinmilkowski.vocab_store.strings;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * strings.json: a JSON array of every interned string in id order, without
 * the reserved empty string at id 0. Reading it into an empty store (or one
 * holding the same prefix) reproduces the original ids.
 */
public final class StringsFile {

    private StringsFile() {
    }

    public static void write(StringStore strings, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        JSONArray array = new JSONArray(Math.max(0, strings.size() - 1));
        Iterator<String> it = strings.iterator();
        if (it.hasNext()) {
            it.next(); // id 0
        }
        while (it.hasNext()) {
            array.add(it.next());
        }
        Files.writeString(path, array.toJSONString(), StandardCharsets.UTF_8);
    }

    /**
     * Interns every string of the file in order.
     *
     * @return number of strings read
     */
    public static int readInto(StringStore strings, Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Strings file not found: " + path);
        }
        JSONArray array;
        try {
            array = JSON.parseArray(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JSONException e) {
            throw new IOException("Invalid strings file " + path + ": " + e.getMessage(), e);
        }
        if (array == null) {
            throw new IOException("Invalid strings file (not a JSON array): " + path);
        }
        for (int i = 0; i < array.size(); i++) {
            String s = array.getString(i);
            if (s == null) {
                throw new IOException("Invalid strings file: null entry at index " + i + " in " + path);
            }
            strings.idFor(s);
        }
        return array.size();
    }
}
