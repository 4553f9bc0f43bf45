package pl.marcinmilkowski.vocab_store.strings;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryStringStoreTest {

    @Test
    @DisplayName("Empty string is id 0")
    void emptyStringIsReserved() {
        InMemoryStringStore store = new InMemoryStringStore();
        assertEquals(0, store.idFor(""));
        assertEquals(0, store.idFor(null));
        assertEquals("", store.stringFor(0));
        assertEquals(1, store.size());
    }

    @Test
    @DisplayName("Interning is idempotent and ids are dense")
    void internIsIdempotent() {
        InMemoryStringStore store = new InMemoryStringStore();
        int theory = store.idFor("theory");
        int mind = store.idFor("mind");

        assertEquals(1, theory);
        assertEquals(2, mind);
        assertEquals(theory, store.idFor("theory"));
        assertEquals("mind", store.stringFor(mind));
        assertTrue(store.contains("theory"));
        assertFalse(store.contains("brain"));
        assertEquals(3, store.size());
    }

    @Test
    @DisplayName("Unknown id throws")
    void unknownIdThrows() {
        InMemoryStringStore store = new InMemoryStringStore();
        assertThrows(IndexOutOfBoundsException.class, () -> store.stringFor(5));
        assertThrows(IndexOutOfBoundsException.class, () -> store.stringFor(-1));
    }

    @Test
    @DisplayName("Strings file preserves ids")
    void stringsFilePreservesIds(@TempDir Path tempDir) throws IOException {
        InMemoryStringStore store = new InMemoryStringStore();
        store.idFor("theory");
        store.idFor("Łódź");
        store.idFor("\"quoted\"");

        Path file = tempDir.resolve("strings.json");
        StringsFile.write(store, file);

        InMemoryStringStore restored = new InMemoryStringStore();
        int read = StringsFile.readInto(restored, file);

        assertEquals(3, read);
        assertEquals(store.size(), restored.size());
        for (int id = 0; id < store.size(); id++) {
            assertEquals(store.stringFor(id), restored.stringFor(id));
        }
    }

    @Test
    @DisplayName("Missing or malformed strings file fails")
    void badStringsFile(@TempDir Path tempDir) throws IOException {
        InMemoryStringStore store = new InMemoryStringStore();
        assertThrows(FileNotFoundException.class,
            () -> StringsFile.readInto(store, tempDir.resolve("missing.json")));

        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "[\"a\", ");
        assertThrows(IOException.class, () -> StringsFile.readInto(store, broken));
    }

    @Test
    @DisplayName("Hash is stable and never the reserved key")
    void hashIsStable() {
        assertEquals(StringHash.hash64("theory"), StringHash.hash64("theory"));
        assertNotEquals(StringHash.hash64("theory"), StringHash.hash64("Theory"));
        assertNotEquals(Long.MIN_VALUE, StringHash.hash64(""));
    }

    @Test
    @DisplayName("Symbols are interned in a fixed order")
    void symbolsInterned() {
        InMemoryStringStore first = new InMemoryStringStore();
        InMemoryStringStore second = new InMemoryStringStore();
        Symbols.internAll(first);
        Symbols.internAll(second);

        assertEquals(first.size(), second.size());
        assertEquals(Symbols.ALL.size() + 1, first.size());
        for (String symbol : Symbols.ALL) {
            assertEquals(first.idFor(symbol), second.idFor(symbol));
        }
    }
}
