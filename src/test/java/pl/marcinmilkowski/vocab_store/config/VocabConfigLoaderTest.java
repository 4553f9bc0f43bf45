package pl.marcinmilkowski.vocab_store.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class VocabConfigLoaderTest {

    @Test
    @DisplayName("Bundled defaults match the built-in defaults")
    void bundledDefaults() throws IOException {
        assertEquals(VocabConfig.defaults(), VocabConfigLoader.loadDefaults());
    }

    @Test
    @DisplayName("Missing keys fall back to defaults")
    void partialConfig() {
        VocabConfig config = VocabConfigLoader.parse("{\"oov_warmup\": 0, \"oov_prob\": -12.5}");

        assertEquals(0, config.oovWarmup());
        assertEquals(-12.5f, config.oovProb());
        assertEquals(VocabConfig.DEFAULT_MIN_OOV_LENGTH, config.minOovLength());
        assertEquals(VocabConfig.DEFAULT_MAX_VECTOR_COMPONENTS, config.maxVectorComponents());
    }

    @Test
    @DisplayName("Unknown key is rejected")
    void unknownKey() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> VocabConfigLoader.parse("{\"oov_warmpu\": 5}"));
        assertTrue(e.getMessage().contains("oov_warmpu"));
    }

    @Test
    @DisplayName("Out-of-range and malformed values are rejected")
    void invalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> VocabConfigLoader.parse("{\"min_oov_length\": -1}"));
        assertThrows(IllegalArgumentException.class,
            () -> VocabConfigLoader.parse("{\"max_vector_components\": 1}"));
        assertThrows(IllegalArgumentException.class,
            () -> VocabConfigLoader.parse("{\"oov_warmup\": "));
    }

    @Test
    @DisplayName("Load from file")
    void loadFromFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("vocab.json");
        Files.writeString(file, "{\"min_oov_length\": 5}");

        assertEquals(5, VocabConfigLoader.load(file).minOovLength());
        assertThrows(IOException.class, () -> VocabConfigLoader.load(tempDir.resolve("missing.json")));
    }

    @Test
    @DisplayName("withOovWarmup changes only the warm-up")
    void withOovWarmup() {
        VocabConfig config = VocabConfig.defaults().withOovWarmup(0);
        assertEquals(0, config.oovWarmup());
        assertEquals(VocabConfig.DEFAULT_MIN_OOV_LENGTH, config.minOovLength());
    }
}
