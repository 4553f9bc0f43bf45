package pl.marcinmilkowski.vocab_store.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_store.config.VocabConfig;
import pl.marcinmilkowski.vocab_store.strings.InMemoryStringStore;
import pl.marcinmilkowski.vocab_store.strings.StringsFile;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads a vocab directory:
 * - strings.json: interned strings in id order
 * - lexemes.bin: fixed-width lexeme records ({@link LexemeCodec})
 * - vec.bin: word vectors, only when the vocab has any
 *
 * Attribute getters are code and are not saved; register them again after loading.
 */
public final class VocabStore {

    private static final Logger log = LoggerFactory.getLogger(VocabStore.class);

    public static final String STRINGS_FILE = "strings.json";
    public static final String LEXEMES_FILE = "lexemes.bin";
    public static final String VECTORS_FILE = "vec.bin";

    private VocabStore() {
    }

    public static void save(Vocab vocab, Path dir) throws IOException {
        Files.createDirectories(dir);
        StringsFile.write(vocab.strings(), dir.resolve(STRINGS_FILE));
        Files.write(dir.resolve(LEXEMES_FILE), vocab.exportLexemes());
        if (vocab.vectorsLength() > 0) {
            vocab.dumpVectors(dir.resolve(VECTORS_FILE));
        }
        log.info("Saved vocab to {}: {} lexemes, {} strings, vector dimension {}",
            dir, vocab.size(), vocab.strings().size(), vocab.vectorsLength());
    }

    public static Vocab load(Path dir) throws IOException {
        return load(dir, VocabConfig.defaults());
    }

    public static Vocab load(Path dir, VocabConfig config) throws IOException {
        Path lexemesPath = dir.resolve(LEXEMES_FILE);
        if (!Files.exists(lexemesPath)) {
            throw new FileNotFoundException("Lexemes file not found: " + lexemesPath);
        }

        InMemoryStringStore strings = new InMemoryStringStore();
        StringsFile.readInto(strings, dir.resolve(STRINGS_FILE));

        Vocab vocab = new Vocab(strings, config);
        int imported = vocab.importLexemes(Files.readAllBytes(lexemesPath));

        Path vectorsPath = dir.resolve(VECTORS_FILE);
        if (Files.exists(vectorsPath)) {
            vocab.restoreVectors(vectorsPath);
        }
        log.info("Loaded vocab from {}: {} lexemes, {} strings, vector dimension {}",
            dir, imported, strings.size(), vocab.vectorsLength());
        return vocab;
    }
}
