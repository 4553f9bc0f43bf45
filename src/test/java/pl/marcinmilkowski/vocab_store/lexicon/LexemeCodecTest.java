package pl.marcinmilkowski.vocab_store.lexicon;

import org.apache.lucene.util.BytesRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import pl.marcinmilkowski.vocab_store.attrs.DefaultLexAttrs;
import pl.marcinmilkowski.vocab_store.config.VocabConfig;
import pl.marcinmilkowski.vocab_store.strings.InMemoryStringStore;

import java.io.IOException;
import java.io.StringReader;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LexemeCodec and bulk export/import.
 */
class LexemeCodecTest {

    @Test
    @DisplayName("Record size is 60 bytes")
    void recordSize() {
        assertEquals(60, LexemeCodec.RECORD_SIZE);
        Vocab vocab = new Vocab();
        assertEquals(60, LexemeCodec.encode(vocab.get("theory")).length);
    }

    @Test
    @DisplayName("Encode and decode a single lexeme")
    void encodeDecode() throws IOException {
        Vocab vocab = new Vocab();
        DefaultLexAttrs.install(vocab);
        vocab.loadVectors(new StringReader("Theory 3.0 4.0\n"), "test");
        Lexeme lex = vocab.get("Theory");
        lex.setSentiment(0.25f);
        lex.setCluster(99);
        assertEquals(5.0f, lex.l2Norm());

        BytesRef encoded = LexemeCodec.encode(lex);
        Lexeme decoded = LexemeCodec.decode(encoded, Arena.scratch(), vocab.emptyVector());

        assertEquals(lex.flags(), decoded.flags());
        assertEquals(lex.id(), decoded.id());
        assertEquals(lex.length(), decoded.length());
        assertEquals(lex.orth(), decoded.orth());
        assertEquals(lex.lower(), decoded.lower());
        assertEquals(lex.norm(), decoded.norm());
        assertEquals(lex.shape(), decoded.shape());
        assertEquals(lex.prefix(), decoded.prefix());
        assertEquals(lex.suffix(), decoded.suffix());
        assertEquals(99, decoded.cluster());
        assertEquals(lex.prob(), decoded.prob());
        assertEquals(0.25f, decoded.sentiment());

        // vectors are not part of the record
        assertSame(vocab.emptyVector(), decoded.vector());
        assertEquals(0.0f, decoded.l2Norm());
    }

    @Test
    @DisplayName("Decode rejects records of the wrong size")
    void wrongSize() {
        assertThrows(IOException.class,
            () -> LexemeCodec.decode(new BytesRef(new byte[59]), Arena.scratch(), new float[0]));
        assertThrows(IOException.class,
            () -> LexemeCodec.decode(null, Arena.scratch(), new float[0]));
    }

    @Test
    @DisplayName("Decode honours the BytesRef offset")
    void decodeWithOffset() throws IOException {
        Vocab vocab = new Vocab();
        Lexeme lex = vocab.get("offset");
        BytesRef encoded = LexemeCodec.encode(lex);

        byte[] padded = new byte[encoded.length + 7];
        System.arraycopy(encoded.bytes, encoded.offset, padded, 7, encoded.length);
        Lexeme decoded = LexemeCodec.decode(new BytesRef(padded, 7, encoded.length), Arena.scratch(), new float[0]);

        assertEquals(lex.orth(), decoded.orth());
        assertEquals(lex.id(), decoded.id());
    }

    @Test
    @DisplayName("Export and import into a table sharing the string store")
    void exportImport() throws IOException {
        Vocab source = new Vocab();
        DefaultLexAttrs.install(source);
        for (String w : new String[] {"The", "quick", "brown", "fox", "42", "http://example.com"}) {
            source.get(w);
        }
        source.get("fox").setProb(-3.5f);

        byte[] blob = source.exportLexemes();
        assertEquals(6 * LexemeCodec.RECORD_SIZE, blob.length);

        Vocab target = new Vocab(source.strings(), VocabConfig.defaults());
        int imported = target.importLexemes(blob);

        assertEquals(6, imported);
        assertEquals(7, target.length());
        assertEquals(6, target.size());
        for (Lexeme original : source) {
            String text = source.text(original);
            assertTrue(target.contains(text));
            Lexeme copy = target.get(text);
            assertEquals(original.orth(), copy.orth());
            assertEquals(original.length(), copy.length());
            assertEquals(original.flags(), copy.flags());
            assertEquals(original.prob(), copy.prob());
            assertEquals(original.id(), copy.id());
            assertSame(target.emptyVector(), copy.vector());
        }
        assertEquals(-3.5f, target.get("fox").prob());
        assertSame(target.get("fox"), target.getByOrth(source.strings().idFor("fox")));
    }

    @Test
    @DisplayName("Partial trailing record fails before importing anything")
    void partialRecord() {
        Vocab source = new Vocab();
        source.get("alpha");
        source.get("beta");
        byte[] blob = source.exportLexemes();

        Vocab target = new Vocab(source.strings(), VocabConfig.defaults());
        byte[] truncated = Arrays.copyOf(blob, blob.length - 1);

        assertThrows(IOException.class, () -> target.importLexemes(truncated));
        assertEquals(0, target.size());
        assertEquals(1, target.length());
    }

    @Test
    @DisplayName("Import against a foreign string store is a consistency fault")
    void foreignStrings() {
        Vocab source = new Vocab();
        source.get("alpha");
        byte[] blob = source.exportLexemes();

        Vocab target = new Vocab(new InMemoryStringStore(), VocabConfig.defaults());
        assertThrows(LexiconConsistencyException.class, () -> target.importLexemes(blob));
    }

    @Test
    @DisplayName("Empty blob imports nothing")
    void emptyBlob() throws IOException {
        Vocab target = new Vocab();
        assertEquals(0, target.importLexemes(new byte[0]));
        assertEquals(0, target.exportLexemes().length);
    }
}
