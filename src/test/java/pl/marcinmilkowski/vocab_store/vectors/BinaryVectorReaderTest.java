package pl.marcinmilkowski.vocab_store.vectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the vec.bin reader and writer.
 */
class BinaryVectorReaderTest {

    private static byte[] write(String[] words, float[][] vectors) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (BinaryVectorWriter writer = new BinaryVectorWriter(out)) {
            for (int i = 0; i < words.length; i++) {
                writer.write(words[i], vectors[i]);
            }
        }
        return out.toByteArray();
    }

    private static BinaryVectorReader reader(byte[] data, int max) {
        return new BinaryVectorReader(new ByteArrayInputStream(data), "test.bin", max);
    }

    private static byte[] header(int wordLen, int vecLen) {
        return ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putInt(wordLen).putInt(vecLen).array();
    }

    @Test
    @DisplayName("Records come back in order")
    void readsRecords() throws IOException {
        byte[] data = write(new String[] {"zażółć", "b"}, new float[][] {{1f, 2f}, {-3f, 4.5f}});

        try (BinaryVectorReader in = reader(data, BinaryVectorReader.DEFAULT_MAX_COMPONENTS)) {
            VectorRecord first = in.next();
            assertEquals("zażółć", first.word());
            assertArrayEquals(new float[] {1f, 2f}, first.vector());
            assertEquals(2, in.dimension());

            VectorRecord second = in.next();
            assertEquals(1, second.index());
            assertArrayEquals(new float[] {-3f, 4.5f}, second.vector());

            assertNull(in.next());
        }
    }

    @Test
    @DisplayName("Layout is little-endian lengths, UTF-8 word, float32 components")
    void layout() throws IOException {
        byte[] data = write(new String[] {"ab"}, new float[][] {{1.0f}});

        ByteBuffer buf = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);
        assertEquals(2 * 4 + 2 + 4, data.length);
        assertEquals(2, buf.getInt());
        assertEquals(1, buf.getInt());
        assertEquals('a', buf.get());
        assertEquals('b', buf.get());
        assertEquals(1.0f, buf.getFloat());
    }

    @Test
    @DisplayName("Empty stream is a clean end")
    void emptyStream() throws IOException {
        try (BinaryVectorReader in = reader(new byte[0], 10)) {
            assertNull(in.next());
            assertEquals(0, in.dimension());
        }
    }

    @Test
    @DisplayName("End of file inside a record fails")
    void truncatedRecord() throws IOException {
        byte[] data = write(new String[] {"a", "b"}, new float[][] {{1f, 2f}, {3f, 4f}});
        byte[] truncated = Arrays.copyOf(data, data.length - 2);

        try (BinaryVectorReader in = reader(truncated, 10)) {
            assertNotNull(in.next());
            VectorReadException e = assertThrows(VectorReadException.class, in::next);
            assertEquals(1, e.getIndex());
            assertTrue(e.getMessage().contains("truncated"));
        }
    }

    @Test
    @DisplayName("Vector length outside [1, max) fails")
    void badSize() throws IOException {
        try (BinaryVectorReader in = reader(header(1, 0), 10)) {
            assertThrows(VectorReadException.class, in::next);
        }
        byte[] data = write(new String[] {"a"}, new float[][] {{1f, 2f, 3f, 4f}});
        try (BinaryVectorReader in = reader(data, 4)) {
            VectorReadException e = assertThrows(VectorReadException.class, in::next);
            assertEquals(0, e.getIndex());
        }
    }

    @Test
    @DisplayName("Record with a different length than the first fails")
    void mismatchedRecord() throws IOException {
        byte[] first = write(new String[] {"a"}, new float[][] {{1f, 2f}});
        byte[] second = write(new String[] {"b"}, new float[][] {{1f, 2f, 3f}});
        byte[] data = Arrays.copyOf(first, first.length + second.length);
        System.arraycopy(second, 0, data, first.length, second.length);

        try (BinaryVectorReader in = reader(data, 10)) {
            in.next();
            VectorReadException e = assertThrows(VectorReadException.class, in::next);
            assertEquals(1, e.getIndex());
            assertTrue(e.getMessage().contains("expected 2"));
        }
    }

    @Test
    @DisplayName("Writer rejects mixed dimensions")
    void writerRejectsMixedDimensions() throws IOException {
        try (BinaryVectorWriter writer = new BinaryVectorWriter(new ByteArrayOutputStream())) {
            writer.write("a", new float[] {1f});
            assertThrows(IllegalArgumentException.class, () -> writer.write("b", new float[] {1f, 2f}));
            assertEquals(1, writer.recordCount());
        }
    }

    @Test
    @DisplayName("Missing file")
    void missingFile() {
        assertThrows(FileNotFoundException.class,
            () -> new BinaryVectorReader(Path.of("does-not-exist.bin"), 10));
    }

    @Test
    @DisplayName("Word bytes are decoded as UTF-8")
    void utf8Word() throws IOException {
        byte[] word = "€".getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(8 + word.length + 4).order(ByteOrder.LITTLE_ENDIAN);
        buf.putInt(word.length).putInt(1).put(word).putFloat(0.5f);

        try (BinaryVectorReader in = reader(buf.array(), 10)) {
            assertEquals("€", in.next().word());
        }
    }
}
