package pl.marcinmilkowski.vocab_store.vectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class TextVectorReaderTest {

    @Test
    @DisplayName("Reads word and components per line")
    void readsLines() throws IOException {
        try (TextVectorReader reader = new TextVectorReader(new StringReader("cat 0.5 -1.5\ndog 2 3e-1\n"), "test")) {
            assertEquals(-1, reader.dimension());

            VectorRecord cat = reader.next();
            assertEquals("cat", cat.word());
            assertEquals(0, cat.index());
            assertArrayEquals(new float[] {0.5f, -1.5f}, cat.vector());
            assertEquals(2, reader.dimension());

            VectorRecord dog = reader.next();
            assertEquals("dog", dog.word());
            assertArrayEquals(new float[] {2.0f, 0.3f}, dog.vector());

            assertNull(reader.next());
        }
    }

    @Test
    @DisplayName("Line starting with whitespace is the space token")
    void leadingWhitespace() throws IOException {
        try (TextVectorReader reader = new TextVectorReader(new StringReader(" 0.1 0.2\nx 1 2\n"), "test")) {
            VectorRecord space = reader.next();
            assertEquals(" ", space.word());
            assertArrayEquals(new float[] {0.1f, 0.2f}, space.vector());
            assertEquals("x", reader.next().word());
        }
    }

    @Test
    @DisplayName("Empty lines are skipped but counted")
    void emptyLinesCounted() throws IOException {
        try (TextVectorReader reader = new TextVectorReader(new StringReader("a 1 2\n\nb 3 4 5\n"), "test")) {
            reader.next();
            VectorReadException e = assertThrows(VectorReadException.class, reader::next);
            assertEquals(2, e.getIndex());
        }
    }

    @Test
    @DisplayName("Non-numeric component fails with the line index")
    void badNumber() throws IOException {
        try (TextVectorReader reader = new TextVectorReader(new StringReader("a 1 2\nb 3 four\n"), "bad.txt")) {
            reader.next();
            VectorReadException e = assertThrows(VectorReadException.class, reader::next);
            assertEquals(1, e.getIndex());
            assertTrue(e.getMessage().contains("four"));
            assertInstanceOf(NumberFormatException.class, e.getCause());
        }
    }
}
