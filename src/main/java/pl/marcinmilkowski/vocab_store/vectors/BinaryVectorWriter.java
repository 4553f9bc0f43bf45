package pl.marcinmilkowski.vocab_store.vectors;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes word vectors in the vec.bin layout read by {@link BinaryVectorReader}:
 * little-endian int32 word length, int32 vector length, UTF-8 word bytes,
 * then the float32 components.
 */
public class BinaryVectorWriter implements Closeable {

    private final OutputStream out;
    private int dimension = -1;
    private ByteBuffer buffer;
    private long written;

    public BinaryVectorWriter(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        this.out = new BufferedOutputStream(Files.newOutputStream(path));
    }

    public BinaryVectorWriter(OutputStream out) {
        this.out = new BufferedOutputStream(out);
    }

    public void write(String word, float[] vector) throws IOException {
        if (word == null || vector == null) {
            throw new IllegalArgumentException("word and vector must not be null");
        }
        if (dimension == -1) {
            dimension = vector.length;
        } else if (dimension != vector.length) {
            throw new IllegalArgumentException(
                "Vector dimension mismatch for '" + word + "'. Expected: " + dimension + ", Got: " + vector.length);
        }

        byte[] wordBytes = word.getBytes(StandardCharsets.UTF_8);
        int size = 8 + wordBytes.length + vector.length * Float.BYTES;
        if (buffer == null || buffer.capacity() < size) {
            buffer = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        } else {
            buffer.clear();
        }

        buffer.putInt(wordBytes.length);
        buffer.putInt(vector.length);
        buffer.put(wordBytes);
        for (float value : vector) {
            buffer.putFloat(value);
        }

        buffer.flip();
        out.write(buffer.array(), 0, buffer.limit());
        written++;
    }

    public long recordCount() {
        return written;
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
