package pl.marcinmilkowski.vocab_store.vectors;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reader for vec.bin files written by {@link BinaryVectorWriter}.
 *
 * File format, repeated until end of file (all little-endian):
 * - wordLen (int32)
 * - vectorLen (int32)
 * - word (UTF-8 bytes, wordLen)
 * - components (float32 x vectorLen)
 *
 * End of file before a record starts ends the stream; end of file inside a
 * record is an error.
 */
public class BinaryVectorReader implements Closeable {

    public static final int DEFAULT_MAX_COMPONENTS = 100_000;

    private final DataInputStream dis;
    private final String source;
    private final int maxComponents;
    private final byte[] intBytes = new byte[4];

    private int recordNum = 0;
    private int dimension = 0;

    public BinaryVectorReader(Path path, int maxComponents) throws IOException {
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Vector file not found: " + path);
        }
        this.dis = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)));
        this.source = path.toString();
        this.maxComponents = maxComponents;
    }

    public BinaryVectorReader(InputStream in, String source, int maxComponents) {
        this.dis = new DataInputStream(new BufferedInputStream(in));
        this.source = source;
        this.maxComponents = maxComponents;
    }

    /**
     * Returns the next record, or null at a clean end of file.
     */
    public VectorRecord next() throws IOException {
        int firstByte = dis.read();
        if (firstByte < 0) {
            return null;
        }
        try {
            intBytes[0] = (byte) firstByte;
            dis.readFully(intBytes, 1, 3);
            int wordLen = ByteBuffer.wrap(intBytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
            int vecLen = readIntLE();

            if (dimension != 0 && vecLen != dimension) {
                throw VectorReadException.mismatchedSizes(source, recordNum, dimension, vecLen);
            }
            if (vecLen < 1 || vecLen >= maxComponents) {
                throw VectorReadException.badSize(source, recordNum, vecLen, maxComponents);
            }
            if (wordLen < 0) {
                throw new VectorReadException("Error reading word vectors from " + source
                    + ": record " + recordNum + " declares negative word length " + wordLen, recordNum);
            }

            byte[] wordBytes = new byte[wordLen];
            dis.readFully(wordBytes);

            byte[] vecBytes = new byte[vecLen * Float.BYTES];
            dis.readFully(vecBytes);
            float[] vector = new float[vecLen];
            ByteBuffer.wrap(vecBytes).order(ByteOrder.LITTLE_ENDIAN).asFloatBuffer().get(vector);

            dimension = vecLen;
            return new VectorRecord(recordNum++, new String(wordBytes, StandardCharsets.UTF_8), vector);
        } catch (EOFException eof) {
            throw new VectorReadException("Error reading word vectors from " + source
                + ": truncated record " + recordNum, recordNum, eof);
        }
    }

    /**
     * Vector length agreed by the records read so far, 0 before the first record.
     */
    public int dimension() {
        return dimension;
    }

    private int readIntLE() throws IOException {
        dis.readFully(intBytes);
        return ByteBuffer.wrap(intBytes).order(ByteOrder.LITTLE_ENDIAN).getInt();
    }

    @Override
    public void close() throws IOException {
        dis.close();
    }
}
