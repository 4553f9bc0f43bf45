package pl.marcinmilkowski.vocab_store.vectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.util.regex.Pattern;

/**
 * Reads whitespace-delimited text vectors, one word per line:
 * <pre>
 * word 0.1 -0.2 0.3
 * </pre>
 * A line that starts with whitespace is the vector of the space token " "
 * and all of its fields are components. Every line must have the component
 * count of the first one. Empty lines are skipped but still counted.
 */
public class TextVectorReader implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(TextVectorReader.class);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final BufferedReader reader;
    private final String source;

    private int lineNum = -1;
    private int dimension = -1;

    public TextVectorReader(Reader reader, String source) {
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.source = source;
    }

    /**
     * Returns the next vector, or null at end of input.
     *
     * @throws VectorReadException if the line's component count differs from the first line
     *                             or a component is not a number
     */
    public VectorRecord next() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            lineNum++;
            if (line.isEmpty()) {
                logger.warn("Skipping empty line {} in {}", lineNum, source);
                continue;
            }
            return parseLine(line);
        }
        return null;
    }

    /**
     * Component count agreed by the lines read so far, -1 before the first line.
     */
    public int dimension() {
        return dimension;
    }

    private VectorRecord parseLine(String line) throws VectorReadException {
        String trimmed = line.strip();
        String[] pieces = trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);

        String word;
        int first;
        if (Character.isWhitespace(line.charAt(0))) {
            word = " ";
            first = 0;
        } else {
            word = pieces[0];
            first = 1;
        }

        int count = pieces.length - first;
        if (dimension == -1) {
            dimension = count;
        } else if (dimension != count) {
            throw VectorReadException.mismatchedSizes(source, lineNum, dimension, count);
        }

        float[] vector = new float[count];
        for (int i = 0; i < count; i++) {
            String piece = pieces[first + i];
            try {
                vector[i] = Float.parseFloat(piece);
            } catch (NumberFormatException e) {
                throw new VectorReadException("Error reading word vectors from " + source
                    + ": invalid component '" + piece + "' on line " + lineNum, lineNum, e);
            }
        }
        return new VectorRecord(lineNum, word, vector);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
