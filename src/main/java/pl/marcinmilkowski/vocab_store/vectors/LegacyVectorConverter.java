package pl.marcinmilkowski.vocab_store.vectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Converts a text vector file into vec.bin without building a vocabulary.
 *
 * Inputs whose name ends in ".gz" are read through gzip.
 */
public final class LegacyVectorConverter {

    private static final Logger log = LoggerFactory.getLogger(LegacyVectorConverter.class);

    private LegacyVectorConverter() {
    }

    /**
     * @return number of vectors written
     */
    public static long convert(Path input, Path output) throws IOException {
        if (!Files.exists(input)) {
            throw new FileNotFoundException("Vector source not found: " + input);
        }

        long count;
        try (InputStream raw = Files.newInputStream(input);
             TextVectorReader reader = new TextVectorReader(
                 new InputStreamReader(decompressed(input, raw), StandardCharsets.UTF_8), input.toString());
             BinaryVectorWriter writer = new BinaryVectorWriter(output)) {
            VectorRecord record;
            while ((record = reader.next()) != null) {
                writer.write(record.word(), record.vector());
            }
            count = writer.recordCount();
            log.info("Converted {} vectors of dimension {} from {} to {}",
                count, Math.max(0, reader.dimension()), input, output);
        }
        return count;
    }

    private static InputStream decompressed(Path input, InputStream raw) throws IOException {
        return input.getFileName().toString().endsWith(".gz") ? new GZIPInputStream(raw) : raw;
    }

    public static void main(String[] args) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: LegacyVectorConverter <vectors.txt[.gz]> <vec.bin>");
            System.exit(1);
        }

        convert(Path.of(args[0]), Path.of(args[1]));
    }
}
