package pl.marcinmilkowski.vocab_store.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.vocab_store.config.VocabConfig;
import pl.marcinmilkowski.vocab_store.strings.InMemoryStringStore;
import pl.marcinmilkowski.vocab_store.strings.StringHash;
import pl.marcinmilkowski.vocab_store.strings.StringStore;
import pl.marcinmilkowski.vocab_store.strings.Symbols;
import pl.marcinmilkowski.vocab_store.vectors.BinaryVectorReader;
import pl.marcinmilkowski.vocab_store.vectors.BinaryVectorWriter;
import pl.marcinmilkowski.vocab_store.vectors.TextVectorReader;
import pl.marcinmilkowski.vocab_store.vectors.VectorMath;
import pl.marcinmilkowski.vocab_store.vectors.VectorRecord;

import java.io.Closeable;
import java.io.IOException;
import java.io.NotSerializableException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Reader;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Deduplicated table of lexemes keyed by surface string.
 *
 * Every distinct non-empty string gets exactly one permanent lexeme, created
 * on first lookup by running the registered attribute getters once. Lexemes
 * are indexed twice: by 64-bit string hash and by orth (string id).
 *
 * Lookups may pass a scratch {@link Arena}. Once the table is past its warm-up
 * size, new strings of at least {@link VocabConfig#minOovLength()} characters
 * are then created in the scratch arena as out-of-vocabulary lexemes
 * (id 0) that are never indexed.
 *
 * Not thread-safe; one instance per vocabulary session.
 */
public class Vocab implements Iterable<Lexeme>, Closeable, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Logger logger = LoggerFactory.getLogger(Vocab.class);

    private final transient StringStore strings;
    private final transient VocabConfig config;
    private final transient Arena mem;
    private final transient LongObjectHashMap<Lexeme> byHash = new LongObjectHashMap<>();
    private final transient LongObjectHashMap<Lexeme> byOrth = new LongObjectHashMap<>();
    private final transient AttributePipeline getters = new AttributePipeline();
    private final transient Lexeme emptyLexeme;

    private transient float[] emptyVector = new float[0];
    private transient int vectorsLength = 0;
    // id 0 is reserved for the empty lexeme and OOV lexemes
    private transient int length = 1;

    public Vocab() {
        this(new InMemoryStringStore(), VocabConfig.defaults());
    }

    public Vocab(StringStore strings, VocabConfig config) {
        this.strings = strings;
        this.config = config;
        this.mem = Arena.permanent("vocab");
        Symbols.internAll(strings);
        this.emptyLexeme = new Lexeme(null, emptyVector);
    }

    public StringStore strings() {
        return strings;
    }

    public VocabConfig config() {
        return config;
    }

    /**
     * The arena owning all permanent lexemes and their vectors.
     */
    public Arena arena() {
        return mem;
    }

    /**
     * Insertion counter: 1 + number of permanent insertions (including imports).
     */
    public int length() {
        return length;
    }

    /**
     * Number of distinct lexemes in the permanent table.
     */
    public int size() {
        return byOrth.size();
    }

    public Lexeme emptyLexeme() {
        return emptyLexeme;
    }

    // ---------------------------------------------------------------- lookup

    public Lexeme get(String string) {
        return get(string, null);
    }

    /**
     * Returns the lexeme for {@code string}, creating it on a miss.
     *
     * @param scratch arena for out-of-vocabulary lexemes, or null to always insert
     * @throws LexiconConsistencyException if the indexed lexeme does not match the string store
     */
    public Lexeme get(String string, Arena scratch) {
        if (string == null || string.isEmpty()) {
            return emptyLexeme;
        }
        Lexeme lex = byHash.get(StringHash.hash64(string));
        if (lex != null) {
            int expected = strings.idFor(string);
            if (lex.orth != expected) {
                throw LexiconConsistencyException.mismatchedStrings(lex.orth, expected, string);
            }
            return lex;
        }
        return newLexeme(scratch, string);
    }

    public Lexeme getByOrth(int orth) {
        return getByOrth(orth, null);
    }

    /**
     * Returns the lexeme for a string id, creating it from the string store on a miss.
     */
    public Lexeme getByOrth(int orth, Arena scratch) {
        if (orth == 0) {
            return emptyLexeme;
        }
        Lexeme lex = byOrth.get(orth);
        if (lex != null) {
            return lex;
        }
        return newLexeme(scratch, strings.stringFor(orth));
    }

    public boolean contains(String string) {
        if (string == null || string.isEmpty()) {
            return false;
        }
        return byHash.containsKey(StringHash.hash64(string));
    }

    /**
     * The string a lexeme was created from.
     */
    public String text(Lexeme lexeme) {
        return strings.stringFor(lexeme.orth);
    }

    /**
     * Iterates permanent lexemes in by-hash index order, which is not stable.
     */
    @Override
    public Iterator<Lexeme> iterator() {
        return byHash.iterator();
    }

    private Lexeme newLexeme(Arena scratch, String string) {
        Arena arena = scratch != null ? scratch : mem;
        if (string.length() < config.minOovLength() || length < config.oovWarmup()) {
            arena = mem;
        }
        boolean oov = arena != mem;

        Lexeme lex = arena.allocLexeme(emptyVector);
        lex.orth = strings.idFor(string);
        lex.length = string.length();
        lex.id = length;
        getters.apply(lex, string, strings);

        if (oov) {
            lex.id = 0;
        } else {
            addToIndex(StringHash.hash64(string), lex);
        }
        return lex;
    }

    private void addToIndex(long key, Lexeme lex) {
        byHash.put(key, lex);
        byOrth.put(lex.orth, lex);
        length++;
    }

    // ------------------------------------------------------------ attributes

    /**
     * Registers a getter run for every lexeme created from now on.
     * Existing lexemes are not updated; use {@link #addFlag} for retroactive flags.
     */
    public void registerGetter(AttrKey key, LexAttrGetter getter) {
        getters.register(key, getter);
    }

    public AttributePipeline attributeGetters() {
        return getters;
    }

    /**
     * Adds a flag on the lowest bit that has no getter yet.
     *
     * @return the assigned bit
     * @throws IllegalArgumentException if all bits 1..63 are taken
     */
    public int addFlag(LexAttrGetter flagGetter) {
        int bit = getters.lowestFreeFlagBit();
        if (bit == -1) {
            throw new IllegalArgumentException("Cannot find empty bit for new lexical flag. "
                + "All bits between 1 and 63 are occupied. Pass a flag id explicitly to replace one.");
        }
        return addFlag(flagGetter, bit);
    }

    /**
     * Sets {@code flagId} on every existing permanent lexeme from {@code flagGetter}
     * and registers the getter for lexemes created later.
     *
     * @throws IllegalArgumentException if flagId is outside [1,63]
     */
    public int addFlag(LexAttrGetter flagGetter, int flagId) {
        if (!Flags.isValidBit(flagId)) {
            throw new IllegalArgumentException("Invalid value for flag id: " + flagId
                + ". Flag ids must be between 1 and 63 (inclusive)");
        }
        AttrKey key = AttrKey.flag(flagId);
        for (Lexeme lex : byOrth) {
            Object value = flagGetter.get(text(lex));
            lex.setAttr(key, value == null ? Integer.valueOf(0) : AttributePipeline.toNumber(key, value, strings));
        }
        getters.register(key, flagGetter);
        logger.debug("Registered flag {} on {} existing lexemes", flagId, byOrth.size());
        return flagId;
    }

    // --------------------------------------------------------------- vectors

    public int vectorsLength() {
        return vectorsLength;
    }

    /**
     * Shared all-zero vector of {@link #vectorsLength()} components. Read-only.
     */
    public float[] emptyVector() {
        return emptyVector;
    }

    /**
     * Replaces a lexeme's vector with a copy of {@code values} allocated from
     * the lexeme's own arena.
     */
    public void setVector(Lexeme lexeme, float[] values) {
        if (lexeme == emptyLexeme) {
            throw new IllegalArgumentException("The empty lexeme cannot have a vector");
        }
        if (values.length != vectorsLength) {
            throw new IllegalArgumentException("Vector has " + values.length
                + " components, vocab vectors have " + vectorsLength);
        }
        float[] buf = lexeme.owner.allocVector(values.length);
        System.arraycopy(values, 0, buf, 0, values.length);
        assignVector(lexeme, buf);
    }

    public boolean hasVector(Lexeme lexeme) {
        return vectorsLength > 0 && !VectorMath.isZero(lexeme.vector);
    }

    /**
     * Cosine similarity of two lexemes' vectors, 0 if either has none.
     */
    public double similarity(Lexeme a, Lexeme b) {
        return VectorMath.cosine(a.vector, a.l2Norm, b.vector, b.l2Norm);
    }

    /**
     * Loads whitespace-delimited text vectors. Each word's lexeme is created in
     * the permanent table and gets its own buffer.
     *
     * @return the vector dimension
     */
    public int loadVectors(Reader reader, String source) throws IOException {
        int count = 0;
        int dimension;
        try (TextVectorReader in = new TextVectorReader(reader, source)) {
            try {
                VectorRecord record;
                while ((record = in.next()) != null) {
                    Lexeme lex = getByOrth(strings.idFor(record.word()));
                    float[] buf = mem.allocVector(record.dimension());
                    System.arraycopy(record.vector(), 0, buf, 0, buf.length);
                    assignVector(lex, buf);
                    count++;
                }
            } catch (IOException | RuntimeException e) {
                // vectors assigned so far stay; keep every buffer at one length
                if (count > 0) {
                    conformVectors(in.dimension());
                }
                throw e;
            }
            dimension = in.dimension();
        }
        if (count == 0) {
            logger.warn("No vectors in {}; keeping vector dimension {}", source, vectorsLength);
            return vectorsLength;
        }
        conformVectors(dimension);
        logger.info("Loaded {} text vectors of dimension {} from {}", count, dimension, source);
        return dimension;
    }

    public int loadVectors(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return loadVectors(reader, path.toString());
        }
    }

    /**
     * Loads vec.bin. Vectors are keyed by the loaded word's orth, and each
     * permanent lexeme then takes the vector stored for its LOWER attribute, so
     * case variants share the lowercase word's vector. Lexemes without a
     * matching entry get the empty vector.
     *
     * @return the vector dimension
     */
    public int loadVectorsFromBin(Path path) throws IOException {
        List<float[]> vectors = new ArrayList<>();
        int dimension;
        try (BinaryVectorReader in = new BinaryVectorReader(path, config.maxVectorComponents())) {
            VectorRecord record;
            while ((record = in.next()) != null) {
                int orth = strings.idFor(record.word());
                getByOrth(orth);
                while (orth >= vectors.size()) {
                    vectors.add(null);
                }
                float[] buf = mem.allocVector(record.dimension());
                System.arraycopy(record.vector(), 0, buf, 0, buf.length);
                vectors.set(orth, buf);
            }
            dimension = in.dimension();
        }

        replaceEmptyVector(dimension);
        int assigned = 0;
        for (Lexeme lex : byOrth) {
            float[] vec = lex.lower < vectors.size() ? vectors.get(lex.lower) : null;
            if (vec != null) {
                assignVector(lex, vec);
                assigned++;
            } else {
                lex.vector = emptyVector;
                lex.l2Norm = 0.0f;
            }
        }
        vectorsLength = dimension;
        logger.info("Loaded binary vectors of dimension {} from {}; {} of {} lexemes have a vector",
            dimension, path, assigned, byOrth.size());
        return dimension;
    }

    /**
     * Reads a vec.bin written by {@link #dumpVectors}: each record goes back to
     * the lexeme of its own word. Lexemes without a record, or with an all-zero
     * one, get the empty vector.
     *
     * @return the vector dimension
     */
    public int restoreVectors(Path path) throws IOException {
        List<Lexeme> lexemes = new ArrayList<>();
        List<float[]> vectors = new ArrayList<>();
        int dimension;
        try (BinaryVectorReader in = new BinaryVectorReader(path, config.maxVectorComponents())) {
            VectorRecord record;
            while ((record = in.next()) != null) {
                lexemes.add(getByOrth(strings.idFor(record.word())));
                vectors.add(record.vector());
            }
            dimension = in.dimension();
        }

        replaceEmptyVector(dimension);
        for (Lexeme lex : byOrth) {
            lex.vector = emptyVector;
            lex.l2Norm = 0.0f;
        }
        int restored = 0;
        for (int i = 0; i < lexemes.size(); i++) {
            float[] values = vectors.get(i);
            if (VectorMath.isZero(values)) {
                continue;
            }
            float[] buf = mem.allocVector(values.length);
            System.arraycopy(values, 0, buf, 0, buf.length);
            assignVector(lexemes.get(i), buf);
            restored++;
        }
        vectorsLength = dimension;
        logger.info("Restored {} vectors of dimension {} from {}", restored, dimension, path);
        return dimension;
    }

    /**
     * Writes every permanent lexeme's vector in vec.bin format.
     */
    public void dumpVectors(Path path) throws IOException {
        if (vectorsLength == 0) {
            throw new IllegalStateException("Vocab has no vectors to dump");
        }
        try (BinaryVectorWriter writer = new BinaryVectorWriter(path)) {
            for (Lexeme lex : this) {
                writer.write(text(lex), lex.vector);
            }
            logger.info("Wrote {} vectors of dimension {} to {}", writer.recordCount(), vectorsLength, path);
        }
    }

    /**
     * Changes the vector dimension. Every permanent vector is reallocated to the
     * new size: on growth the old components are kept and the tail is zero, on
     * shrink vectors are truncated and their norms recomputed.
     */
    public void resizeVectors(int newSize) {
        if (newSize < 0) {
            throw new IllegalArgumentException("Vector size must be >= 0: " + newSize);
        }
        int oldSize = vectorsLength;
        conformVectors(newSize);
        logger.debug("Resized vectors from {} to {}", oldSize, newSize);
    }

    private void conformVectors(int dimension) {
        float[] oldEmpty = replaceEmptyVector(dimension);
        for (Lexeme lex : byOrth) {
            if (lex.vector == oldEmpty || lex.vector == emptyVector) {
                lex.vector = emptyVector;
                lex.l2Norm = 0.0f;
            } else if (lex.vector.length != dimension) {
                assignVector(lex, mem.reallocVector(lex.vector, dimension));
            }
        }
        vectorsLength = dimension;
    }

    /**
     * @return the previous empty vector
     */
    private float[] replaceEmptyVector(int dimension) {
        float[] old = emptyVector;
        if (old.length != dimension) {
            emptyVector = new float[dimension];
            emptyLexeme.vector = emptyVector;
        }
        return old;
    }

    private static void assignVector(Lexeme lex, float[] buf) {
        lex.vector = buf;
        lex.l2Norm = VectorMath.l2Norm(buf);
    }

    // ----------------------------------------------------------------- codec

    /**
     * Fixed-width records of all permanent lexemes in by-hash order.
     * Vectors are not included.
     */
    public byte[] exportLexemes() {
        ByteBuffer buf = ByteBuffer.allocate(byHash.size() * LexemeCodec.RECORD_SIZE)
            .order(ByteOrder.LITTLE_ENDIAN);
        for (Lexeme lex : byHash) {
            LexemeCodec.encodeTo(lex, buf);
        }
        return buf.array();
    }

    /**
     * Inserts lexemes from {@link #exportLexemes()} output. Each record's string
     * must already be in the string store under the same id. Imported lexemes
     * get the empty vector. Records imported before a failure stay in the table.
     *
     * @return number of records imported
     * @throws IOException                 if the blob is not a whole number of records
     * @throws LexiconConsistencyException if a record's orth does not round-trip
     */
    public int importLexemes(byte[] blob) throws IOException {
        if (blob.length % LexemeCodec.RECORD_SIZE != 0) {
            throw new IOException("Lexeme data length " + blob.length
                + " is not a multiple of the record size " + LexemeCodec.RECORD_SIZE);
        }
        ByteBuffer buf = ByteBuffer.wrap(blob).order(ByteOrder.LITTLE_ENDIAN);
        int count = 0;
        while (buf.hasRemaining()) {
            Lexeme lex = LexemeCodec.decodeFrom(buf, mem, emptyVector);
            String string;
            try {
                string = strings.stringFor(lex.orth);
            } catch (IndexOutOfBoundsException e) {
                throw new LexiconConsistencyException("Lexeme record " + count
                    + " refers to unknown string id " + lex.orth);
            }
            int roundTrip = strings.idFor(string);
            if (roundTrip != lex.orth) {
                throw LexiconConsistencyException.mismatchedStrings(lex.orth, roundTrip, string);
            }
            addToIndex(StringHash.hash64(string), lex);
            count++;
        }
        return count;
    }

    // ------------------------------------------------------------- lifecycle

    /**
     * Releases the permanent arena. The table cannot create lexemes afterwards.
     */
    @Override
    public void close() {
        mem.close();
    }

    private void writeObject(ObjectOutputStream out) throws IOException {
        throw new NotSerializableException("Vocab cannot be serialized as a whole; "
            + "use VocabStore.save to write strings.json and lexemes.bin");
    }

    private void readObject(ObjectInputStream in) throws IOException {
        throw new NotSerializableException("Vocab cannot be deserialized as a whole; use VocabStore.load");
    }
}
