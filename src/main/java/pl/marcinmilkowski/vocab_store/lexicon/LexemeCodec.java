package pl.marcinmilkowski.vocab_store.lexicon;

import org.apache.lucene.util.BytesRef;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Encodes/decodes lexemes as fixed-width records for lexemes.bin.
 *
 * Format (little-endian, {@value #RECORD_SIZE} bytes):
 * - flags: int64
 * - lang, id, length, orth, lower, norm, shape, prefix, suffix, cluster: int32 each
 * - prob, sentiment, l2Norm: float32 each
 *
 * The string itself is not stored; it is recovered from orth through the
 * string store. Vectors are not stored either.
 */
public final class LexemeCodec {

    public static final int RECORD_SIZE = Long.BYTES + 10 * Integer.BYTES + 3 * Float.BYTES;

    private LexemeCodec() {
    }

    public static BytesRef encode(Lexeme lexeme) {
        ByteBuffer buf = ByteBuffer.allocate(RECORD_SIZE).order(ByteOrder.LITTLE_ENDIAN);
        encodeTo(lexeme, buf);
        return new BytesRef(buf.array());
    }

    /**
     * Appends one record at the buffer's position. The buffer must be little-endian.
     */
    public static void encodeTo(Lexeme lex, ByteBuffer buf) {
        buf.putLong(lex.flags);
        buf.putInt(lex.lang);
        buf.putInt(lex.id);
        buf.putInt(lex.length);
        buf.putInt(lex.orth);
        buf.putInt(lex.lower);
        buf.putInt(lex.norm);
        buf.putInt(lex.shape);
        buf.putInt(lex.prefix);
        buf.putInt(lex.suffix);
        buf.putInt(lex.cluster);
        buf.putFloat(lex.prob);
        buf.putFloat(lex.sentiment);
        buf.putFloat(lex.l2Norm);
    }

    /**
     * Decodes one record into a lexeme allocated from {@code arena}. The vector is
     * set to {@code emptyVector} and the cached norm to 0.
     */
    public static Lexeme decode(BytesRef bytesRef, Arena arena, float[] emptyVector) throws IOException {
        if (bytesRef == null || bytesRef.length != RECORD_SIZE) {
            throw new IOException("Lexeme record must be " + RECORD_SIZE + " bytes, got "
                + (bytesRef == null ? 0 : bytesRef.length));
        }
        ByteBuffer buf = ByteBuffer.wrap(bytesRef.bytes, bytesRef.offset, bytesRef.length)
            .order(ByteOrder.LITTLE_ENDIAN);
        return decodeFrom(buf, arena, emptyVector);
    }

    static Lexeme decodeFrom(ByteBuffer buf, Arena arena, float[] emptyVector) {
        Lexeme lex = arena.allocLexeme(emptyVector);
        lex.flags = buf.getLong();
        lex.lang = buf.getInt();
        lex.id = buf.getInt();
        lex.length = buf.getInt();
        lex.orth = buf.getInt();
        lex.lower = buf.getInt();
        lex.norm = buf.getInt();
        lex.shape = buf.getInt();
        lex.prefix = buf.getInt();
        lex.suffix = buf.getInt();
        lex.cluster = buf.getInt();
        lex.prob = buf.getFloat();
        lex.sentiment = buf.getFloat();
        buf.getFloat(); // stored norm belongs to a vector that was not stored
        lex.l2Norm = 0.0f;
        return lex;
    }
}
