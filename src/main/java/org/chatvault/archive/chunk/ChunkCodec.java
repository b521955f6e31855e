package org.chatvault.archive.chunk;

import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON Lines codec for chunk logs.
 * <p>
 * Each record is one JSON object followed by {@code '\n'}. The parser never closes the
 * underlying stream, so a channel can be repositioned and read again after a record was
 * decoded from it.
 * <p>
 * <strong>Thread Safety:</strong> the shared {@link ObjectMapper} is thread-safe; parsers
 * returned by {@link #parser(InputStream)} are not.
 */
public final class ChunkCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper(JsonFactory.builder()
            .disable(StreamReadFeature.AUTO_CLOSE_SOURCE)
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final byte NEWLINE = '\n';

    private ChunkCodec() {
    }

    /**
     * @return the mapper used for the log format, shared with the replay harness
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Serializes one chunk into a complete, newline-terminated record.
     *
     * @param chunk the chunk to encode
     * @return the record bytes
     * @throws JsonProcessingException if the chunk cannot be serialized
     */
    public static byte[] encode(Chunk chunk) throws JsonProcessingException {
        byte[] json = MAPPER.writeValueAsBytes(chunk);
        byte[] record = new byte[json.length + 1];
        System.arraycopy(json, 0, record, 0, json.length);
        record[json.length] = NEWLINE;
        return record;
    }

    /**
     * Creates a parser reading records from {@code in}. Closing the parser leaves {@code in} open.
     */
    public static JsonParser parser(InputStream in) throws IOException {
        return MAPPER.createParser(in);
    }

    /**
     * Advances to the next record.
     *
     * @param parser a parser created by {@link #parser(InputStream)}
     * @param base   absolute offset the parser's input started at
     * @return absolute byte offset of the next record, or {@code -1} at end of stream
     * @throws ChunkDecodeException if the input at the current position is not a JSON object
     */
    public static long nextRecord(JsonParser parser, long base) throws ChunkDecodeException {
        long offset = base + parser.currentLocation().getByteOffset();
        try {
            JsonToken token = parser.nextToken();
            if (token == null) {
                return -1;
            }
            offset = base + parser.currentTokenLocation().getByteOffset();
            if (token != JsonToken.START_OBJECT) {
                throw new ChunkDecodeException(offset, new IOException("expected a JSON object, got " + token));
            }
            return offset;
        } catch (ChunkDecodeException e) {
            throw e;
        } catch (IOException e) {
            throw new ChunkDecodeException(offset, e);
        }
    }

    /**
     * Binds the record the parser is positioned at.
     *
     * @param parser parser positioned on the record's opening brace
     * @param offset absolute offset of the record, for diagnostics
     * @return the decoded chunk
     * @throws ChunkDecodeException if the record is malformed
     */
    public static Chunk read(JsonParser parser, long offset) throws ChunkDecodeException {
        try {
            return MAPPER.readValue(parser, Chunk.class);
        } catch (IOException e) {
            throw new ChunkDecodeException(offset, e);
        }
    }
}
