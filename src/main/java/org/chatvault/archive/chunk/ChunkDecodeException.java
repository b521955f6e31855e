package org.chatvault.archive.chunk;

import java.io.IOException;

/**
 * Thrown when a record of a chunk log cannot be parsed.
 * <p>
 * Indicates file corruption. During indexing it makes the whole log unusable; during a point
 * read it is surfaced with the offending byte offset and never retried.
 */
public class ChunkDecodeException extends IOException {

    private final long offset;

    public ChunkDecodeException(long offset, Throwable cause) {
        super("failed to decode chunk at offset " + offset + ": " + cause.getMessage(), cause);
        this.offset = offset;
    }

    /**
     * @return byte offset of the record that failed to decode
     */
    public long getOffset() {
        return offset;
    }
}
