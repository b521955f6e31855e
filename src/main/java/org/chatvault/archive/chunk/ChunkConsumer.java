package org.chatvault.archive.chunk;

import java.io.IOException;

/**
 * Callback of a full log scan that may fail with an I/O error.
 *
 * @see Player#forEach(ChunkConsumer)
 */
@FunctionalInterface
public interface ChunkConsumer {

    /**
     * Processes one chunk.
     *
     * @param chunk the chunk, in file order
     * @throws IOException to abort the scan
     */
    void accept(Chunk chunk) throws IOException;
}
