package org.chatvault.archive.chunk;

/**
 * Thrown when every chunk of a group key has already been read.
 * <p>
 * This is the expected end of a pagination loop, not an error: callers draining a key stop
 * on it. Only {@link Player#reset()} makes the key readable again.
 */
public class ChunkExhaustedException extends ChunkLookupException {

    public ChunkExhaustedException(GroupId groupId) {
        super(groupId, "exhausted: " + groupId);
    }
}
