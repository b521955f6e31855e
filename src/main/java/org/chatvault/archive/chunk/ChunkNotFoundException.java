package org.chatvault.archive.chunk;

/**
 * Thrown when a group key has no chunks in the log at all. Permanent: retrying will not help.
 */
public class ChunkNotFoundException extends ChunkLookupException {

    public ChunkNotFoundException(GroupId groupId) {
        super(groupId, "not found: " + groupId);
    }
}
