package org.chatvault.archive.chunk;

/**
 * Base class for point lookups that found no chunk to return.
 *
 * @see ChunkNotFoundException
 * @see ChunkExhaustedException
 */
public abstract class ChunkLookupException extends Exception {

    private final GroupId groupId;

    protected ChunkLookupException(GroupId groupId, String message) {
        super(message);
        this.groupId = groupId;
    }

    /**
     * @return the group key that was requested
     */
    public GroupId getGroupId() {
        return groupId;
    }
}
