package org.chatvault.archive.chunk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of API response a {@link Chunk} carries. The numeric code is the on-disk tag and
 * must never be reordered.
 */
public enum ChunkType {
    MESSAGES(0),
    THREAD_MESSAGES(1),
    FILES(2),
    USERS(3),
    CHANNELS(4),
    CHANNEL_INFO(5),
    WORKSPACE_INFO(6),
    CHANNEL_USERS(7),
    STARRED_ITEMS(8),
    BOOKMARKS(9);

    private final int code;

    ChunkType(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    /**
     * Resolves the on-disk tag.
     *
     * @param code the tag read from the log
     * @return the matching type
     * @throws IllegalArgumentException if no type has this code
     */
    @JsonCreator
    public static ChunkType fromCode(int code) {
        for (ChunkType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown chunk type code: " + code);
    }

    /**
     * Name used in diagnostics, e.g. {@code ThreadMessages}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder();
        for (String part : name().split("_")) {
            sb.append(part.charAt(0)).append(part.substring(1).toLowerCase());
        }
        return sb.toString();
    }
}
