package org.chatvault.replay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pagination cursor. In replay the cursor is the byte offset of the record that was served;
 * it is only meaningful for debugging.
 */
public record ResponseMetadata(@JsonProperty("next_cursor") String nextCursor) {

    public static final ResponseMetadata NONE = new ResponseMetadata("");
}
