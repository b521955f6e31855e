package org.chatvault.replay.dto;

import java.util.List;

import org.chatvault.archive.model.Message;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code conversations.history} and {@code conversations.replies}.
 */
public record MessagesResponseDto(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("messages") List<Message> messages,
    @JsonProperty("response_metadata") ResponseMetadata responseMetadata
) {

    public static MessagesResponseDto endOfData() {
        return new MessagesResponseDto(true, false, List.of(), ResponseMetadata.NONE);
    }
}
