package org.chatvault.replay.dto;

import java.util.List;

import org.chatvault.archive.model.Channel;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code conversations.list}.
 */
public record ChannelsResponseDto(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("channels") List<Channel> channels,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("response_metadata") ResponseMetadata responseMetadata
) {
}
