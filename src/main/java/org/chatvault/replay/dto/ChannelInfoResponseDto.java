package org.chatvault.replay.dto;

import org.chatvault.archive.model.Channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code conversations.info}. {@code channel} is absent once all recorded info
 * chunks of the channel were served.
 */
public record ChannelInfoResponseDto(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("channel") @JsonInclude(JsonInclude.Include.NON_NULL) Channel channel,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("response_metadata") ResponseMetadata responseMetadata
) {
}
