package org.chatvault.replay.dto;

import java.util.List;

import org.chatvault.archive.model.User;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response of {@code users.list}.
 */
public record UsersResponseDto(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("members") List<User> members,
    @JsonProperty("has_more") boolean hasMore,
    @JsonProperty("response_metadata") ResponseMetadata responseMetadata
) {
}
