package org.chatvault.replay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error envelope, {@code {"ok": false, "error": "..."}}.
 */
public record ErrorResponseDto(
    @JsonProperty("ok") boolean ok,
    @JsonProperty("error") String error
) {

    public static ErrorResponseDto of(String error) {
        return new ErrorResponseDto(false, error);
    }
}
