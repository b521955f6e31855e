package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Bookmark(
    @JsonProperty("id") String id,
    @JsonProperty("channel_id") String channelId,
    @JsonProperty("title") String title,
    @JsonProperty("link") String link,
    @JsonProperty("emoji") String emoji,
    @JsonProperty("type") String type,
    @JsonProperty("date_created") long dateCreated
) {
}
