package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item starred by the archiving user: a message, a file or a whole channel.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StarredItem(
    @JsonProperty("type") String type,
    @JsonProperty("channel") String channel,
    @JsonProperty("message") Message message,
    @JsonProperty("file") SlackFile file
) {
}
