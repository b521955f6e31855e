package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Conversation metadata: public/private channels, direct messages and group DMs.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Channel(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("is_channel") boolean isChannel,
    @JsonProperty("is_private") boolean isPrivate,
    @JsonProperty("is_im") boolean isIm,
    @JsonProperty("is_mpim") boolean isMpim,
    @JsonProperty("is_archived") boolean isArchived,
    @JsonProperty("created") long created,
    @JsonProperty("creator") String creator,
    @JsonProperty("num_members") int numMembers,
    @JsonProperty("topic") Topic topic,
    @JsonProperty("purpose") Topic purpose
) {

    /**
     * Topic or purpose of a channel.
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Topic(
        @JsonProperty("value") String value,
        @JsonProperty("creator") String creator,
        @JsonProperty("last_set") long lastSet
    ) {
    }

    public static Channel of(String id, String name) {
        return new Channel(id, name, true, false, false, false, false, 0, null, 0, null, null);
    }
}
