package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record User(
    @JsonProperty("id") String id,
    @JsonProperty("team_id") String teamId,
    @JsonProperty("name") String name,
    @JsonProperty("real_name") String realName,
    @JsonProperty("deleted") boolean deleted,
    @JsonProperty("is_bot") boolean bot
) {

    public static User of(String id, String name) {
        return new User(id, null, name, null, false, false);
    }
}
