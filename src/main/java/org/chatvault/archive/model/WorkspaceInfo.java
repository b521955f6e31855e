package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the archived workspace and of the user the archive was captured as.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkspaceInfo(
    @JsonProperty("url") String url,
    @JsonProperty("team") String team,
    @JsonProperty("user") String user,
    @JsonProperty("team_id") String teamId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("bot_id") String botId,
    @JsonProperty("enterprise_id") String enterpriseId
) {
}
