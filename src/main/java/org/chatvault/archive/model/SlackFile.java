package org.chatvault.archive.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * File metadata as attached to a message. The file contents are not part of the archive.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SlackFile(
    @JsonProperty("id") String id,
    @JsonProperty("name") String name,
    @JsonProperty("title") String title,
    @JsonProperty("mimetype") String mimeType,
    @JsonProperty("filetype") String fileType,
    @JsonProperty("size") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long size,
    @JsonProperty("url_private") String urlPrivate,
    @JsonProperty("url_private_download") String urlPrivateDownload,
    @JsonProperty("timestamp") @JsonInclude(JsonInclude.Include.NON_DEFAULT) long timestamp
) {

    public static SlackFile of(String id, String name) {
        return new SlackFile(id, name, name, null, null, 0, null, null, 0);
    }
}
