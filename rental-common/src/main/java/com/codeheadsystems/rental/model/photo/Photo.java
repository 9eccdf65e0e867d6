package com.codeheadsystems.rental.model.photo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for a photo attached to a user.
 *
 * @param id       server-assigned identifier
 * @param userId   identifier of the owning user document
 * @param filepath client-side path of the photo, used as the delete key
 * @param webPath  optional URL the client can display
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Photo(
    @JsonProperty("_id") String id,
    @JsonProperty("user_id") String userId,
    @JsonProperty("filepath") String filepath,
    @JsonProperty("webview_path") String webPath) {
}
