package com.codeheadsystems.rental.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model returned after a successful registration or login.
 * <p>
 * The token is a signed bearer token; send it as {@code Authorization: Bearer <token>} on
 * protected HTTP routes and as the payload of the first {@code authorization} message on the
 * real-time channel.
 *
 * @param userId identifier of the stored credential document
 * @param token  signed bearer token for the authenticated identity
 */
public record AuthResponse(
    @JsonProperty("userId") String userId,
    @JsonProperty("token") String token) {
}
