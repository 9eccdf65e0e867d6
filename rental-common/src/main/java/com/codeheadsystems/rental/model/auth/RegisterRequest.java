package com.codeheadsystems.rental.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for account creation.
 * <p>
 * Used by: {@code POST /rental/api/auth/register}
 *
 * @param username the requested identity; must not already be registered
 * @param password the cleartext password, hashed server-side before storage
 */
public record RegisterRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {
}
