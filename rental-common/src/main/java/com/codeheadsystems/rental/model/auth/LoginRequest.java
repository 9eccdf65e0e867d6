package com.codeheadsystems.rental.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for password login.
 * <p>
 * Used by: {@code POST /rental/api/auth/login}
 *
 * @param username the registered identity
 * @param password the cleartext password to compare against the stored hash
 */
public record LoginRequest(
    @JsonProperty("username") String username,
    @JsonProperty("password") String password) {
}
