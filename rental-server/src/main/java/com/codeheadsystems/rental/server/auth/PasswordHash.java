package com.codeheadsystems.rental.server.auth;

/**
 * Output of {@link PasswordHasher#hash}: the derived hash and the salt it was derived with,
 * both hex-encoded for storage.
 *
 * @param hashHex hex-encoded Argon2id output
 * @param saltHex hex-encoded salt
 */
public record PasswordHash(String hashHex, String saltHex) {
}
