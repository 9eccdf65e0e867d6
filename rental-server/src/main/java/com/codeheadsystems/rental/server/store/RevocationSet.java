package com.codeheadsystems.rental.server.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Tokens revoked before their natural expiry, keyed by the raw token string.
 * <p>
 * Implementations must be thread-safe. Entries only need to live until the token's own
 * expiry; after that the token is rejected as expired regardless, so {@link #prune} may drop
 * them.
 */
public interface RevocationSet {

  /**
   * Marks a token as revoked.
   *
   * @param token     raw token string
   * @param expiresAt expiry embedded in the token, used for pruning
   */
  void revoke(String token, Instant expiresAt);

  /**
   * Returns when the token was revoked, or empty if it was not (or its entry was pruned).
   *
   * @param token raw token string
   * @return the revocation timestamp
   */
  Optional<Instant> revokedAt(String token);

  /**
   * Returns true if the token is currently revoked.
   *
   * @param token raw token string
   * @return whether the token is revoked
   */
  default boolean isRevoked(String token) {
    return revokedAt(token).isPresent();
  }

  /**
   * Drops every entry whose token expired before {@code now}.
   *
   * @param now the cutoff
   * @return number of entries removed
   */
  int prune(Instant now);
}
