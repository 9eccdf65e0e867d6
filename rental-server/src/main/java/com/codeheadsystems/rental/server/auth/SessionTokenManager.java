package com.codeheadsystems.rental.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.rental.server.store.RevocationSet;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates signed bearer tokens.
 * <p>
 * Tokens are JWTs signed with HMAC-SHA256 carrying the identity as subject and an expiry of
 * issue time plus the configured TTL. Nothing is stored on issuance: a token is valid iff its
 * signature verifies, it has not expired, and the raw token string is not in the
 * {@link RevocationSet}. Revocation is consulted last since it is the only check that touches
 * shared state.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final RevocationSet revocationSet;
  private final String issuer;
  private final long ttlSeconds;

  private final ScheduledExecutorService revocationReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "token-revocation-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret        HMAC-SHA256 signing secret, fixed for the process lifetime
   * @param issuer        JWT issuer claim
   * @param ttlSeconds    token time-to-live in seconds
   * @param revocationSet tokens revoked by logout
   */
  public SessionTokenManager(byte[] secret, String issuer, long ttlSeconds, RevocationSet revocationSet) {
    if (secret == null || secret.length == 0) {
      throw new IllegalArgumentException("A token signing secret is required");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.revocationSet = revocationSet;
    this.issuer = issuer;
    this.ttlSeconds = ttlSeconds;
    long period = Math.max(1, ttlSeconds / 4);
    revocationReaper.scheduleAtFixedRate(
        () -> revocationSet.prune(Instant.now()), period, period, TimeUnit.SECONDS);
  }

  /**
   * Stops the revocation reaper thread.
   */
  public void shutdown() {
    revocationReaper.shutdown();
  }

  /**
   * Issues a token for the given identity.
   *
   * @param identity the authenticated username
   * @return signed JWT string
   */
  public String issue(String identity) {
    Instant now = Instant.now();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(identity)
        .withIssuedAt(now)
        .withExpiresAt(now.plusSeconds(ttlSeconds))
        .sign(algorithm);
    log.debug("Issued token for {}", identity);
    return token;
  }

  /**
   * Validates a token and returns the identity it was issued to.
   *
   * @param token raw token string
   * @return the identity
   * @throws AuthException with the reason the token was rejected
   */
  public String validate(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthException(AuthException.Reason.MISSING, "Token is missing");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (JWTDecodeException e) {
      throw new AuthException(AuthException.Reason.MALFORMED, "Token is malformed", e);
    } catch (AlgorithmMismatchException | SignatureVerificationException e) {
      throw new AuthException(AuthException.Reason.INVALID_SIGNATURE, "Token signature is invalid", e);
    } catch (TokenExpiredException e) {
      throw new AuthException(AuthException.Reason.EXPIRED, "Token has expired", e);
    } catch (JWTVerificationException e) {
      throw new AuthException(AuthException.Reason.MALFORMED, "Token claims are invalid: " + e.getMessage(), e);
    }
    String identity = decoded.getSubject();
    if (identity == null || identity.isBlank()) {
      throw new AuthException(AuthException.Reason.MALFORMED, "Token has no subject");
    }
    if (revocationSet.isRevoked(token)) {
      throw new AuthException(AuthException.Reason.REVOKED, "Token has been revoked");
    }
    return identity;
  }

  /**
   * Validates a token, collapsing every failure into an empty result.
   *
   * @param token raw token string
   * @return the identity if valid
   */
  public Optional<String> verify(String token) {
    try {
      return Optional.of(validate(token));
    } catch (AuthException e) {
      log.debug("Token rejected ({}): {}", e.reason(), e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Revokes a token so it is rejected before its natural expiry.
   *
   * @param token raw token string
   * @throws AuthException with reason {@code MISSING} or {@code MALFORMED} if the token cannot
   *                       be decoded
   */
  public void revoke(String token) {
    if (token == null || token.isBlank()) {
      throw new AuthException(AuthException.Reason.MISSING, "Token is missing");
    }
    Instant expiresAt;
    try {
      expiresAt = JWT.decode(token).getExpiresAtAsInstant();
    } catch (JWTDecodeException e) {
      throw new AuthException(AuthException.Reason.MALFORMED, "Token is malformed", e);
    }
    revocationSet.revoke(token, expiresAt != null ? expiresAt : Instant.now().plusSeconds(ttlSeconds));
  }
}
