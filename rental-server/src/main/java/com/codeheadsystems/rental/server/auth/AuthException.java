package com.codeheadsystems.rental.server.auth;

/**
 * Authentication failure with a preserved reason.
 * <p>
 * HTTP callers usually collapse every reason into a single 401; the reason stays available
 * for logs and diagnostics.
 */
public class AuthException extends SecurityException {

  /**
   * Why a token was rejected.
   */
  public enum Reason {
    MISSING,
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED,
    REVOKED
  }

  private final Reason reason;

  public AuthException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public AuthException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
