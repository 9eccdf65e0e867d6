package com.codeheadsystems.rental.server.store;

/**
 * Classified failure of a {@link DocumentStore} operation.
 * <p>
 * Never retried by the store; callers translate the kind into a response.
 */
public class StoreException extends RuntimeException {

  /**
   * Failure classification and the HTTP status route handlers answer with.
   */
  public enum Kind {
    /** No document matched, or a replace would not change anything. */
    NOT_FOUND(400),
    /** An insert's uniqueness filter matched an existing document. */
    CONFLICT(409),
    /** The backing store is unreachable, timed out or failed. */
    TRANSPORT(500);

    private final int httpStatus;

    Kind(int httpStatus) {
      this.httpStatus = httpStatus;
    }

    public int httpStatus() {
      return httpStatus;
    }
  }

  private final Kind kind;

  public StoreException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public StoreException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }

  public static StoreException notFound(String message) {
    return new StoreException(Kind.NOT_FOUND, message);
  }

  public static StoreException conflict(String message) {
    return new StoreException(Kind.CONFLICT, message);
  }

  public static StoreException transport(String message, Throwable cause) {
    return new StoreException(Kind.TRANSPORT, message, cause);
  }
}
