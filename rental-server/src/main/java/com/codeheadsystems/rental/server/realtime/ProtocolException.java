package com.codeheadsystems.rental.server.realtime;

/**
 * An inbound frame that breaks the real-time protocol.
 */
public class ProtocolException extends RuntimeException {

  public enum Kind {
    MALFORMED_MESSAGE,
    UNEXPECTED_FIRST_MESSAGE
  }

  private final Kind kind;

  public ProtocolException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public ProtocolException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
