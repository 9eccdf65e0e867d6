package com.codeheadsystems.rental.server.realtime;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-connection state held by the {@link RealtimeGateway}.
 * <p>
 * Transport adapters keep the instance returned by {@link RealtimeGateway#accept} and pass it
 * back with every inbound frame and on disconnect.
 */
public class GatewaySession {

  /**
   * Connection lifecycle. {@code CLOSED} is terminal.
   */
  public enum State {
    AWAITING_HANDSHAKE,
    AUTHENTICATED,
    ACTIVE,
    CLOSED
  }

  private final RealtimeConnection connection;
  private final AtomicReference<State> state = new AtomicReference<>(State.AWAITING_HANDSHAKE);
  private volatile String identity;

  GatewaySession(RealtimeConnection connection) {
    this.connection = connection;
  }

  public RealtimeConnection connection() {
    return connection;
  }

  public State state() {
    return state.get();
  }

  public Optional<String> identity() {
    return Optional.ofNullable(identity);
  }

  void identity(String identity) {
    this.identity = identity;
  }

  boolean transition(State from, State to) {
    return state.compareAndSet(from, to);
  }

  /**
   * Moves to {@code CLOSED}.
   *
   * @return false if the session was already closed
   */
  boolean markClosed() {
    return state.getAndSet(State.CLOSED) != State.CLOSED;
  }
}
