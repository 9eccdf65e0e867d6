package com.codeheadsystems.rental.server.realtime;

import com.codeheadsystems.rental.server.auth.AuthException;
import com.codeheadsystems.rental.server.auth.SessionTokenManager;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives each real-time connection through handshake, admission, dispatch and teardown.
 * <p>
 * States: {@code AWAITING_HANDSHAKE → AUTHENTICATED → ACTIVE → CLOSED}.
 * <ul>
 *   <li>The first frame must be an {@code authorization} message with a valid token. Anything
 *       else gets a best-effort {@code error} notice and closes the connection.</li>
 *   <li>Once authenticated the connection is admitted to the {@link ConnectionRegistry} and,
 *       when enabled, bound to a {@link PeriodicNotifier} task.</li>
 *   <li>While active, {@code logout} retires every connection of the identity; any other kind
 *       is stamped with the identity as sender and broadcast to that identity's connections.
 *       A malformed frame closes the connection.</li>
 * </ul>
 * The gateway is transport-agnostic: an adapter calls {@link #accept}, then
 * {@link #onMessage} per inbound frame and {@link #onDisconnect} when the transport goes away.
 * Frames of one connection are expected in order, never concurrently.
 */
public class RealtimeGateway {

  private static final Logger log = LoggerFactory.getLogger(RealtimeGateway.class);

  private final SessionTokenManager tokenManager;
  private final ConnectionRegistry registry;
  private final BroadcastDispatcher dispatcher;
  private final PeriodicNotifier notifier;
  private final MessageCodec codec;

  public RealtimeGateway(SessionTokenManager tokenManager, ConnectionRegistry registry,
                         BroadcastDispatcher dispatcher, PeriodicNotifier notifier, MessageCodec codec) {
    this.tokenManager = tokenManager;
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.notifier = notifier;
    this.codec = codec;
  }

  /**
   * Starts tracking a freshly opened transport. Nothing is registered until the handshake
   * succeeds.
   */
  public GatewaySession accept(RealtimeConnection connection) {
    log.debug("Accepted connection {}", connection.id());
    return new GatewaySession(connection);
  }

  /**
   * Handles one inbound frame.
   */
  public void onMessage(GatewaySession session, String frame) {
    switch (session.state()) {
      case AWAITING_HANDSHAKE -> handshake(session, frame);
      case ACTIVE -> dispatch(session, frame);
      default -> log.debug("Ignoring frame on connection {} in state {}",
          session.connection().id(), session.state());
    }
  }

  /**
   * Handles the transport going away (peer closed, read failure).
   */
  public void onDisconnect(GatewaySession session) {
    if (session.state() != GatewaySession.State.CLOSED) {
      log.info("Connection {} of {} disconnected", session.connection().id(),
          session.identity().orElse("<unauthenticated>"));
    }
    close(session);
  }

  /**
   * Retires every connection and stops background notifications.
   */
  public void shutdown() {
    log.info("Shutting down real-time gateway with {} connection(s)", registry.size());
    registry.retireAll();
    notifier.shutdown();
  }

  private void handshake(GatewaySession session, String frame) {
    RealtimeMessage message;
    try {
      message = codec.decode(frame);
    } catch (ProtocolException e) {
      reject(session, "Invalid message format", e);
      return;
    }
    if (!(message instanceof RealtimeMessage.Authorization authorization)) {
      reject(session, "Invalid message type", new ProtocolException(
          ProtocolException.Kind.UNEXPECTED_FIRST_MESSAGE,
          "Expected authorization, got " + message.type().wireName()));
      return;
    }
    String identity;
    try {
      identity = tokenManager.validate(authorization.token());
    } catch (AuthException e) {
      reject(session, "Invalid token", e);
      return;
    }
    if (!session.transition(GatewaySession.State.AWAITING_HANDSHAKE, GatewaySession.State.AUTHENTICATED)) {
      return;
    }
    session.identity(identity);
    RealtimeConnection connection = session.connection();
    registry.admit(connection, identity);
    if (notifier.enabled()) {
      registry.bindTask(connection, notifier.start(connection, identity));
    }
    if (session.transition(GatewaySession.State.AUTHENTICATED, GatewaySession.State.ACTIVE)) {
      log.info("User '{}' connected on {}", identity, connection.id());
    } else {
      // closed while being admitted
      registry.retire(connection);
    }
  }

  private void dispatch(GatewaySession session, String frame) {
    String identity = session.identity().orElseThrow();
    RealtimeMessage message;
    try {
      message = codec.decode(frame);
    } catch (ProtocolException e) {
      log.info("Closing connection {} of {}: {}", session.connection().id(), identity, e.getMessage());
      sendErrorQuietly(session.connection(), e.getMessage());
      close(session);
      return;
    }
    if (message instanceof RealtimeMessage.Logout) {
      log.info("User '{}' logged out from {}", identity, session.connection().id());
      session.markClosed();
      registry.retireByIdentity(identity);
      return;
    }
    if (message instanceof RealtimeMessage.Authorization) {
      sendErrorQuietly(session.connection(), "Already authorized");
      return;
    }
    dispatcher.broadcast(BroadcastPredicate.ownedBy(identity), codec.encode(message, identity));
  }

  private void reject(GatewaySession session, String notice, RuntimeException cause) {
    log.info("Rejecting connection {}: {} ({})", session.connection().id(), notice, cause.getMessage());
    sendErrorQuietly(session.connection(), notice);
    close(session);
  }

  private void sendErrorQuietly(RealtimeConnection connection, String text) {
    try {
      connection.send(codec.error(text));
    } catch (IOException e) {
      log.debug("Unable to deliver error notice to {}: {}", connection.id(), e.getMessage());
    }
  }

  private void close(GatewaySession session) {
    if (session.markClosed() && !registry.retire(session.connection())) {
      session.connection().close();
    }
  }
}
