package com.codeheadsystems.rental.server.realtime;

import com.codeheadsystems.rental.model.realtime.MessageEnvelope;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans a message out to the registered connections a predicate selects.
 * <p>
 * A failed write marks the peer as dead: the connection is retired on the spot and delivery
 * continues with the rest, so one broken peer only loses its own copy.
 */
public class BroadcastDispatcher {

  private static final Logger log = LoggerFactory.getLogger(BroadcastDispatcher.class);

  private final ConnectionRegistry registry;

  public BroadcastDispatcher(ConnectionRegistry registry) {
    this.registry = registry;
  }

  /**
   * @return number of connections the message was written to
   */
  public int broadcast(BroadcastPredicate predicate, MessageEnvelope envelope) {
    List<RealtimeConnection> targets = registry.select(predicate);
    int delivered = 0;
    for (RealtimeConnection connection : targets) {
      try {
        connection.send(envelope);
        delivered++;
      } catch (IOException e) {
        log.warn("Error broadcasting {} to {}: {}", envelope.type(), connection.id(), e.getMessage());
        registry.retire(connection);
      }
    }
    log.debug("Broadcast {} to {}/{} connection(s)", envelope.type(), delivered, targets.size());
    return delivered;
  }
}
