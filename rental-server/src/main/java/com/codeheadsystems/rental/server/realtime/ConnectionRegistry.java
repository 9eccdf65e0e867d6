package com.codeheadsystems.rental.server.realtime;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bookkeeping of live real-time connections keyed by owning identity.
 * <p>
 * Two views are kept: connection to identity, and connection to the cancellation handle of
 * its background task. Both are guarded by one lock, so admission and retirement are atomic
 * to every reader: a connection is never visible in one view and missing from the other.
 * Transport I/O (close notices, socket close) always happens outside the lock.
 * <p>
 * The registry owns the lifecycle of background tasks: tasks are cancelled here on
 * retirement, never by themselves.
 */
public class ConnectionRegistry {

  private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

  /**
   * WebSocket normal-closure status code.
   */
  public static final int CLOSE_NORMAL = 1000;

  private final Object lock = new Object();
  private final Map<RealtimeConnection, String> owners = new HashMap<>();
  private final Map<RealtimeConnection, Future<?>> tasks = new HashMap<>();
  private final Duration logoutGrace;

  /**
   * @param logoutGrace how long {@link #retireByIdentity} waits after sending close notices
   *                    before releasing the transports
   */
  public ConnectionRegistry(Duration logoutGrace) {
    this.logoutGrace = logoutGrace;
  }

  /**
   * Registers a connection under an identity. Other connections of the same identity are
   * kept.
   */
  public void admit(RealtimeConnection connection, String identity) {
    synchronized (lock) {
      owners.put(connection, identity);
    }
    log.debug("Admitted connection {} for {}", connection.id(), identity);
  }

  /**
   * Associates a background task with an admitted connection. If the connection is no longer
   * registered the task is cancelled at once.
   *
   * @return true if the task was bound
   */
  public boolean bindTask(RealtimeConnection connection, Future<?> task) {
    Future<?> replaced;
    synchronized (lock) {
      if (!owners.containsKey(connection)) {
        replaced = task;
      } else {
        replaced = tasks.put(connection, task);
      }
    }
    if (replaced != null) {
      replaced.cancel(true);
    }
    return replaced != task;
  }

  /**
   * Closes a connection, cancels its bound task and removes it from both views.
   * Calling it again, or for a connection that was never admitted, does nothing.
   *
   * @return true if the connection was registered
   */
  public boolean retire(RealtimeConnection connection) {
    String identity;
    Future<?> task;
    synchronized (lock) {
      identity = owners.remove(connection);
      task = tasks.remove(connection);
    }
    if (task != null) {
      task.cancel(true);
    }
    if (identity == null) {
      return false;
    }
    connection.close();
    log.debug("Retired connection {} of {}", connection.id(), identity);
    return true;
  }

  /**
   * Retires every connection owned by an identity, typically on logout. Each one first gets a
   * protocol close notice; after one grace period for delivery all of them are closed.
   *
   * @return number of connections retired
   */
  public int retireByIdentity(String identity) {
    List<RealtimeConnection> retired = new ArrayList<>();
    List<Future<?>> cancelled = new ArrayList<>();
    synchronized (lock) {
      Iterator<Map.Entry<RealtimeConnection, String>> it = owners.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<RealtimeConnection, String> entry = it.next();
        if (identity.equals(entry.getValue())) {
          it.remove();
          retired.add(entry.getKey());
          Future<?> task = tasks.remove(entry.getKey());
          if (task != null) {
            cancelled.add(task);
          }
        }
      }
    }
    cancelled.forEach(task -> task.cancel(true));
    if (retired.isEmpty()) {
      return 0;
    }
    for (RealtimeConnection connection : retired) {
      try {
        log.info("Sending close message to {} on {}", identity, connection.id());
        connection.sendClose(CLOSE_NORMAL, "User logged out");
      } catch (IOException e) {
        log.warn("Error sending close message to {}: {}", identity, e.getMessage());
      }
    }
    awaitGrace();
    retired.forEach(RealtimeConnection::close);
    return retired.size();
  }

  /**
   * Retires every registered connection, for process shutdown.
   */
  public void retireAll() {
    List<RealtimeConnection> all;
    synchronized (lock) {
      all = new ArrayList<>(owners.keySet());
    }
    all.forEach(this::retire);
  }

  /**
   * Snapshot of the connections the predicate selects.
   */
  public List<RealtimeConnection> select(BroadcastPredicate predicate) {
    List<RealtimeConnection> selected = new ArrayList<>();
    synchronized (lock) {
      owners.forEach((connection, identity) -> {
        if (predicate.test(connection, identity)) {
          selected.add(connection);
        }
      });
    }
    return selected;
  }

  public List<RealtimeConnection> connectionsOf(String identity) {
    return select(BroadcastPredicate.ownedBy(identity));
  }

  public Optional<String> identityOf(RealtimeConnection connection) {
    synchronized (lock) {
      return Optional.ofNullable(owners.get(connection));
    }
  }

  public boolean hasTask(RealtimeConnection connection) {
    synchronized (lock) {
      return tasks.containsKey(connection);
    }
  }

  public int size() {
    synchronized (lock) {
      return owners.size();
    }
  }

  private void awaitGrace() {
    if (logoutGrace.isZero() || logoutGrace.isNegative()) {
      return;
    }
    try {
      Thread.sleep(logoutGrace.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
