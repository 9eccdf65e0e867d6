package com.codeheadsystems.rental.server.realtime;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends numbered sample notifications to a connection at a fixed interval.
 * <p>
 * {@link #start} hands back the task's {@link Future}; the caller binds it in the
 * {@link ConnectionRegistry}, which cancels it when the connection is retired. The task never
 * decides on its own to stop, except by retiring a connection it can no longer write to.
 */
public class PeriodicNotifier {

  private static final Logger log = LoggerFactory.getLogger(PeriodicNotifier.class);

  private final ScheduledExecutorService scheduler;
  private final Duration interval;
  private final ConnectionRegistry registry;
  private final MessageCodec codec;

  public PeriodicNotifier(ScheduledExecutorService scheduler, Duration interval,
                          ConnectionRegistry registry, MessageCodec codec) {
    this.scheduler = scheduler;
    this.interval = interval;
    this.registry = registry;
    this.codec = codec;
  }

  /**
   * False when the configured interval is zero.
   */
  public boolean enabled() {
    return !interval.isZero() && !interval.isNegative();
  }

  /**
   * Schedules notifications for a connection.
   *
   * @return the cancellation handle
   */
  public Future<?> start(RealtimeConnection connection, String identity) {
    AtomicInteger notificationId = new AtomicInteger(1);
    long millis = interval.toMillis();
    return scheduler.scheduleAtFixedRate(() -> {
      int n = notificationId.get();
      log.debug("Sending notification {} to {}", n, identity);
      try {
        connection.send(codec.notification(
            "Hello " + identity + ", this is a sample notification no. " + n));
        notificationId.incrementAndGet();
      } catch (IOException e) {
        log.warn("Error sending notification to {}: {}", identity, e.getMessage());
        registry.retire(connection);
      }
    }, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the scheduler. Pending notifications are dropped.
   */
  public void shutdown() {
    scheduler.shutdownNow();
  }
}
