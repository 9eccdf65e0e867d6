package com.codeheadsystems.rental.server.store;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RevocationSet} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Revocations are lost on restart, which means a logged-out token becomes usable again until
 * it expires. Suitable for a single instance only.
 */
public class InMemoryRevocationSet implements RevocationSet {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRevocationSet.class);

  private record Entry(Instant revokedAt, Instant expiresAt) {
  }

  private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

  @Override
  public void revoke(String token, Instant expiresAt) {
    entries.putIfAbsent(token, new Entry(Instant.now(), expiresAt));
    log.debug("Revoked token expiring at {}", expiresAt);
  }

  @Override
  public Optional<Instant> revokedAt(String token) {
    Entry entry = entries.get(token);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.expiresAt().isBefore(Instant.now())) {
      entries.remove(token, entry);
      return Optional.empty();
    }
    return Optional.of(entry.revokedAt());
  }

  @Override
  public int prune(Instant now) {
    int before = entries.size();
    entries.values().removeIf(e -> e.expiresAt().isBefore(now));
    int removed = before - entries.size();
    if (removed > 0) {
      log.debug("Pruned {} expired revocation(s)", removed);
    }
    return Math.max(removed, 0);
  }

  /**
   * Current number of entries.
   */
  public int size() {
    return entries.size();
  }
}
