package com.codeheadsystems.rental.springboot.health;

import com.codeheadsystems.rental.server.realtime.ConnectionRegistry;
import com.codeheadsystems.rental.server.store.DocumentStore;
import com.codeheadsystems.rental.server.store.StoreException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class DocumentStoreHealthIndicator implements HealthIndicator {

  private final DocumentStore documentStore;
  private final ConnectionRegistry registry;

  public DocumentStoreHealthIndicator(DocumentStore documentStore, ConnectionRegistry registry) {
    this.documentStore = documentStore;
    this.registry = registry;
  }

  @Override
  public Health health() {
    try {
      documentStore.ping();
    } catch (StoreException e) {
      return Health.down(e).withDetail("store", documentStore.getClass().getSimpleName()).build();
    }
    return Health.up()
        .withDetail("store", documentStore.getClass().getSimpleName())
        .withDetail("realtimeConnections", registry.size())
        .build();
  }
}
