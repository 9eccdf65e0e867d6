package com.codeheadsystems.rental.springboot.config;

import com.codeheadsystems.rental.server.auth.PasswordHashConfig;
import com.codeheadsystems.rental.server.auth.PasswordHasher;
import com.codeheadsystems.rental.server.auth.SessionTokenManager;
import com.codeheadsystems.rental.server.manager.AuthManager;
import com.codeheadsystems.rental.server.manager.CatalogManager;
import com.codeheadsystems.rental.server.manager.PhotoManager;
import com.codeheadsystems.rental.server.realtime.BroadcastDispatcher;
import com.codeheadsystems.rental.server.realtime.ConnectionRegistry;
import com.codeheadsystems.rental.server.realtime.MessageCodec;
import com.codeheadsystems.rental.server.realtime.PeriodicNotifier;
import com.codeheadsystems.rental.server.realtime.RealtimeGateway;
import com.codeheadsystems.rental.server.store.DocumentStore;
import com.codeheadsystems.rental.server.store.InMemoryDocumentStore;
import com.codeheadsystems.rental.server.store.InMemoryRevocationSet;
import com.codeheadsystems.rental.server.store.MongoDocumentStore;
import com.codeheadsystems.rental.server.store.RevocationSet;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(before = MongoAutoConfiguration.class)
@EnableConfigurationProperties(RentalProperties.class)
public class RentalAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(RentalAutoConfiguration.class);

  /**
   * Default {@link SecureRandom} used for password salts. Override to supply a custom provider.
   */
  @Bean
  @ConditionalOnMissingBean
  public SecureRandom secureRandom() {
    return new SecureRandom();
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(RentalProperties props, SecureRandom secureRandom) {
    PasswordHashConfig config = new PasswordHashConfig(
        props.getArgon2Iterations(),
        props.getArgon2MemoryKib(),
        props.getArgon2Parallelism(),
        props.getHashLength(),
        props.getSaltLength());
    return new PasswordHasher(config, secureRandom);
  }

  @Bean
  @ConditionalOnMissingBean
  public RevocationSet revocationSet() {
    log.warn("Using in-memory revocation set. Logged-out tokens become valid again after a restart.");
    return new InMemoryRevocationSet();
  }

  /**
   * Fails startup when {@code rental.jwt-secret} is not configured.
   */
  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public SessionTokenManager sessionTokenManager(RentalProperties props, RevocationSet revocationSet) {
    String secret = props.getJwtSecret();
    if (secret == null || secret.isBlank()) {
      throw new IllegalStateException(
          "rental.jwt-secret must be configured (for example through the JWT_SECRET_KEY "
              + "environment variable). Generate a value with: openssl rand -hex 32");
    }
    return new SessionTokenManager(secret.getBytes(StandardCharsets.UTF_8), props.getJwtIssuer(),
        props.getJwtTtlSeconds(), revocationSet);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnExpression("!'${rental.mongo-uri:}'.isBlank()")
  public MongoClient mongoClient(RentalProperties props) {
    log.info("Connecting document store to MongoDB database '{}'", props.getMongoDatabase());
    return MongoClients.create(props.getMongoUri());
  }

  @Bean
  @ConditionalOnMissingBean
  public DocumentStore documentStore(RentalProperties props, ObjectProvider<MongoClient> mongoClient) {
    String uri = props.getMongoUri();
    if (uri == null || uri.isBlank()) {
      return new InMemoryDocumentStore();
    }
    return new MongoDocumentStore(mongoClient.getObject().getDatabase(props.getMongoDatabase()));
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageCodec messageCodec(ObjectProvider<ObjectMapper> objectMapper) {
    return new MessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
  }

  @Bean
  @ConditionalOnMissingBean
  public ConnectionRegistry connectionRegistry(RentalProperties props) {
    return new ConnectionRegistry(Duration.ofMillis(props.getLogoutGraceMillis()));
  }

  @Bean
  @ConditionalOnMissingBean
  public BroadcastDispatcher broadcastDispatcher(ConnectionRegistry registry) {
    return new BroadcastDispatcher(registry);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public PeriodicNotifier periodicNotifier(RentalProperties props, ConnectionRegistry registry,
                                           MessageCodec codec) {
    AtomicInteger count = new AtomicInteger();
    ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(props.getNotificationThreads(), r -> {
      Thread t = new Thread(r, "realtime-notifier-" + count.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    Duration interval = Duration.ofSeconds(props.getNotificationIntervalSeconds());
    if (interval.isZero()) {
      log.info("Periodic notifications disabled");
    }
    return new PeriodicNotifier(scheduler, interval, registry, codec);
  }

  @Bean(destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  public RealtimeGateway realtimeGateway(SessionTokenManager tokenManager, ConnectionRegistry registry,
                                         BroadcastDispatcher dispatcher, PeriodicNotifier notifier,
                                         MessageCodec codec) {
    return new RealtimeGateway(tokenManager, registry, dispatcher, notifier, codec);
  }

  @Bean
  @ConditionalOnMissingBean
  public AuthManager authManager(DocumentStore documentStore, PasswordHasher passwordHasher,
                                 SessionTokenManager tokenManager, ConnectionRegistry registry) {
    return new AuthManager(documentStore, passwordHasher, tokenManager, registry);
  }

  @Bean
  @ConditionalOnMissingBean
  public CatalogManager catalogManager(DocumentStore documentStore, BroadcastDispatcher dispatcher,
                                       MessageCodec codec) {
    return new CatalogManager(documentStore, dispatcher, codec);
  }

  @Bean
  @ConditionalOnMissingBean
  public PhotoManager photoManager(DocumentStore documentStore) {
    return new PhotoManager(documentStore);
  }
}
