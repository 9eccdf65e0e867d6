package com.codeheadsystems.rental.server.manager;

import com.codeheadsystems.rental.model.auth.AuthResponse;
import com.codeheadsystems.rental.server.auth.PasswordHash;
import com.codeheadsystems.rental.server.auth.PasswordHasher;
import com.codeheadsystems.rental.server.auth.SessionTokenManager;
import com.codeheadsystems.rental.server.realtime.ConnectionRegistry;
import com.codeheadsystems.rental.server.store.Document;
import com.codeheadsystems.rental.server.store.DocumentFilter;
import com.codeheadsystems.rental.server.store.DocumentStore;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic password registration, login and logout over the {@code users}
 * collection.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} for a blank username or password: HTTP 400</li>
 *   <li>{@link com.codeheadsystems.rental.server.store.StoreException} with kind
 *       {@code CONFLICT} when the username is taken: HTTP 409</li>
 *   <li>{@link SecurityException} for an unknown user or a wrong password: HTTP 401</li>
 * </ul>
 */
public class AuthManager {

  private static final Logger log = LoggerFactory.getLogger(AuthManager.class);

  public static final String USERS = "users";
  static final String USERNAME = "username";
  static final String PASSWORD = "password";
  static final String SALT = "salt";
  static final String DATE = "date";

  private final DocumentStore store;
  private final PasswordHasher passwordHasher;
  private final SessionTokenManager tokenManager;
  private final ConnectionRegistry registry;

  public AuthManager(DocumentStore store, PasswordHasher passwordHasher,
                     SessionTokenManager tokenManager, ConnectionRegistry registry) {
    this.store = store;
    this.passwordHasher = passwordHasher;
    this.tokenManager = tokenManager;
    this.registry = registry;
  }

  /**
   * Creates a credential and signs the new user in.
   */
  public AuthResponse register(String username, String password) {
    requireNonBlank(username, "username");
    requireNonBlank(password, "password");
    log.debug("register({})", username);
    PasswordHash hash = passwordHasher.hash(password.getBytes(StandardCharsets.UTF_8));
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(USERNAME, username);
    fields.put(PASSWORD, hash.hashHex());
    fields.put(SALT, hash.saltHex());
    fields.put(DATE, Instant.now().toString());
    String userId = store.insert(USERS, DocumentFilter.eq(USERNAME, username), Document.of(fields));
    log.info("Registered user '{}'", username);
    return new AuthResponse(userId, tokenManager.issue(username));
  }

  /**
   * Checks the password against the stored hash and issues a token.
   */
  public AuthResponse login(String username, String password) {
    requireNonBlank(username, "username");
    requireNonBlank(password, "password");
    log.debug("login({})", username);
    List<Document> users = store.query(USERS, DocumentFilter.eq(USERNAME, username));
    if (users.isEmpty()) {
      throw new SecurityException("Invalid username or password");
    }
    Document user = users.get(0);
    if (!passwordHasher.compare(password.getBytes(StandardCharsets.UTF_8),
        user.getString(SALT), user.getString(PASSWORD))) {
      throw new SecurityException("Invalid username or password");
    }
    return new AuthResponse(user.id(), tokenManager.issue(username));
  }

  /**
   * Revokes the token and disconnects every real-time connection of the identity.
   *
   * @return number of real-time connections closed
   */
  public int logout(String token, String identity) {
    tokenManager.revoke(token);
    int closed = registry.retireByIdentity(identity);
    log.info("User '{}' logged out, {} connection(s) closed", identity, closed);
    return closed;
  }

  private static void requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
