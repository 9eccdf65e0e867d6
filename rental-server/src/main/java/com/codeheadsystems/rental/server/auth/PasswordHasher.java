package com.codeheadsystems.rental.server.auth;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Salted Argon2id password hashing.
 * <p>
 * Passwords are never compared directly: {@link #compare} re-derives the hash with the stored
 * salt and compares digests in constant time.
 */
public class PasswordHasher {

  private static final HexFormat HEX = HexFormat.of();

  private final PasswordHashConfig config;
  private final SecureRandom secureRandom;

  public PasswordHasher(PasswordHashConfig config, SecureRandom secureRandom) {
    this.config = config;
    this.secureRandom = secureRandom;
  }

  /**
   * Hashes a password with a freshly generated salt of the configured length.
   *
   * @param password cleartext password bytes
   * @return the hash and the generated salt
   */
  public PasswordHash hash(byte[] password) {
    byte[] salt = new byte[config.saltLength()];
    secureRandom.nextBytes(salt);
    return hash(password, salt);
  }

  /**
   * Hashes a password with the given salt.
   *
   * @param password cleartext password bytes
   * @param salt     salt to derive with; a {@code null} or empty salt generates a new one
   * @return the hash and the salt used
   */
  public PasswordHash hash(byte[] password, byte[] salt) {
    if (salt == null || salt.length == 0) {
      return hash(password);
    }
    return new PasswordHash(HEX.formatHex(derive(password, salt)), HEX.formatHex(salt));
  }

  /**
   * Returns true when {@code password} derives to {@code expectedHashHex} under {@code saltHex}.
   *
   * @param password        candidate password
   * @param saltHex         stored salt, hex-encoded
   * @param expectedHashHex stored hash, hex-encoded
   * @return whether the password matches
   */
  public boolean compare(byte[] password, String saltHex, String expectedHashHex) {
    byte[] salt;
    byte[] expected;
    try {
      salt = HEX.parseHex(saltHex);
      expected = HEX.parseHex(expectedHashHex);
    } catch (IllegalArgumentException e) {
      return false;
    }
    if (salt.length == 0) {
      return false;
    }
    return MessageDigest.isEqual(derive(password, salt), expected);
  }

  private byte[] derive(byte[] password, byte[] salt) {
    Argon2Parameters params = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
        .withVersion(Argon2Parameters.ARGON2_VERSION_13)
        .withSalt(salt)
        .withMemoryAsKB(config.memoryKib())
        .withIterations(config.iterations())
        .withParallelism(config.parallelism())
        .build();
    Argon2BytesGenerator generator = new Argon2BytesGenerator();
    generator.init(params);
    byte[] output = new byte[config.hashLength()];
    generator.generateBytes(password, output, 0, output.length);
    return output;
  }
}
