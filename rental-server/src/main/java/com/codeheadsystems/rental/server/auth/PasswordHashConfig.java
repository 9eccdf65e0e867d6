package com.codeheadsystems.rental.server.auth;

/**
 * Argon2id cost parameters for {@link PasswordHasher}.
 * <p>
 * These are deployment configuration, never request input: letting a caller pick the cost
 * would let it pick how much CPU and memory each login burns.
 *
 * @param iterations  number of passes over memory
 * @param memoryKib   memory cost in kibibytes
 * @param parallelism number of lanes
 * @param hashLength  derived hash length in bytes
 * @param saltLength  length in bytes of generated salts
 */
public record PasswordHashConfig(
    int iterations,
    int memoryKib,
    int parallelism,
    int hashLength,
    int saltLength) {

  /**
   * Defaults used when nothing is configured.
   */
  public static final PasswordHashConfig DEFAULT = new PasswordHashConfig(5, 7 * 1024, 4, 32, 16);

  public PasswordHashConfig {
    if (iterations < 1 || memoryKib < 8 || parallelism < 1 || hashLength < 16 || saltLength < 8) {
      throw new IllegalArgumentException("Invalid Argon2id parameters: iterations=" + iterations
          + " memoryKib=" + memoryKib + " parallelism=" + parallelism
          + " hashLength=" + hashLength + " saltLength=" + saltLength);
    }
  }

  /**
   * Cheap parameters for unit tests. Do not use in production.
   */
  public static PasswordHashConfig forTesting() {
    return new PasswordHashConfig(1, 64, 1, 32, 16);
  }
}
