package com.codeheadsystems.rental.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PasswordHasherTest {

  private static final byte[] PASSWORD = "correct horse battery staple".getBytes(StandardCharsets.UTF_8);

  private PasswordHasher hasher;

  @BeforeEach
  void setUp() {
    hasher = new PasswordHasher(PasswordHashConfig.forTesting(), new SecureRandom());
  }

  @Test
  void hash_generatesSaltOfConfiguredLength() {
    PasswordHash hash = hasher.hash(PASSWORD);

    assertThat(HexFormat.of().parseHex(hash.saltHex())).hasSize(16);
    assertThat(HexFormat.of().parseHex(hash.hashHex())).hasSize(32);
  }

  @Test
  void hash_sameSalt_isDeterministic() {
    byte[] salt = HexFormat.of().parseHex("000102030405060708090a0b0c0d0e0f");
    PasswordHash first = hasher.hash(PASSWORD, salt);
    PasswordHash second = hasher.hash(PASSWORD, salt.clone());

    assertThat(second.hashHex()).isEqualTo(first.hashHex());
  }

  @Test
  void hash_freshSalts_differ() {
    PasswordHash first = hasher.hash(PASSWORD);
    PasswordHash second = hasher.hash(PASSWORD);

    assertThat(second.saltHex()).isNotEqualTo(first.saltHex());
    assertThat(second.hashHex()).isNotEqualTo(first.hashHex());
  }

  @Test
  void hash_emptySalt_generatesOne() {
    PasswordHash hash = hasher.hash(PASSWORD, new byte[0]);

    assertThat(hash.saltHex()).hasSize(32);
  }

  @Test
  void compare_matchingPassword_returnsTrue() {
    PasswordHash hash = hasher.hash(PASSWORD);

    assertThat(hasher.compare(PASSWORD, hash.saltHex(), hash.hashHex())).isTrue();
  }

  @Test
  void compare_wrongPassword_returnsFalse() {
    PasswordHash hash = hasher.hash(PASSWORD);

    assertThat(hasher.compare("wrong".getBytes(StandardCharsets.UTF_8), hash.saltHex(), hash.hashHex()))
        .isFalse();
  }

  @Test
  void compare_otherSalt_returnsFalse() {
    PasswordHash hash = hasher.hash(PASSWORD);
    PasswordHash other = hasher.hash(PASSWORD);

    assertThat(hasher.compare(PASSWORD, other.saltHex(), hash.hashHex())).isFalse();
  }

  @Test
  void compare_invalidHex_returnsFalse() {
    assertThat(hasher.compare(PASSWORD, "not-hex", "abcd")).isFalse();
    assertThat(hasher.compare(PASSWORD, "", "abcd")).isFalse();
  }

  @Test
  void config_rejectsUnusableParameters() {
    assertThatThrownBy(() -> new PasswordHashConfig(0, 7168, 4, 32, 16))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new PasswordHashConfig(5, 7168, 4, 8, 16))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
