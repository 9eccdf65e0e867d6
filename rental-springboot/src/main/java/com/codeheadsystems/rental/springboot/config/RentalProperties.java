package com.codeheadsystems.rental.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rental")
public class RentalProperties {

  private String jwtSecret = "";
  private String jwtIssuer = "rental";
  private long jwtTtlSeconds = 3600;
  private int argon2Iterations = 5;
  private int argon2MemoryKib = 7 * 1024;
  private int argon2Parallelism = 4;
  private int hashLength = 32;
  private int saltLength = 16;
  private long notificationIntervalSeconds = 20;
  private int notificationThreads = 2;
  private long logoutGraceMillis = 1000;
  private int sendTimeLimitMillis = 10_000;
  private int sendBufferSizeLimit = 512 * 1024;
  private String mongoUri = "";
  private String mongoDatabase = "rental";

  public String getJwtSecret() {
    return jwtSecret;
  }

  public void setJwtSecret(String jwtSecret) {
    this.jwtSecret = jwtSecret;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  public int getArgon2Iterations() {
    return argon2Iterations;
  }

  public void setArgon2Iterations(int argon2Iterations) {
    this.argon2Iterations = argon2Iterations;
  }

  public int getArgon2MemoryKib() {
    return argon2MemoryKib;
  }

  public void setArgon2MemoryKib(int argon2MemoryKib) {
    this.argon2MemoryKib = argon2MemoryKib;
  }

  public int getArgon2Parallelism() {
    return argon2Parallelism;
  }

  public void setArgon2Parallelism(int argon2Parallelism) {
    this.argon2Parallelism = argon2Parallelism;
  }

  public int getHashLength() {
    return hashLength;
  }

  public void setHashLength(int hashLength) {
    this.hashLength = hashLength;
  }

  public int getSaltLength() {
    return saltLength;
  }

  public void setSaltLength(int saltLength) {
    this.saltLength = saltLength;
  }

  public long getNotificationIntervalSeconds() {
    return notificationIntervalSeconds;
  }

  public void setNotificationIntervalSeconds(long notificationIntervalSeconds) {
    this.notificationIntervalSeconds = notificationIntervalSeconds;
  }

  public int getNotificationThreads() {
    return notificationThreads;
  }

  public void setNotificationThreads(int notificationThreads) {
    this.notificationThreads = notificationThreads;
  }

  public long getLogoutGraceMillis() {
    return logoutGraceMillis;
  }

  public void setLogoutGraceMillis(long logoutGraceMillis) {
    this.logoutGraceMillis = logoutGraceMillis;
  }

  public int getSendTimeLimitMillis() {
    return sendTimeLimitMillis;
  }

  public void setSendTimeLimitMillis(int sendTimeLimitMillis) {
    this.sendTimeLimitMillis = sendTimeLimitMillis;
  }

  public int getSendBufferSizeLimit() {
    return sendBufferSizeLimit;
  }

  public void setSendBufferSizeLimit(int sendBufferSizeLimit) {
    this.sendBufferSizeLimit = sendBufferSizeLimit;
  }

  public String getMongoUri() {
    return mongoUri;
  }

  public void setMongoUri(String mongoUri) {
    this.mongoUri = mongoUri;
  }

  public String getMongoDatabase() {
    return mongoDatabase;
  }

  public void setMongoDatabase(String mongoDatabase) {
    this.mongoDatabase = mongoDatabase;
  }
}
