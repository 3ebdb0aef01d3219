package com.codeheadsystems.sendkey.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sendkey")
public class SendKeyProperties {

  /**
   * Backing store for users, entries and refresh tokens: {@code memory} or {@code jdbc}.
   */
  private String store = "memory";
  private String masterKeyHex = "";
  private String jwtSecretHex = "";
  private String jwtIssuer = "sendkey";
  private int maxInvalidAttempts = 5;
  private long accessTokenTtlSeconds = 900;
  private long refreshTokenTtlSeconds = 604_800;
  private int maxValueBytes = 2484;
  private long reaperIntervalSeconds = 60;
  private int bcryptCost = 10;

  public String getStore() {
    return store;
  }

  public void setStore(String store) {
    this.store = store;
  }

  public String getMasterKeyHex() {
    return masterKeyHex;
  }

  public void setMasterKeyHex(String masterKeyHex) {
    this.masterKeyHex = masterKeyHex;
  }

  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  public String getJwtIssuer() {
    return jwtIssuer;
  }

  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  public int getMaxInvalidAttempts() {
    return maxInvalidAttempts;
  }

  public void setMaxInvalidAttempts(int maxInvalidAttempts) {
    this.maxInvalidAttempts = maxInvalidAttempts;
  }

  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  public int getMaxValueBytes() {
    return maxValueBytes;
  }

  public void setMaxValueBytes(int maxValueBytes) {
    this.maxValueBytes = maxValueBytes;
  }

  public long getReaperIntervalSeconds() {
    return reaperIntervalSeconds;
  }

  public void setReaperIntervalSeconds(long reaperIntervalSeconds) {
    this.reaperIntervalSeconds = reaperIntervalSeconds;
  }

  public int getBcryptCost() {
    return bcryptCost;
  }

  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }
}
