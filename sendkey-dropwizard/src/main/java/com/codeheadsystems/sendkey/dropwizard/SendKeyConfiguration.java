package com.codeheadsystems.sendkey.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * Dropwizard configuration for the sendkey server.
 * <p>
 * For production, supply both {@code masterKeyHex} (32 bytes) and {@code jwtSecretHex} so that
 * entries stay readable and tokens stay valid across restarts. Omitting either causes a random
 * key to be generated on each startup (dev/test only).
 * <p>
 * Generate keys with: {@code openssl rand -hex 32}
 */
public class SendKeyConfiguration extends Configuration {

  /**
   * Hex-encoded 32-byte master key from which every entry key is derived.
   * Leave empty for random generation (dev only: stored entries become unreadable on restart).
   */
  private String masterKeyHex = "";

  /**
   * Hex-encoded HMAC-SHA256 signing secret for access tokens.
   * Leave empty for random generation (dev only: tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  @NotEmpty
  private String jwtIssuer = "sendkey";

  /**
   * Wrong secret phrases tolerated before an entry expires.
   */
  @Min(1)
  private int maxInvalidAttempts = 5;

  @Min(1)
  private long accessTokenTtlSeconds = 900;

  @Min(1)
  private long refreshTokenTtlSeconds = 604_800;

  /**
   * Largest accepted entry value in UTF-8 bytes.
   */
  @Min(1)
  private int maxValueBytes = 2484;

  /**
   * Seconds between sweeps that move overdue entries to the expired projection. 0 disables the
   * sweep; entries then expire lazily when next looked up.
   */
  @Min(0)
  private long reaperIntervalSeconds = 60;

  @Min(4)
  @Max(31)
  private int bcryptCost = 10;

  @JsonProperty
  public String getMasterKeyHex() {
    return masterKeyHex;
  }

  @JsonProperty
  public void setMasterKeyHex(String masterKeyHex) {
    this.masterKeyHex = masterKeyHex;
  }

  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  @JsonProperty
  public int getMaxInvalidAttempts() {
    return maxInvalidAttempts;
  }

  @JsonProperty
  public void setMaxInvalidAttempts(int maxInvalidAttempts) {
    this.maxInvalidAttempts = maxInvalidAttempts;
  }

  @JsonProperty
  public long getAccessTokenTtlSeconds() {
    return accessTokenTtlSeconds;
  }

  @JsonProperty
  public void setAccessTokenTtlSeconds(long accessTokenTtlSeconds) {
    this.accessTokenTtlSeconds = accessTokenTtlSeconds;
  }

  @JsonProperty
  public long getRefreshTokenTtlSeconds() {
    return refreshTokenTtlSeconds;
  }

  @JsonProperty
  public void setRefreshTokenTtlSeconds(long refreshTokenTtlSeconds) {
    this.refreshTokenTtlSeconds = refreshTokenTtlSeconds;
  }

  @JsonProperty
  public int getMaxValueBytes() {
    return maxValueBytes;
  }

  @JsonProperty
  public void setMaxValueBytes(int maxValueBytes) {
    this.maxValueBytes = maxValueBytes;
  }

  @JsonProperty
  public long getReaperIntervalSeconds() {
    return reaperIntervalSeconds;
  }

  @JsonProperty
  public void setReaperIntervalSeconds(long reaperIntervalSeconds) {
    this.reaperIntervalSeconds = reaperIntervalSeconds;
  }

  @JsonProperty
  public int getBcryptCost() {
    return bcryptCost;
  }

  @JsonProperty
  public void setBcryptCost(int bcryptCost) {
    this.bcryptCost = bcryptCost;
  }
}
