package com.codeheadsystems.sendkey.server.auth;

import java.time.Instant;

/**
 * A freshly issued token value and its absolute expiry.
 *
 * @param value     the token string
 * @param expiresAt expiry instant
 */
public record IssuedToken(String value, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[expiresAt=" + expiresAt + "]";
  }
}
