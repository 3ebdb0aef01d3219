package com.codeheadsystems.sendkey.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A persisted refresh token. The value carries no identity; the binding to {@code userId}
 * exists only here.
 *
 * @param id        record identifier
 * @param userId    owning user
 * @param token     lowercase hex value handed to the client
 * @param createdAt issue instant
 * @param expiresAt instant after which the token is refused
 */
public record RefreshToken(
    UUID id,
    UUID userId,
    String token,
    Instant createdAt,
    Instant expiresAt) {

  @Override
  public String toString() {
    return "RefreshToken[id=" + id + ", userId=" + userId + ", expiresAt=" + expiresAt + "]";
  }
}
