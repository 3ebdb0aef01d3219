package com.codeheadsystems.sendkey.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * An active secret entry awaiting a single reveal.
 * <p>
 * The nonce is fixed at creation. It is both the AES-GCM nonce and the capability a caller
 * must present to look the entry up. {@code value} holds {@code ciphertext || tag}.
 *
 * @param id              entry identifier
 * @param name            display name
 * @param sentByUserId    creating user
 * @param sentToEmail     recipient email
 * @param nonce           12 random bytes
 * @param value           sealed value
 * @param invalidAttempts number of failed reveal attempts so far
 * @param createdAt       creation instant
 * @param expiresAt       deadline for a reveal
 */
public record Entry(
    UUID id,
    String name,
    UUID sentByUserId,
    String sentToEmail,
    byte[] nonce,
    byte[] value,
    int invalidAttempts,
    Instant createdAt,
    Instant expiresAt) {

  /**
   * Returns a copy with a different invalid-attempt count.
   *
   * @param attempts the new count
   * @return the updated entry
   */
  public Entry withInvalidAttempts(int attempts) {
    return new Entry(id, name, sentByUserId, sentToEmail, nonce, value, attempts, createdAt, expiresAt);
  }

  /**
   * An entry is expired once its deadline is not after {@code now}.
   *
   * @param now the current instant
   * @return true if the entry can no longer be revealed
   */
  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  @Override
  public String toString() {
    return "Entry[id=" + id + ", sentByUserId=" + sentByUserId + ", invalidAttempts=" + invalidAttempts
        + ", createdAt=" + createdAt + ", expiresAt=" + expiresAt + "]";
  }
}
