package com.codeheadsystems.sendkey.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Terminal record of an entry that can no longer be revealed.
 *
 * @param id              entry identifier
 * @param name            display name
 * @param sentByUserId    creating user
 * @param sentToEmail     recipient email
 * @param tooManyAttempts true when the attempt limit was reached, false when the deadline passed
 * @param expiredAt       instant of the transition
 */
public record ExpiredEntry(
    UUID id,
    String name,
    UUID sentByUserId,
    String sentToEmail,
    boolean tooManyAttempts,
    Instant expiredAt) {

  public static ExpiredEntry of(Entry entry, boolean tooManyAttempts, Instant expiredAt) {
    return new ExpiredEntry(entry.id(), entry.name(), entry.sentByUserId(), entry.sentToEmail(),
        tooManyAttempts, expiredAt);
  }
}
