package com.codeheadsystems.sendkey.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Terminal record of an entry whose value was revealed.
 */
public record ClaimedEntry(
    UUID id,
    String name,
    UUID sentByUserId,
    String sentToEmail,
    Instant claimedAt) {

  public static ClaimedEntry of(Entry entry, Instant claimedAt) {
    return new ClaimedEntry(entry.id(), entry.name(), entry.sentByUserId(), entry.sentToEmail(), claimedAt);
  }
}
