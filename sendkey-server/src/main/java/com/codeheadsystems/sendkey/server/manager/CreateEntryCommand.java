package com.codeheadsystems.sendkey.server.manager;

import java.time.Duration;
import java.util.UUID;

/**
 * Input to {@link EntryManager#createEntry}.
 *
 * @param name           display name
 * @param senderId       the authenticated caller
 * @param recipientEmail where the entry link goes
 * @param value          plaintext to protect
 * @param secretPhrase   phrase the recipient must present
 * @param duration       lifetime, positive and at most {@link EntryManager#MAX_DURATION}
 */
public record CreateEntryCommand(
    String name,
    UUID senderId,
    String recipientEmail,
    String value,
    String secretPhrase,
    Duration duration) {

  /**
   * Converts a caller-supplied minute count without overflowing. Counts outside the accepted
   * range are clamped to one step past it, so validation still rejects them.
   *
   * @param minutes the requested lifetime in minutes
   * @return the lifetime
   */
  public static Duration durationOfMinutes(long minutes) {
    long max = EntryManager.MAX_DURATION.toMinutes();
    return Duration.ofMinutes(Math.max(-1, Math.min(minutes, max + 1)));
  }

  @Override
  public String toString() {
    return "CreateEntryCommand[name=" + name + ", senderId=" + senderId + ", duration=" + duration + "]";
  }
}
