package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;

/**
 * Storage abstraction for active entries and their terminal projections.
 * <p>
 * Implementations must be thread-safe. {@link #recordClaim} and {@link #recordExpiry} move an
 * entry out of the active set and write its projection as one unit: once either returns, no
 * reader may see the entry as active, and the projection is present.
 */
public interface EntryStore {

  /**
   * Loads an active entry.
   *
   * @param id the entry identifier
   * @return the entry, or empty if it is not active
   */
  Optional<Entry> find(UUID id);

  /**
   * Lists the active entries created by a user.
   *
   * @param senderId the creating user
   * @return entries ordered oldest first
   */
  List<Entry> findBySender(UUID senderId);

  /**
   * Lists active entries whose deadline is at or before the cutoff.
   *
   * @param cutoff the cutoff instant
   * @return matching entries
   */
  List<Entry> findExpiringBefore(Instant cutoff);

  /**
   * Persists a new active entry.
   *
   * @param entry the entry
   */
  void create(Entry entry);

  /**
   * Removes an active entry without writing a projection.
   *
   * @param id the entry identifier
   * @return true if an entry was removed
   */
  boolean delete(UUID id);

  /**
   * Atomically adds one to the entry's invalid-attempt counter and reads it back.
   *
   * @param id the entry identifier
   * @return the new count, or empty if the entry is no longer active
   */
  OptionalInt incrementInvalidAttempts(UUID id);

  /**
   * Moves an active entry to the claimed projection.
   *
   * @param claimedEntry the projection to write
   * @return true if this call performed the transition, false if the entry was no longer active
   */
  boolean recordClaim(ClaimedEntry claimedEntry);

  /**
   * Moves an active entry to the expired projection.
   *
   * @param expiredEntry the projection to write
   * @return true if this call performed the transition, false if the entry was no longer active
   */
  boolean recordExpiry(ExpiredEntry expiredEntry);

  Optional<ClaimedEntry> findClaimed(UUID id);

  Optional<ExpiredEntry> findExpired(UUID id);
}
