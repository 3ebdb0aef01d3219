package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link EntryStore} backed by {@link ConcurrentHashMap}s.
 * <p>
 * Transitions run inside {@code computeIfPresent} on the active map, so the projection write
 * and the removal happen under the same per-key lock. All entries are lost on restart.
 */
public class InMemoryEntryStore implements EntryStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryEntryStore.class);

  private final ConcurrentHashMap<UUID, Entry> active = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, ClaimedEntry> claimed = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<UUID, ExpiredEntry> expired = new ConcurrentHashMap<>();

  public InMemoryEntryStore() {
    log.warn("Using InMemoryEntryStore: entries will NOT survive restarts. "
        + "Replace with a persistent EntryStore for production.");
  }

  @Override
  public Optional<Entry> find(UUID id) {
    return Optional.ofNullable(active.get(id));
  }

  @Override
  public List<Entry> findBySender(UUID senderId) {
    return active.values().stream()
        .filter(e -> e.sentByUserId().equals(senderId))
        .sorted(Comparator.comparing(Entry::createdAt))
        .toList();
  }

  @Override
  public List<Entry> findExpiringBefore(Instant cutoff) {
    return active.values().stream()
        .filter(e -> e.isExpiredAt(cutoff))
        .toList();
  }

  @Override
  public void create(Entry entry) {
    if (active.putIfAbsent(entry.id(), entry) != null) {
      throw new IllegalStateException("Entry already exists: " + entry.id());
    }
    log.debug("Stored entry {}", entry.id());
  }

  @Override
  public boolean delete(UUID id) {
    return active.remove(id) != null;
  }

  @Override
  public OptionalInt incrementInvalidAttempts(UUID id) {
    Entry updated = active.computeIfPresent(id,
        (key, entry) -> entry.withInvalidAttempts(entry.invalidAttempts() + 1));
    return updated == null ? OptionalInt.empty() : OptionalInt.of(updated.invalidAttempts());
  }

  @Override
  public boolean recordClaim(ClaimedEntry claimedEntry) {
    AtomicBoolean moved = new AtomicBoolean(false);
    active.computeIfPresent(claimedEntry.id(), (key, entry) -> {
      claimed.put(key, claimedEntry);
      moved.set(true);
      return null;
    });
    return moved.get();
  }

  @Override
  public boolean recordExpiry(ExpiredEntry expiredEntry) {
    AtomicBoolean moved = new AtomicBoolean(false);
    active.computeIfPresent(expiredEntry.id(), (key, entry) -> {
      expired.put(key, expiredEntry);
      moved.set(true);
      return null;
    });
    return moved.get();
  }

  @Override
  public Optional<ClaimedEntry> findClaimed(UUID id) {
    return Optional.ofNullable(claimed.get(id));
  }

  @Override
  public Optional<ExpiredEntry> findExpired(UUID id) {
    return Optional.ofNullable(expired.get(id));
  }
}
