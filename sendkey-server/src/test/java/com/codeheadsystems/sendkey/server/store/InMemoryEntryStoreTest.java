package com.codeheadsystems.sendkey.server.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryEntryStoreTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  private InMemoryEntryStore store;

  @BeforeEach
  void setUp() {
    store = new InMemoryEntryStore();
  }

  private static Entry entry(UUID sender, Instant createdAt) {
    return new Entry(UUID.randomUUID(), "name", sender, "bob@example.com", new byte[12], new byte[20], 0,
        createdAt, createdAt.plusSeconds(60));
  }

  @Test
  void incrementInvalidAttempts_returnsNewCount() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThat(store.incrementInvalidAttempts(entry.id())).hasValue(1);
    assertThat(store.incrementInvalidAttempts(entry.id())).hasValue(2);
    assertThat(store.find(entry.id()).get().invalidAttempts()).isEqualTo(2);
  }

  @Test
  void incrementInvalidAttempts_unknownEntry_empty() {
    assertThat(store.incrementInvalidAttempts(UUID.randomUUID())).isEmpty();
  }

  @Test
  void recordClaim_movesEntryOnce() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThat(store.recordClaim(ClaimedEntry.of(entry, NOW))).isTrue();
    assertThat(store.recordClaim(ClaimedEntry.of(entry, NOW))).isFalse();
    assertThat(store.recordExpiry(ExpiredEntry.of(entry, false, NOW))).isFalse();
    assertThat(store.find(entry.id())).isEmpty();
    assertThat(store.findClaimed(entry.id())).isPresent();
    assertThat(store.findExpired(entry.id())).isEmpty();
  }

  @Test
  void recordExpiry_movesEntryOnce() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThat(store.recordExpiry(ExpiredEntry.of(entry, true, NOW))).isTrue();
    assertThat(store.recordClaim(ClaimedEntry.of(entry, NOW))).isFalse();
    assertThat(store.findExpired(entry.id()).get().tooManyAttempts()).isTrue();
    assertThat(store.findClaimed(entry.id())).isEmpty();
  }

  @Test
  void findBySender_ordersByCreation() {
    UUID sender = UUID.randomUUID();
    Entry later = entry(sender, NOW.plusSeconds(5));
    Entry earlier = entry(sender, NOW);
    store.create(later);
    store.create(earlier);
    store.create(entry(UUID.randomUUID(), NOW));

    assertThat(store.findBySender(sender)).extracting(Entry::id).containsExactly(earlier.id(), later.id());
  }

  @Test
  void findExpiringBefore_includesDeadlineEqualToCutoff() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThat(store.findExpiringBefore(NOW.plusSeconds(59))).isEmpty();
    assertThat(store.findExpiringBefore(NOW.plusSeconds(60))).extracting(Entry::id).containsExactly(entry.id());
  }

  @Test
  void create_duplicateId_throws() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThatThrownBy(() -> store.create(entry)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void delete_removesWithoutProjection() {
    Entry entry = entry(UUID.randomUUID(), NOW);
    store.create(entry);

    assertThat(store.delete(entry.id())).isTrue();
    assertThat(store.delete(entry.id())).isFalse();
    assertThat(store.findClaimed(entry.id())).isEmpty();
    assertThat(store.findExpired(entry.id())).isEmpty();
  }
}
