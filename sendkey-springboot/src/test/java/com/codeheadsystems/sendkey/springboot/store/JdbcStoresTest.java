package com.codeheadsystems.sendkey.springboot.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.model.User;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Exercises the JDBC stores against the Flyway schema on H2.
 */
@SpringBootTest
class JdbcStoresTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  @Autowired
  private JdbcEntryStore entryStore;

  @Autowired
  private JdbcUserStore userStore;

  @Autowired
  private JdbcRefreshTokenStore refreshTokenStore;

  private User sender;

  @BeforeEach
  void setUp() {
    sender = new User(UUID.randomUUID(), "sender-" + UUID.randomUUID() + "@example.com", false,
        "Sam", null, "$2a$04$abcdefghijklmnopqrstuv", NOW);
    assertThat(userStore.create(sender)).isTrue();
  }

  private Entry entry(Instant createdAt, Duration ttl) {
    return new Entry(UUID.randomUUID(), "wifi", sender.id(), "bob@example.com",
        new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12}, new byte[]{42, 43, 44}, 0,
        createdAt, createdAt.plus(ttl));
  }

  // ── Users ─────────────────────────────────────────────────────────────────

  @Test
  void user_roundTripAndDuplicateEmail() {
    assertThat(userStore.find(sender.id())).contains(sender);
    assertThat(userStore.findByEmail(sender.email())).contains(sender);

    User clash = new User(UUID.randomUUID(), sender.email(), false, null, null, "hash", NOW);
    assertThat(userStore.create(clash)).isFalse();
    assertThat(userStore.find(clash.id())).isEmpty();
  }

  // ── Entries ───────────────────────────────────────────────────────────────

  @Test
  void entry_roundTrip() {
    Entry entry = entry(NOW, Duration.ofMinutes(10));
    entryStore.create(entry);

    Entry loaded = entryStore.find(entry.id()).orElseThrow();
    assertThat(loaded.name()).isEqualTo("wifi");
    assertThat(loaded.sentByUserId()).isEqualTo(sender.id());
    assertThat(loaded.nonce()).isEqualTo(entry.nonce());
    assertThat(loaded.value()).isEqualTo(entry.value());
    assertThat(loaded.createdAt()).isEqualTo(NOW);
    assertThat(loaded.expiresAt()).isEqualTo(entry.expiresAt());
    assertThatThrownBy(() -> entryStore.create(entry)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void findBySender_oldestFirst() {
    Entry later = entry(NOW.plusSeconds(60), Duration.ofMinutes(10));
    Entry earlier = entry(NOW, Duration.ofMinutes(10));
    entryStore.create(later);
    entryStore.create(earlier);

    assertThat(entryStore.findBySender(sender.id()))
        .extracting(Entry::id)
        .containsExactly(earlier.id(), later.id());
  }

  @Test
  void findExpiringBefore_includesDeadlineEqualToCutoff() {
    Entry due = entry(NOW, Duration.ofMinutes(1));
    Entry notDue = entry(NOW, Duration.ofMinutes(2));
    entryStore.create(due);
    entryStore.create(notDue);

    List<Entry> expiring = entryStore.findExpiringBefore(NOW.plus(Duration.ofMinutes(1)));

    assertThat(expiring).extracting(Entry::id).contains(due.id()).doesNotContain(notDue.id());
  }

  @Test
  void incrementInvalidAttempts_countsUpUntilGone() {
    Entry entry = entry(NOW, Duration.ofMinutes(10));
    entryStore.create(entry);

    assertThat(entryStore.incrementInvalidAttempts(entry.id())).hasValue(1);
    assertThat(entryStore.incrementInvalidAttempts(entry.id())).hasValue(2);
    assertThat(entryStore.find(entry.id()).orElseThrow().invalidAttempts()).isEqualTo(2);

    assertThat(entryStore.delete(entry.id())).isTrue();
    assertThat(entryStore.incrementInvalidAttempts(entry.id())).isEmpty();
    assertThat(entryStore.delete(entry.id())).isFalse();
  }

  @Test
  void recordClaim_movesEntryOnce() {
    Entry entry = entry(NOW, Duration.ofMinutes(10));
    entryStore.create(entry);

    assertThat(entryStore.recordClaim(ClaimedEntry.of(entry, NOW.plusSeconds(5)))).isTrue();
    assertThat(entryStore.recordClaim(ClaimedEntry.of(entry, NOW.plusSeconds(6)))).isFalse();
    assertThat(entryStore.recordExpiry(ExpiredEntry.of(entry, false, NOW.plusSeconds(7)))).isFalse();

    assertThat(entryStore.find(entry.id())).isEmpty();
    assertThat(entryStore.findClaimed(entry.id()))
        .hasValueSatisfying(claimed -> assertThat(claimed.claimedAt()).isEqualTo(NOW.plusSeconds(5)));
    assertThat(entryStore.findExpired(entry.id())).isEmpty();
  }

  @Test
  void concurrentClaimAndExpiry_exactlyOneWins() throws Exception {
    Entry entry = entry(NOW, Duration.ofMinutes(10));
    entryStore.create(entry);
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      Callable<Boolean> claim = () -> {
        start.await();
        return entryStore.recordClaim(ClaimedEntry.of(entry, NOW));
      };
      Callable<Boolean> expire = () -> {
        start.await();
        return entryStore.recordExpiry(ExpiredEntry.of(entry, true, NOW));
      };
      Future<Boolean> claimed = executor.submit(claim);
      Future<Boolean> expired = executor.submit(expire);
      start.countDown();

      assertThat(claimed.get() ^ expired.get()).isTrue();
      assertThat(entryStore.findClaimed(entry.id()).isPresent()).isEqualTo(claimed.get());
      assertThat(entryStore.findExpired(entry.id()).isPresent()).isEqualTo(expired.get());
    } finally {
      executor.shutdownNow();
    }
  }

  // ── Refresh tokens ────────────────────────────────────────────────────────

  @Test
  void refreshToken_scopedToUser() {
    RefreshToken token = new RefreshToken(UUID.randomUUID(), sender.id(),
        "ab".repeat(25), NOW, NOW.plus(Duration.ofDays(7)));
    refreshTokenStore.create(token);

    assertThat(refreshTokenStore.findByTokenAndUser(token.token(), sender.id())).contains(token);
    assertThat(refreshTokenStore.findByTokenAndUser(token.token(), UUID.randomUUID())).isEmpty();

    refreshTokenStore.delete(token.id());
    assertThat(refreshTokenStore.findByTokenAndUser(token.token(), sender.id())).isEmpty();
  }
}
