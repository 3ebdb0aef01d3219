package com.codeheadsystems.sendkey.springboot.store;

import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import com.codeheadsystems.sendkey.server.store.EntryStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link EntryStore} over the {@code entries}, {@code claimed_entries} and {@code expired_entries}
 * tables.
 * <p>
 * A transition deletes the active row and inserts the projection in one transaction. Only the
 * caller whose delete removed the row writes the projection.
 */
public class JdbcEntryStore implements EntryStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcEntryStore.class);

  private static final String ENTRY_COLUMNS = """
      id, name, sent_by_user_id, sent_to_email, nonce, encrypted_value, invalid_attempts,
      created_at, expires_at""";

  private final JdbcClient jdbc;
  private final TransactionTemplate transactionTemplate;

  public JdbcEntryStore(JdbcClient jdbc, TransactionTemplate transactionTemplate) {
    this.jdbc = jdbc;
    this.transactionTemplate = transactionTemplate;
  }

  // ── Active entries ────────────────────────────────────────────────────────

  @Override
  public Optional<Entry> find(UUID id) {
    return jdbc.sql("SELECT " + ENTRY_COLUMNS + " FROM entries WHERE id = ?")
        .param(id)
        .query(JdbcEntryStore::entry)
        .optional();
  }

  @Override
  public List<Entry> findBySender(UUID senderId) {
    return jdbc.sql("SELECT " + ENTRY_COLUMNS + " FROM entries WHERE sent_by_user_id = ? ORDER BY created_at, id")
        .param(senderId)
        .query(JdbcEntryStore::entry)
        .list();
  }

  @Override
  public List<Entry> findExpiringBefore(Instant cutoff) {
    return jdbc.sql("SELECT " + ENTRY_COLUMNS + " FROM entries WHERE expires_at <= ?")
        .param(Timestamp.from(cutoff))
        .query(JdbcEntryStore::entry)
        .list();
  }

  @Override
  public void create(Entry entry) {
    try {
      jdbc.sql("INSERT INTO entries (" + ENTRY_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")
          .params(entry.id(), entry.name(), entry.sentByUserId(), entry.sentToEmail(), entry.nonce(),
              entry.value(), entry.invalidAttempts(), Timestamp.from(entry.createdAt()),
              Timestamp.from(entry.expiresAt()))
          .update();
    } catch (DuplicateKeyException e) {
      throw new IllegalStateException("Entry already exists: " + entry.id(), e);
    }
    log.debug("Stored entry {}", entry.id());
  }

  @Override
  public boolean delete(UUID id) {
    return jdbc.sql("DELETE FROM entries WHERE id = ?").param(id).update() > 0;
  }

  @Override
  public OptionalInt incrementInvalidAttempts(UUID id) {
    return transactionTemplate.execute(status -> {
      int updated = jdbc.sql("UPDATE entries SET invalid_attempts = invalid_attempts + 1 WHERE id = ?")
          .param(id)
          .update();
      if (updated == 0) {
        return OptionalInt.empty();
      }
      Integer attempts = jdbc.sql("SELECT invalid_attempts FROM entries WHERE id = ?")
          .param(id)
          .query(Integer.class)
          .single();
      return OptionalInt.of(attempts);
    });
  }

  // ── Transitions ───────────────────────────────────────────────────────────

  @Override
  public boolean recordClaim(ClaimedEntry claimedEntry) {
    return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
      if (!delete(claimedEntry.id())) {
        return false;
      }
      jdbc.sql("""
              INSERT INTO claimed_entries (id, name, sent_by_user_id, sent_to_email, claimed_at)
              VALUES (?, ?, ?, ?, ?)""")
          .params(claimedEntry.id(), claimedEntry.name(), claimedEntry.sentByUserId(),
              claimedEntry.sentToEmail(), Timestamp.from(claimedEntry.claimedAt()))
          .update();
      return true;
    }));
  }

  @Override
  public boolean recordExpiry(ExpiredEntry expiredEntry) {
    return Boolean.TRUE.equals(transactionTemplate.execute(status -> {
      if (!delete(expiredEntry.id())) {
        return false;
      }
      jdbc.sql("""
              INSERT INTO expired_entries
                  (id, name, sent_by_user_id, sent_to_email, too_many_attempts, expired_at)
              VALUES (?, ?, ?, ?, ?, ?)""")
          .params(expiredEntry.id(), expiredEntry.name(), expiredEntry.sentByUserId(),
              expiredEntry.sentToEmail(), expiredEntry.tooManyAttempts(),
              Timestamp.from(expiredEntry.expiredAt()))
          .update();
      return true;
    }));
  }

  @Override
  public Optional<ClaimedEntry> findClaimed(UUID id) {
    return jdbc.sql("SELECT id, name, sent_by_user_id, sent_to_email, claimed_at FROM claimed_entries WHERE id = ?")
        .param(id)
        .query((rs, rowNum) -> new ClaimedEntry(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getObject("sent_by_user_id", UUID.class),
            rs.getString("sent_to_email"),
            rs.getTimestamp("claimed_at").toInstant()))
        .optional();
  }

  @Override
  public Optional<ExpiredEntry> findExpired(UUID id) {
    return jdbc.sql("""
            SELECT id, name, sent_by_user_id, sent_to_email, too_many_attempts, expired_at
            FROM expired_entries WHERE id = ?""")
        .param(id)
        .query((rs, rowNum) -> new ExpiredEntry(
            rs.getObject("id", UUID.class),
            rs.getString("name"),
            rs.getObject("sent_by_user_id", UUID.class),
            rs.getString("sent_to_email"),
            rs.getBoolean("too_many_attempts"),
            rs.getTimestamp("expired_at").toInstant()))
        .optional();
  }

  private static Entry entry(ResultSet rs, int rowNum) throws SQLException {
    return new Entry(
        rs.getObject("id", UUID.class),
        rs.getString("name"),
        rs.getObject("sent_by_user_id", UUID.class),
        rs.getString("sent_to_email"),
        rs.getBytes("nonce"),
        rs.getBytes("encrypted_value"),
        rs.getInt("invalid_attempts"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("expires_at").toInstant());
  }
}
