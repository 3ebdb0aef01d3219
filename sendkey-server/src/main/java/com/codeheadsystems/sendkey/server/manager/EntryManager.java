package com.codeheadsystems.sendkey.server.manager;

import com.codeheadsystems.sendkey.server.crypto.EntryCipher;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import com.codeheadsystems.sendkey.server.model.ClaimedEntry;
import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.model.ExpiredEntry;
import com.codeheadsystems.sendkey.server.notify.EntryNotifier;
import com.codeheadsystems.sendkey.server.store.EntryStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic owner of the entry lifecycle: create, find, list, reveal, expire.
 * <p>
 * An entry is active until it is claimed (one successful reveal) or expired (deadline passed,
 * or too many wrong phrases). Both moves go through {@link EntryStore#recordClaim} /
 * {@link EntryStore#recordExpiry}, which write the projection and drop the active record as
 * one unit. Expiry is discovered lazily whenever an entry is read; {@link #expireOverdue()}
 * catches entries nobody reads again.
 * <p>
 * This class holds no mutable state. User-correctable outcomes are returned as result records;
 * store failures propagate unchanged.
 */
public class EntryManager {

  private static final Logger log = LoggerFactory.getLogger(EntryManager.class);

  public static final String SENDER_REQUIRED = "A sender ID is required.";
  public static final String NAME_REQUIRED = "A name is required.";
  public static final String EMAIL_REQUIRED = "A send to email is required.";
  public static final String VALUE_REQUIRED = "A value is required.";
  public static final String SECRET_REQUIRED = "A secret is required.";
  public static final String DURATION_POSITIVE = "Duration must be greater than 0.";
  public static final String DURATION_TOO_LONG = "Duration must be at most 525600 minutes.";
  public static final String NAME_TOO_LONG = "Name must be at most 100 characters.";
  public static final String EMAIL_TOO_LONG = "Send to email must be at most 100 characters.";
  public static final String INVALID_ENTRY = "Invalid entry ID.";
  public static final String INVALID_SECRET = "Invalid secret.";
  public static final String TOO_MANY_ATTEMPTS =
      "Too many attempts have been made, and the entry has been expired.";

  static final int MAX_NAME_LENGTH = 100;
  static final int MAX_EMAIL_LENGTH = 100;

  /**
   * Longest accepted entry lifetime.
   */
  public static final Duration MAX_DURATION = Duration.ofDays(365);

  private final EntryStore entryStore;
  private final EntryCipher entryCipher;
  private final EntryNotifier entryNotifier;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final int maxInvalidAttempts;
  private final int maxValueBytes;

  /**
   * Instantiates a new entry manager.
   *
   * @param entryStore         active and terminal entry storage
   * @param entryCipher        seals and opens values
   * @param entryNotifier      delivers the entry link to the recipient
   * @param randomProvider     nonce source
   * @param clock              time source for deadlines
   * @param maxInvalidAttempts wrong phrases allowed before the entry expires, at least 1
   * @param maxValueBytes      largest accepted plaintext, in UTF-8 bytes
   */
  public EntryManager(EntryStore entryStore,
                      EntryCipher entryCipher,
                      EntryNotifier entryNotifier,
                      RandomProvider randomProvider,
                      Clock clock,
                      int maxInvalidAttempts,
                      int maxValueBytes) {
    if (maxInvalidAttempts < 1) {
      throw new IllegalArgumentException("maxInvalidAttempts must be at least 1");
    }
    this.entryStore = entryStore;
    this.entryCipher = entryCipher;
    this.entryNotifier = entryNotifier;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.maxInvalidAttempts = maxInvalidAttempts;
    this.maxValueBytes = maxValueBytes;
  }

  // ── Creation ──────────────────────────────────────────────────────────────

  /**
   * Validates, encrypts and stores a new entry, then notifies the recipient.
   * <p>
   * If notification fails the entry is deleted and the exception propagates.
   *
   * @param command the entry to create
   * @return the stored entry, or every validation error
   */
  public CreateEntryResult createEntry(CreateEntryCommand command) {
    log.debug("createEntry(sender={})", command.senderId());
    List<String> errors = validate(command);
    if (!errors.isEmpty()) {
      return CreateEntryResult.invalid(errors);
    }

    byte[] nonce = randomProvider.randomBytes(EntryCipher.NONCE_LENGTH);
    byte[] sealed = entryCipher.seal(command.secretPhrase(), nonce,
        command.value().getBytes(StandardCharsets.UTF_8));
    Instant now = clock.instant();
    Entry entry = new Entry(UUID.randomUUID(), command.name().trim(), command.senderId(),
        command.recipientEmail().trim(), nonce, sealed, 0, now, now.plus(command.duration()));
    entryStore.create(entry);

    try {
      entryNotifier.entryCreated(entry);
    } catch (RuntimeException e) {
      log.warn("Notification for entry {} failed; deleting it", entry.id());
      entryStore.delete(entry.id());
      throw e;
    }
    log.info("Created entry {} expiring at {}", entry.id(), entry.expiresAt());
    return CreateEntryResult.created(entry);
  }

  private List<String> validate(CreateEntryCommand command) {
    List<String> errors = new ArrayList<>();
    if (command.senderId() == null) {
      errors.add(SENDER_REQUIRED);
    }
    if (isBlank(command.name())) {
      errors.add(NAME_REQUIRED);
    } else if (command.name().trim().length() > MAX_NAME_LENGTH) {
      errors.add(NAME_TOO_LONG);
    }
    if (isBlank(command.recipientEmail())) {
      errors.add(EMAIL_REQUIRED);
    } else if (command.recipientEmail().trim().length() > MAX_EMAIL_LENGTH) {
      errors.add(EMAIL_TOO_LONG);
    }
    if (isBlank(command.value())) {
      errors.add(VALUE_REQUIRED);
    } else if (command.value().getBytes(StandardCharsets.UTF_8).length > maxValueBytes) {
      errors.add("Value must be at most " + maxValueBytes + " bytes.");
    }
    if (isBlank(command.secretPhrase())) {
      errors.add(SECRET_REQUIRED);
    }
    if (command.duration() == null || command.duration().isNegative() || command.duration().isZero()) {
      errors.add(DURATION_POSITIVE);
    } else if (command.duration().compareTo(MAX_DURATION) > 0) {
      errors.add(DURATION_TOO_LONG);
    }
    return errors;
  }

  // ── Lookup ────────────────────────────────────────────────────────────────

  /**
   * Finds an active entry by id and nonce.
   * <p>
   * An unknown id, a wrong or undecodable nonce, and a passed deadline all yield empty.
   * A passed deadline also expires the entry.
   *
   * @param id       the entry id
   * @param nonceHex the presented nonce, hex-encoded
   * @return the entry, unmodified
   */
  public Optional<Entry> findEntry(UUID id, String nonceHex) {
    log.debug("findEntry(id={})", id);
    Optional<Entry> found = entryStore.find(id);
    if (found.isEmpty()) {
      return Optional.empty();
    }
    Entry entry = found.get();
    if (entry.isExpiredAt(clock.instant())) {
      expire(entry, false);
      return Optional.empty();
    }
    if (!nonceMatches(entry.nonce(), nonceHex)) {
      return Optional.empty();
    }
    return found;
  }

  /**
   * Lists a user's active entries, oldest first. Entries past their deadline are expired
   * and left out.
   *
   * @param senderId the creating user
   * @return the active entries
   */
  public List<Entry> listBySender(UUID senderId) {
    log.debug("listBySender(sender={})", senderId);
    Instant now = clock.instant();
    List<Entry> result = new ArrayList<>();
    for (Entry entry : entryStore.findBySender(senderId)) {
      if (entry.isExpiredAt(now)) {
        expire(entry, false);
      } else {
        result.add(entry);
      }
    }
    return result;
  }

  // ── Reveal ────────────────────────────────────────────────────────────────

  /**
   * Attempts to reveal an entry's value.
   * <p>
   * A wrong phrase increments the attempt counter; reaching the limit expires the entry.
   * A blank or missing phrase counts as a wrong phrase. The right phrase claims the entry,
   * so the value is returned at most once.
   *
   * @param id           the entry id
   * @param nonceHex     the presented nonce, hex-encoded
   * @param secretPhrase the presented phrase
   * @return the plaintext, or the failure reasons
   */
  public DecryptEntryResult decryptEntry(UUID id, String nonceHex, String secretPhrase) {
    log.debug("decryptEntry(id={})", id);
    Optional<Entry> found = findEntry(id, nonceHex);
    if (found.isEmpty()) {
      return DecryptEntryResult.failed(false, INVALID_ENTRY);
    }
    Entry entry = found.get();

    Optional<byte[]> plaintext = entryCipher.open(
        secretPhrase == null ? "" : secretPhrase, entry.nonce(), entry.value());
    if (plaintext.isEmpty()) {
      return recordInvalidAttempt(entry);
    }
    if (!entryStore.recordClaim(ClaimedEntry.of(entry, clock.instant()))) {
      // claimed or expired by a concurrent request since the lookup
      return DecryptEntryResult.failed(false, INVALID_ENTRY);
    }
    log.info("Entry {} claimed", entry.id());
    return DecryptEntryResult.revealed(plaintext.get());
  }

  private DecryptEntryResult recordInvalidAttempt(Entry entry) {
    OptionalInt attempts = entryStore.incrementInvalidAttempts(entry.id());
    if (attempts.isEmpty()) {
      return DecryptEntryResult.failed(false, INVALID_SECRET);
    }
    log.debug("Invalid secret for entry {} (attempt {})", entry.id(), attempts.getAsInt());
    if (attempts.getAsInt() >= maxInvalidAttempts) {
      expire(entry, true);
      return DecryptEntryResult.failed(true, INVALID_SECRET, TOO_MANY_ATTEMPTS);
    }
    return DecryptEntryResult.failed(false, INVALID_SECRET);
  }

  // ── Expiry ────────────────────────────────────────────────────────────────

  /**
   * Expires every active entry whose deadline has passed.
   *
   * @return the number of entries this call expired
   */
  public int expireOverdue() {
    int count = 0;
    for (Entry entry : entryStore.findExpiringBefore(clock.instant())) {
      if (expire(entry, false)) {
        count++;
      }
    }
    if (count > 0) {
      log.info("Expired {} overdue entries", count);
    }
    return count;
  }

  private boolean expire(Entry entry, boolean tooManyAttempts) {
    boolean moved = entryStore.recordExpiry(ExpiredEntry.of(entry, tooManyAttempts, clock.instant()));
    if (moved) {
      log.info("Entry {} expired (tooManyAttempts={})", entry.id(), tooManyAttempts);
    }
    return moved;
  }

  private static boolean nonceMatches(byte[] stored, String presentedHex) {
    if (presentedHex == null) {
      return false;
    }
    byte[] presented;
    try {
      presented = HexFormat.of().parseHex(presentedHex.trim());
    } catch (IllegalArgumentException e) {
      log.debug("Presented nonce is not valid hex");
      return false;
    }
    return MessageDigest.isEqual(stored, presented);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
