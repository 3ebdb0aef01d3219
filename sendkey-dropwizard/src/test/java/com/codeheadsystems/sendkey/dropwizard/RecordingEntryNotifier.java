package com.codeheadsystems.sendkey.dropwizard;

import com.codeheadsystems.sendkey.server.model.Entry;
import com.codeheadsystems.sendkey.server.notify.EntryNotifier;
import java.util.HexFormat;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Test notifier that keeps the nonce of every created entry so tests can play the recipient.
 */
public class RecordingEntryNotifier implements EntryNotifier {

  private final Map<UUID, String> noncesByEntry = new ConcurrentHashMap<>();

  @Override
  public void entryCreated(Entry entry) {
    noncesByEntry.put(entry.id(), HexFormat.of().formatHex(entry.nonce()));
  }

  public String nonceHex(UUID entryId) {
    String nonce = noncesByEntry.get(entryId);
    if (nonce == null) {
      throw new IllegalStateException("No notification for entry " + entryId);
    }
    return nonce;
  }
}
