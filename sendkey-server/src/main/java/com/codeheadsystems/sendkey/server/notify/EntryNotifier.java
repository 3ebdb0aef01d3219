package com.codeheadsystems.sendkey.server.notify;

import com.codeheadsystems.sendkey.server.model.Entry;

/**
 * Delivers the link for a new entry (its id and hex nonce) to the recipient.
 * <p>
 * Called after the entry is persisted. An exception thrown here makes the creation fail and
 * the entry is deleted again.
 */
public interface EntryNotifier {

  void entryCreated(Entry entry);
}
