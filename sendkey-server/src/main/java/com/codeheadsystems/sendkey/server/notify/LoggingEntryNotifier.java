package com.codeheadsystems.sendkey.server.notify;

import com.codeheadsystems.sendkey.server.model.Entry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EntryNotifier} that only records that a notification would have been sent.
 * The nonce is not logged.
 */
public class LoggingEntryNotifier implements EntryNotifier {

  private static final Logger log = LoggerFactory.getLogger(LoggingEntryNotifier.class);

  public LoggingEntryNotifier() {
    log.warn("Using LoggingEntryNotifier: recipients will NOT be emailed their entry links.");
  }

  @Override
  public void entryCreated(Entry entry) {
    log.info("Entry {} created for {}; no notification transport configured", entry.id(), entry.sentToEmail());
  }
}
