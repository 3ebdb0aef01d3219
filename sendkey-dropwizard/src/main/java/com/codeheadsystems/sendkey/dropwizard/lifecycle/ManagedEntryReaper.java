package com.codeheadsystems.sendkey.dropwizard.lifecycle;

import com.codeheadsystems.sendkey.server.manager.EntryReaper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the {@link EntryReaper} to the Dropwizard server lifecycle.
 */
public class ManagedEntryReaper implements Managed {

  private final EntryReaper entryReaper;

  public ManagedEntryReaper(EntryReaper entryReaper) {
    this.entryReaper = entryReaper;
  }

  @Override
  public void start() {
    entryReaper.start();
  }

  @Override
  public void stop() {
    entryReaper.shutdown();
  }
}
