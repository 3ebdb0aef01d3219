package com.codeheadsystems.sendkey.server.manager;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically runs {@link EntryManager#expireOverdue()} so entries nobody reads again still
 * reach the expired projection.
 * <p>
 * Call {@link #start()} once and {@link #shutdown()} on application stop. In Dropwizard, wrap
 * it in a {@code Managed}; in Spring Boot declare it with
 * {@code @Bean(initMethod = "start", destroyMethod = "shutdown")}.
 */
public class EntryReaper {

  private static final Logger log = LoggerFactory.getLogger(EntryReaper.class);

  private final EntryManager entryManager;
  private final Duration interval;
  private final ScheduledExecutorService executor =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sendkey-entry-reaper");
        t.setDaemon(true);
        return t;
      });

  public EntryReaper(EntryManager entryManager, Duration interval) {
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Reaper interval must be positive");
    }
    this.entryManager = entryManager;
    this.interval = interval;
  }

  public void start() {
    log.info("Starting entry reaper every {}", interval);
    long millis = interval.toMillis();
    executor.scheduleAtFixedRate(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
  }

  public void shutdown() {
    executor.shutdown();
  }

  void sweep() {
    try {
      entryManager.expireOverdue();
    } catch (RuntimeException e) {
      // an exception escaping here would cancel every later run
      log.error("Entry reaper sweep failed", e);
    }
  }
}
