package com.codeheadsystems.sendkey.dropwizard;

import com.codeheadsystems.sendkey.dropwizard.auth.SendKeyAuthenticator;
import com.codeheadsystems.sendkey.dropwizard.auth.SendKeyPrincipal;
import com.codeheadsystems.sendkey.dropwizard.health.EntryCipherHealthCheck;
import com.codeheadsystems.sendkey.dropwizard.lifecycle.ManagedEntryReaper;
import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.crypto.EntryCipher;
import com.codeheadsystems.sendkey.server.crypto.PasswordHasher;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import com.codeheadsystems.sendkey.server.manager.EntryManager;
import com.codeheadsystems.sendkey.server.manager.EntryReaper;
import com.codeheadsystems.sendkey.server.manager.UserManager;
import com.codeheadsystems.sendkey.server.notify.EntryNotifier;
import com.codeheadsystems.sendkey.server.notify.LoggingEntryNotifier;
import com.codeheadsystems.sendkey.server.resource.EntryResource;
import com.codeheadsystems.sendkey.server.resource.UserResource;
import com.codeheadsystems.sendkey.server.store.EntryStore;
import com.codeheadsystems.sendkey.server.store.InMemoryEntryStore;
import com.codeheadsystems.sendkey.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.sendkey.server.store.InMemoryUserStore;
import com.codeheadsystems.sendkey.server.store.RefreshTokenStore;
import com.codeheadsystems.sendkey.server.store.UserStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the sendkey server into an existing Dropwizard application.
 * <p>
 * Registers the entry and user JAX-RS resources, the cipher health check, the bearer-token
 * authentication filter and, when {@code reaperIntervalSeconds > 0}, the periodic expiry sweep.
 * Requires a {@link SendKeyConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new SendKeyBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and a real notifier:
 * <pre>{@code
 *   bootstrap.addBundle(new SendKeyBundle<>(entryStore, userStore, refreshTokenStore, mailNotifier));
 * }</pre>
 * Consumers can protect their own resources with {@code @Auth SendKeyPrincipal}.
 */
@Singleton
public class SendKeyBundle<C extends SendKeyConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(SendKeyBundle.class);
  private static final int KEY_LENGTH = 32;

  private final EntryStore entryStore;
  private final UserStore userStore;
  private final RefreshTokenStore refreshTokenStore;
  private final EntryNotifier entryNotifier;
  private final RandomProvider randomProvider = new RandomProvider();

  /**
   * Creates a bundle backed by in-memory stores and a notifier that only logs.
   * <p>
   * For dev/test only: all users, entries and refresh tokens are lost on restart, and nobody
   * receives the entry links.
   */
  public SendKeyBundle() {
    this(new InMemoryEntryStore(), new InMemoryUserStore(), new InMemoryRefreshTokenStore(),
        new LoggingEntryNotifier());
    log.warn("""
        #################################################################
        # WARNING: Using ephemeral in-memory stores and a logging-only  #
        # notifier. All data will be lost on restart.                   #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores and notifier.
   */
  @Inject
  public SendKeyBundle(EntryStore entryStore,
                       UserStore userStore,
                       RefreshTokenStore refreshTokenStore,
                       EntryNotifier entryNotifier) {
    this.entryStore = entryStore;
    this.userStore = userStore;
    this.refreshTokenStore = refreshTokenStore;
    this.entryNotifier = entryNotifier;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    Clock clock = Clock.systemUTC();
    EntryCipher entryCipher = new EntryCipher(
        key(configuration.getMasterKeyHex(), "masterKeyHex", "Stored entries"));
    TokenManager tokenManager = new TokenManager(
        key(configuration.getJwtSecretHex(), "jwtSecretHex", "Issued tokens"),
        configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getAccessTokenTtlSeconds()),
        Duration.ofSeconds(configuration.getRefreshTokenTtlSeconds()),
        refreshTokenStore, randomProvider, clock);
    EntryManager entryManager = new EntryManager(entryStore, entryCipher, entryNotifier, randomProvider, clock,
        configuration.getMaxInvalidAttempts(), configuration.getMaxValueBytes());
    UserManager userManager = new UserManager(userStore,
        new PasswordHasher(randomProvider, configuration.getBcryptCost()), tokenManager, clock);

    environment.jersey().register(new EntryResource(entryManager, tokenManager));
    environment.jersey().register(new UserResource(userManager, tokenManager));
    environment.healthChecks().register("entry-cipher", new EntryCipherHealthCheck(entryCipher, randomProvider));

    // Bearer auth for consumer resources
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<SendKeyPrincipal>()
            .setAuthenticator(new SendKeyAuthenticator(tokenManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(SendKeyPrincipal.class));

    if (configuration.getReaperIntervalSeconds() > 0) {
      environment.lifecycle().manage(new ManagedEntryReaper(
          new EntryReaper(entryManager, Duration.ofSeconds(configuration.getReaperIntervalSeconds()))));
    } else {
      log.info("Entry reaper disabled, entries expire lazily");
    }
  }

  private byte[] key(String hex, String name, String lostOnRestart) {
    if (hex == null || hex.isBlank()) {
      log.warn("No {} configured, generating randomly. {} will be invalidated on restart. "
          + "Do not use in production.", name, lostOnRestart);
      return randomProvider.randomBytes(KEY_LENGTH);
    }
    byte[] key;
    try {
      key = HexFormat.of().parseHex(hex.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(name + " is not valid hex", e);
    }
    if (key.length != KEY_LENGTH) {
      throw new IllegalStateException(name + " must be " + KEY_LENGTH + " bytes, was " + key.length);
    }
    return key;
  }
}
