package com.codeheadsystems.sendkey.springboot.config;

import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.crypto.EntryCipher;
import com.codeheadsystems.sendkey.server.crypto.PasswordHasher;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import com.codeheadsystems.sendkey.server.manager.EntryManager;
import com.codeheadsystems.sendkey.server.manager.EntryReaper;
import com.codeheadsystems.sendkey.server.manager.UserManager;
import com.codeheadsystems.sendkey.server.notify.EntryNotifier;
import com.codeheadsystems.sendkey.server.notify.LoggingEntryNotifier;
import com.codeheadsystems.sendkey.server.store.EntryStore;
import com.codeheadsystems.sendkey.server.store.InMemoryEntryStore;
import com.codeheadsystems.sendkey.server.store.InMemoryRefreshTokenStore;
import com.codeheadsystems.sendkey.server.store.InMemoryUserStore;
import com.codeheadsystems.sendkey.server.store.RefreshTokenStore;
import com.codeheadsystems.sendkey.server.store.UserStore;
import com.codeheadsystems.sendkey.springboot.store.JdbcEntryStore;
import com.codeheadsystems.sendkey.springboot.store.JdbcRefreshTokenStore;
import com.codeheadsystems.sendkey.springboot.store.JdbcUserStore;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Wires the sendkey managers from {@link SendKeyProperties}.
 * <p>
 * Stores are in-memory unless {@code sendkey.store=jdbc}, in which case they run against the
 * application's {@code DataSource} with the schema applied by Flyway from
 * {@code classpath:db/migration}. Every bean backs off when the application defines its own,
 * so a real {@link EntryNotifier} replaces the logging one:
 * <pre>{@code
 *   @Bean
 *   public EntryNotifier entryNotifier(MailSender mailSender) {
 *     return new MailEntryNotifier(mailSender);
 *   }
 * }</pre>
 * The controllers, security configuration and health indicator live under
 * {@code com.codeheadsystems.sendkey.springboot} and are picked up by component scanning.
 */
@AutoConfiguration
@EnableConfigurationProperties(SendKeyProperties.class)
public class SendKeyAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(SendKeyAutoConfiguration.class);
  private static final int KEY_LENGTH = 32;
  private static final String STORE_PROPERTY = "store";

  @Bean
  @ConditionalOnMissingBean
  public RandomProvider randomProvider() {
    return new RandomProvider();
  }

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  // ── Stores ────────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "memory", matchIfMissing = true)
  public EntryStore entryStore() {
    return new InMemoryEntryStore();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "memory", matchIfMissing = true)
  public UserStore userStore() {
    return new InMemoryUserStore();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "memory", matchIfMissing = true)
  public RefreshTokenStore refreshTokenStore() {
    return new InMemoryRefreshTokenStore();
  }

  @Bean
  @ConditionalOnMissingBean(EntryStore.class)
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "jdbc")
  public JdbcEntryStore jdbcEntryStore(JdbcClient jdbcClient, PlatformTransactionManager transactionManager) {
    return new JdbcEntryStore(jdbcClient, new TransactionTemplate(transactionManager));
  }

  @Bean
  @ConditionalOnMissingBean(UserStore.class)
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "jdbc")
  public JdbcUserStore jdbcUserStore(JdbcClient jdbcClient) {
    return new JdbcUserStore(jdbcClient);
  }

  @Bean
  @ConditionalOnMissingBean(RefreshTokenStore.class)
  @ConditionalOnProperty(prefix = "sendkey", name = STORE_PROPERTY, havingValue = "jdbc")
  public JdbcRefreshTokenStore jdbcRefreshTokenStore(JdbcClient jdbcClient) {
    return new JdbcRefreshTokenStore(jdbcClient);
  }

  @Bean
  @ConditionalOnMissingBean
  public EntryNotifier entryNotifier() {
    log.warn("Using logging entry notifier. Recipients will not be told about their entries. "
        + "Do not use in production.");
    return new LoggingEntryNotifier();
  }

  // ── Crypto and tokens ─────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public EntryCipher entryCipher(SendKeyProperties props, RandomProvider randomProvider) {
    return new EntryCipher(key(props.getMasterKeyHex(), "masterKeyHex", "Stored entries", randomProvider));
  }

  @Bean
  @ConditionalOnMissingBean
  public PasswordHasher passwordHasher(SendKeyProperties props, RandomProvider randomProvider) {
    return new PasswordHasher(randomProvider, props.getBcryptCost());
  }

  @Bean
  @ConditionalOnMissingBean
  public TokenManager tokenManager(SendKeyProperties props,
                                   RefreshTokenStore refreshTokenStore,
                                   RandomProvider randomProvider,
                                   Clock clock) {
    return new TokenManager(
        key(props.getJwtSecretHex(), "jwtSecretHex", "Issued tokens", randomProvider),
        props.getJwtIssuer(),
        Duration.ofSeconds(props.getAccessTokenTtlSeconds()),
        Duration.ofSeconds(props.getRefreshTokenTtlSeconds()),
        refreshTokenStore, randomProvider, clock);
  }

  // ── Managers ──────────────────────────────────────────────────────────────

  @Bean
  @ConditionalOnMissingBean
  public EntryManager entryManager(SendKeyProperties props,
                                   EntryStore entryStore,
                                   EntryCipher entryCipher,
                                   EntryNotifier entryNotifier,
                                   RandomProvider randomProvider,
                                   Clock clock) {
    return new EntryManager(entryStore, entryCipher, entryNotifier, randomProvider, clock,
        props.getMaxInvalidAttempts(), props.getMaxValueBytes());
  }

  @Bean
  @ConditionalOnMissingBean
  public UserManager userManager(UserStore userStore,
                                 PasswordHasher passwordHasher,
                                 TokenManager tokenManager,
                                 Clock clock) {
    return new UserManager(userStore, passwordHasher, tokenManager, clock);
  }

  @Bean(initMethod = "start", destroyMethod = "shutdown")
  @ConditionalOnMissingBean
  @ConditionalOnExpression("${sendkey.reaper-interval-seconds:60} > 0")
  public EntryReaper entryReaper(SendKeyProperties props, EntryManager entryManager) {
    return new EntryReaper(entryManager, Duration.ofSeconds(props.getReaperIntervalSeconds()));
  }

  private static byte[] key(String hex, String name, String lostOnRestart, RandomProvider randomProvider) {
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
