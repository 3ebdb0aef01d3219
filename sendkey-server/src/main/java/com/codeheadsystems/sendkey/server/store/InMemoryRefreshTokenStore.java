package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.RefreshToken;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link RefreshTokenStore}, keyed by token value.
 */
public class InMemoryRefreshTokenStore implements RefreshTokenStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRefreshTokenStore.class);

  private final ConcurrentHashMap<String, RefreshToken> byToken = new ConcurrentHashMap<>();

  public InMemoryRefreshTokenStore() {
    log.warn("Using InMemoryRefreshTokenStore: refresh tokens will NOT survive restarts.");
  }

  @Override
  public void create(RefreshToken refreshToken) {
    byToken.put(refreshToken.token(), refreshToken);
  }

  @Override
  public Optional<RefreshToken> findByTokenAndUser(String token, UUID userId) {
    return Optional.ofNullable(byToken.get(token))
        .filter(t -> t.userId().equals(userId));
  }

  @Override
  public void delete(UUID id) {
    byToken.values().removeIf(t -> t.id().equals(id));
  }
}
