package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.User;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link UserStore}.
 */
public class InMemoryUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryUserStore.class);

  private final ConcurrentHashMap<UUID, User> users = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, UUID> idsByEmail = new ConcurrentHashMap<>();

  public InMemoryUserStore() {
    log.warn("Using InMemoryUserStore: accounts will NOT survive restarts.");
  }

  @Override
  public Optional<User> find(UUID id) {
    return Optional.ofNullable(users.get(id));
  }

  @Override
  public Optional<User> findByEmail(String email) {
    return Optional.ofNullable(idsByEmail.get(email)).map(users::get);
  }

  @Override
  public boolean create(User user) {
    if (idsByEmail.putIfAbsent(user.email(), user.id()) != null) {
      return false;
    }
    users.put(user.id(), user);
    return true;
  }
}
