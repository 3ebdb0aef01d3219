package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.User;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage abstraction for user accounts. Emails are stored normalized (trimmed, lower-case).
 */
public interface UserStore {

  Optional<User> find(UUID id);

  Optional<User> findByEmail(String email);

  /**
   * Persists a new user.
   *
   * @param user the user
   * @return false if another account already uses the email
   */
  boolean create(User user);
}
