package com.codeheadsystems.sendkey.server.manager;

import com.codeheadsystems.sendkey.server.model.User;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link UserManager#createUser}.
 */
public record UserResult(Optional<User> user, List<String> errors) {

  public boolean success() {
    return user.isPresent();
  }
}
