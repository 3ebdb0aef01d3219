package com.codeheadsystems.sendkey.server.manager;

import com.codeheadsystems.sendkey.server.auth.IssuedToken;
import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.model.User;
import java.util.List;

/**
 * Outcome of {@link UserManager#login}. On failure only {@code errors} is set.
 *
 * @param user         the authenticated user
 * @param accessToken  fresh access token
 * @param refreshToken fresh, persisted refresh token
 * @param errors       failure reasons, empty on success
 */
public record LoginResult(User user, IssuedToken accessToken, RefreshToken refreshToken, List<String> errors) {

  static LoginResult failed(String error) {
    return new LoginResult(null, null, null, List.of(error));
  }

  public boolean success() {
    return user != null;
  }
}
