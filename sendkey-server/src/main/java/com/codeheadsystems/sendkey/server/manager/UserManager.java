package com.codeheadsystems.sendkey.server.manager;

import com.codeheadsystems.sendkey.server.auth.IssuedToken;
import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.crypto.PasswordHasher;
import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.model.User;
import com.codeheadsystems.sendkey.server.store.UserStore;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Account registration and password login.
 * <p>
 * A successful login returns a new access token and a new persisted refresh token.
 */
public class UserManager {

  private static final Logger log = LoggerFactory.getLogger(UserManager.class);

  public static final String EMAIL_REQUIRED = "An email is required.";
  public static final String PASSWORD_REQUIRED = "A password is required.";
  public static final String PASSWORD_TOO_LONG =
      "Password must be at most " + PasswordHasher.MAX_PASSWORD_BYTES + " bytes.";
  public static final String EMAIL_TOO_LONG = "Email must be at most 100 characters.";
  public static final String FIRST_NAME_TOO_LONG = "First name must be at most 100 characters.";
  public static final String LAST_NAME_TOO_LONG = "Last name must be at most 100 characters.";
  public static final String EMAIL_TAKEN = "An account with the specified email already exists.";
  public static final String UNKNOWN_EMAIL = "No user could be found with the specified email.";
  public static final String WRONG_PASSWORD = "The specified password is invalid.";

  static final int MAX_FIELD_LENGTH = 100;

  private final UserStore userStore;
  private final PasswordHasher passwordHasher;
  private final TokenManager tokenManager;
  private final Clock clock;

  public UserManager(UserStore userStore, PasswordHasher passwordHasher, TokenManager tokenManager, Clock clock) {
    this.userStore = userStore;
    this.passwordHasher = passwordHasher;
    this.tokenManager = tokenManager;
    this.clock = clock;
  }

  /**
   * Registers a new account.
   *
   * @param email     account email, normalized to lower case
   * @param password  plaintext password
   * @param firstName optional first name
   * @param lastName  optional last name
   * @return the created user, or every validation error
   */
  public UserResult createUser(String email, String password, String firstName, String lastName) {
    log.debug("createUser()");
    List<String> errors = new ArrayList<>();
    if (email == null || email.isBlank()) {
      errors.add(EMAIL_REQUIRED);
    } else if (normalize(email).length() > MAX_FIELD_LENGTH) {
      errors.add(EMAIL_TOO_LONG);
    }
    if (password == null || password.isEmpty()) {
      errors.add(PASSWORD_REQUIRED);
    } else if (password.getBytes(StandardCharsets.UTF_8).length > PasswordHasher.MAX_PASSWORD_BYTES) {
      errors.add(PASSWORD_TOO_LONG);
    }
    if (tooLong(trimToNull(firstName))) {
      errors.add(FIRST_NAME_TOO_LONG);
    }
    if (tooLong(trimToNull(lastName))) {
      errors.add(LAST_NAME_TOO_LONG);
    }
    if (!errors.isEmpty()) {
      return new UserResult(Optional.empty(), List.copyOf(errors));
    }

    String normalized = normalize(email);
    if (userStore.findByEmail(normalized).isPresent()) {
      return new UserResult(Optional.empty(), List.of(EMAIL_TAKEN));
    }
    User user = new User(UUID.randomUUID(), normalized, false, trimToNull(firstName), trimToNull(lastName),
        passwordHasher.hash(password), clock.instant());
    if (!userStore.create(user)) {
      return new UserResult(Optional.empty(), List.of(EMAIL_TAKEN));
    }
    log.info("Created user {}", user.id());
    return new UserResult(Optional.of(user), List.of());
  }

  /**
   * Checks credentials and issues a token pair.
   *
   * @param email    account email
   * @param password plaintext password
   * @return the user and tokens, or the failure reason
   */
  public LoginResult login(String email, String password) {
    log.debug("login()");
    if (email == null || email.isBlank()) {
      return LoginResult.failed(EMAIL_REQUIRED);
    }
    if (password == null || password.isEmpty()) {
      return LoginResult.failed(PASSWORD_REQUIRED);
    }
    Optional<User> found = userStore.findByEmail(normalize(email));
    if (found.isEmpty()) {
      return LoginResult.failed(UNKNOWN_EMAIL);
    }
    User user = found.get();
    if (password.getBytes(StandardCharsets.UTF_8).length > PasswordHasher.MAX_PASSWORD_BYTES
        || !passwordHasher.matches(user.passwordHash(), password)) {
      log.debug("Wrong password for user {}", user.id());
      return LoginResult.failed(WRONG_PASSWORD);
    }
    IssuedToken accessToken = tokenManager.issueAccessToken(user.id());
    RefreshToken refreshToken = tokenManager.createRefreshToken(user.id());
    log.info("User {} logged in", user.id());
    return new LoginResult(user, accessToken, refreshToken, List.of());
  }

  public Optional<User> findUser(UUID id) {
    return userStore.find(id);
  }

  private static String normalize(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  private static String trimToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static boolean tooLong(String value) {
    return value != null && value.length() > MAX_FIELD_LENGTH;
  }
}
