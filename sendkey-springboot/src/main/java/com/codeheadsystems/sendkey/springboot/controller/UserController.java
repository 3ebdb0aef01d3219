package com.codeheadsystems.sendkey.springboot.controller;

import com.codeheadsystems.sendkey.model.CreateUserRequest;
import com.codeheadsystems.sendkey.model.CreateUserResponse;
import com.codeheadsystems.sendkey.model.LoginRequest;
import com.codeheadsystems.sendkey.model.LoginResponse;
import com.codeheadsystems.sendkey.model.RefreshTokenRequest;
import com.codeheadsystems.sendkey.model.RefreshTokenResponse;
import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.manager.LoginResult;
import com.codeheadsystems.sendkey.server.manager.UserManager;
import com.codeheadsystems.sendkey.server.manager.UserResult;
import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.model.Views;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
public class UserController {

  private static final Logger log = LoggerFactory.getLogger(UserController.class);

  static final String INVALID_USER_ID = "Invalid userId.";
  static final String REFRESH_TOKEN_REQUIRED = "A refresh token is required.";
  static final String INVALID_REFRESH_TOKEN = "Invalid refresh token.";

  private final UserManager userManager;
  private final TokenManager tokenManager;

  public UserController(UserManager userManager, TokenManager tokenManager) {
    this.userManager = userManager;
    this.tokenManager = tokenManager;
  }

  @PostMapping("/users")
  public ResponseEntity<CreateUserResponse> createUser(@RequestBody(required = false) CreateUserRequest request) {
    log.debug("createUser()");
    if (request == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body");
    }
    UserResult result = userManager.createUser(request.email(), request.password(),
        request.firstName(), request.lastName());
    if (!result.success()) {
      return ResponseEntity.badRequest().body(CreateUserResponse.failed(result.errors()));
    }
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(CreateUserResponse.created(Views.user(result.user().get())));
  }

  @PostMapping("/login")
  public ResponseEntity<LoginResponse> login(@RequestBody(required = false) LoginRequest request) {
    log.debug("login()");
    if (request == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body");
    }
    LoginResult result = userManager.login(request.email(), request.password());
    if (!result.success()) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(LoginResponse.failed(result.errors()));
    }
    return ResponseEntity.ok(new LoginResponse(true, List.of(), Views.user(result.user()),
        Views.token(result.accessToken()), Views.token(result.refreshToken())));
  }

  @PostMapping("/token")
  public ResponseEntity<RefreshTokenResponse> refresh(@RequestBody(required = false) RefreshTokenRequest request) {
    log.debug("refresh()");
    if (request == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body");
    }
    Optional<UUID> userId = parseUserId(request.userId());
    if (userId.isEmpty()) {
      return badRequest(INVALID_USER_ID);
    }
    if (request.refreshToken() == null || request.refreshToken().isBlank()) {
      return badRequest(REFRESH_TOKEN_REQUIRED);
    }
    Optional<RefreshToken> refreshToken = tokenManager.verifyRefreshToken(request.refreshToken(), userId.get());
    if (refreshToken.isEmpty()) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(RefreshTokenResponse.failed(List.of(INVALID_REFRESH_TOKEN)));
    }
    return ResponseEntity.ok(RefreshTokenResponse.refreshed(
        Views.token(tokenManager.refreshAccessToken(refreshToken.get()))));
  }

  private static ResponseEntity<RefreshTokenResponse> badRequest(String error) {
    return ResponseEntity.badRequest().body(RefreshTokenResponse.failed(List.of(error)));
  }

  private static Optional<UUID> parseUserId(String userId) {
    if (userId == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(userId.trim()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
