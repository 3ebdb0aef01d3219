package com.codeheadsystems.sendkey.server.resource;

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
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for accounts and tokens.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /users} register</li>
 *   <li>{@code POST /login} exchange email and password for a token pair</li>
 *   <li>{@code POST /token} exchange a refresh token for a new access token</li>
 * </ul>
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

  private static final Logger log = LoggerFactory.getLogger(UserResource.class);

  static final String INVALID_USER_ID = "Invalid userId.";
  static final String REFRESH_TOKEN_REQUIRED = "A refresh token is required.";
  static final String INVALID_REFRESH_TOKEN = "Invalid refresh token.";

  private final UserManager userManager;
  private final TokenManager tokenManager;

  public UserResource(UserManager userManager, TokenManager tokenManager) {
    this.userManager = userManager;
    this.tokenManager = tokenManager;
  }

  @POST
  @Path("users")
  public Response createUser(CreateUserRequest request) {
    log.debug("createUser()");
    if (request == null) {
      throw BearerAuth.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    UserResult result = userManager.createUser(request.email(), request.password(),
        request.firstName(), request.lastName());
    if (!result.success()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .entity(CreateUserResponse.failed(result.errors()))
          .build();
    }
    return Response.status(Response.Status.CREATED)
        .entity(CreateUserResponse.created(Views.user(result.user().get())))
        .build();
  }

  @POST
  @Path("login")
  public Response login(LoginRequest request) {
    log.debug("login()");
    if (request == null) {
      throw BearerAuth.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    LoginResult result = userManager.login(request.email(), request.password());
    if (!result.success()) {
      return Response.status(Response.Status.UNAUTHORIZED)
          .entity(LoginResponse.failed(result.errors()))
          .build();
    }
    return Response.ok(new LoginResponse(true, List.of(), Views.user(result.user()),
        Views.token(result.accessToken()), Views.token(result.refreshToken()))).build();
  }

  @POST
  @Path("token")
  public Response refresh(RefreshTokenRequest request) {
    log.debug("refresh()");
    if (request == null) {
      throw BearerAuth.error(Response.Status.BAD_REQUEST, "Missing request body");
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
      return Response.status(Response.Status.UNAUTHORIZED)
          .entity(RefreshTokenResponse.failed(List.of(INVALID_REFRESH_TOKEN)))
          .build();
    }
    return Response.ok(RefreshTokenResponse.refreshed(
        Views.token(tokenManager.refreshAccessToken(refreshToken.get())))).build();
  }

  private static Response badRequest(String error) {
    return Response.status(Response.Status.BAD_REQUEST)
        .entity(RefreshTokenResponse.failed(List.of(error)))
        .build();
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
