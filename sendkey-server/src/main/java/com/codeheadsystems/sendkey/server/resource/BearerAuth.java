package com.codeheadsystems.sendkey.server.resource;

import com.codeheadsystems.sendkey.model.ErrorResponse;
import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.auth.TokenVerificationException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the caller from an {@code Authorization: Bearer ...} header.
 */
final class BearerAuth {

  private static final Logger log = LoggerFactory.getLogger(BearerAuth.class);
  private static final String PREFIX = "Bearer ";

  private BearerAuth() {
  }

  static UUID requireCaller(TokenManager tokenManager, String authorizationHeader) {
    String token = authorizationHeader != null && authorizationHeader.startsWith(PREFIX)
        ? authorizationHeader.substring(PREFIX.length()).trim()
        : null;
    try {
      return tokenManager.verifyAccessToken(token);
    } catch (TokenVerificationException e) {
      log.debug("Rejected bearer token: {}", e.reason());
      throw error(Response.Status.UNAUTHORIZED, "Authentication required");
    }
  }

  static WebApplicationException error(Response.Status status, String message) {
    return new WebApplicationException(Response.status(status)
        .type(MediaType.APPLICATION_JSON)
        .entity(new ErrorResponse(status.getStatusCode(), message))
        .build());
  }
}
