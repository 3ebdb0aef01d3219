package com.codeheadsystems.sendkey.dropwizard.auth;

import java.security.Principal;
import java.util.UUID;

/**
 * Principal representing an authenticated sendkey user.
 *
 * @param userId the user id from the access token subject
 */
public record SendKeyPrincipal(UUID userId) implements Principal {

  @Override
  public String getName() {
    return userId.toString();
  }
}
