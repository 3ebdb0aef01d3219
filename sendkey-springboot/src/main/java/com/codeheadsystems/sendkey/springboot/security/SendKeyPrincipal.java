package com.codeheadsystems.sendkey.springboot.security;

import java.security.Principal;
import java.util.UUID;

/**
 * Authenticated caller, identified by the user id carried in the access token.
 *
 * @param userId the verified subject
 */
public record SendKeyPrincipal(UUID userId) implements Principal {

  @Override
  public String getName() {
    return userId.toString();
  }
}
