package com.codeheadsystems.sendkey.server.model;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered user. {@code passwordHash} is a bcrypt string and is never exposed outward.
 */
public record User(
    UUID id,
    String email,
    boolean emailVerified,
    String firstName,
    String lastName,
    String passwordHash,
    Instant createdAt) {

  @Override
  public String toString() {
    return "User[id=" + id + ", email=" + email + "]";
  }
}
