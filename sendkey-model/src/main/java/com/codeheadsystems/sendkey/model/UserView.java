package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Outward view of a user account. The password hash is never part of it.
 *
 * @param id            user identifier
 * @param email         normalized (lower-case) email address
 * @param emailVerified whether the email address has been confirmed
 * @param firstName     optional first name
 * @param lastName      optional last name
 * @param createdAtUtc  account creation instant
 */
public record UserView(
    @JsonProperty("id") UUID id,
    @JsonProperty("email") String email,
    @JsonProperty("emailVerified") boolean emailVerified,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName,
    @JsonProperty("createdAtUtc") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAtUtc) {
}
