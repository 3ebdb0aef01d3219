package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.UUID;

/**
 * Outward view of an active entry. The nonce and the ciphertext are never part of it.
 *
 * @param id           entry identifier
 * @param name         display name
 * @param sentByUserId identifier of the user who created the entry
 * @param sentToEmail  recipient email address
 * @param createdAtUtc creation instant
 * @param expiresAtUtc instant after which the entry can no longer be revealed
 */
public record EntryView(
    @JsonProperty("id") UUID id,
    @JsonProperty("name") String name,
    @JsonProperty("sentByUserId") UUID sentByUserId,
    @JsonProperty("sentToEmail") String sentToEmail,
    @JsonProperty("createdAtUtc") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant createdAtUtc,
    @JsonProperty("expiresAtUtc") @JsonFormat(shape = JsonFormat.Shape.STRING) Instant expiresAtUtc) {
}
