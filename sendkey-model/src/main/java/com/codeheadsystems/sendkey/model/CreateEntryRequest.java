package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for creating a new secret entry.
 * <p>
 * The sender is never part of the body; it is the authenticated caller.
 * <p>
 * Used by: {@code POST /entries}
 *
 * @param name            display name shown to the recipient
 * @param sendToEmail     recipient email address that receives the nonce link
 * @param value           plaintext value to protect
 * @param secret          secret phrase the recipient must present to reveal the value
 * @param durationMinutes lifetime of the entry in minutes, must be positive
 */
public record CreateEntryRequest(
    @JsonProperty("name") String name,
    @JsonProperty("sendToEmail") String sendToEmail,
    @JsonProperty("value") String value,
    @JsonProperty("secret") String secret,
    @JsonProperty("durationMinutes") long durationMinutes) {
}
