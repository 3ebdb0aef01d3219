package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Wire model for revealing an entry's value.
 * <p>
 * Sent as a body rather than query parameters so the secret phrase never lands in
 * access logs or browser history.
 * <p>
 * Used by: {@code POST /entries/{id}/value}
 *
 * @param nonce  hex-encoded nonce delivered to the recipient
 * @param secret the secret phrase agreed with the sender
 */
public record RevealEntryRequest(
    @JsonProperty("nonce") String nonce,
    @JsonProperty("secret") String secret) {
}
