package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A bearer credential and its absolute expiry.
 *
 * @param token   the access token (signed JWT) or refresh token (opaque hex)
 * @param expires expiry as unix seconds
 */
public record Token(
    @JsonProperty("token") String token,
    @JsonProperty("expires") long expires) {
}
