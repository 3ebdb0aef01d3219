package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exchanges a refresh token for a new access token.
 * <p>
 * {@code userId} is kept as a string so a malformed value can be reported as a
 * validation error instead of a deserialization failure.
 * <p>
 * Used by: {@code POST /token}
 *
 * @param userId       the user the refresh token was issued to
 * @param refreshToken the opaque refresh token value
 */
public record RefreshTokenRequest(
    @JsonProperty("userId") String userId,
    @JsonProperty("refreshToken") String refreshToken) {
}
