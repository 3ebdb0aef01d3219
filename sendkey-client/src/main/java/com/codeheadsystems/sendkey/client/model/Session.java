package com.codeheadsystems.sendkey.client.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.UUID;

/**
 * The locally saved login state.
 *
 * @param userId       the logged in user
 * @param accessToken  current access token
 * @param refreshToken refresh token issued at login
 */
public record Session(
    @JsonProperty("userId") UUID userId,
    @JsonProperty("accessToken") String accessToken,
    @JsonProperty("refreshToken") String refreshToken) {

  public Session withAccessToken(String newAccessToken) {
    return new Session(userId, newAccessToken, refreshToken);
  }

  @Override
  public String toString() {
    return "Session[userId=" + userId + "]";
  }
}
