package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefreshTokenResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("accessToken") Token accessToken) {

  public static RefreshTokenResponse refreshed(Token accessToken) {
    return new RefreshTokenResponse(true, List.of(), accessToken);
  }

  public static RefreshTokenResponse failed(List<String> errors) {
    return new RefreshTokenResponse(false, errors, null);
  }
}
