package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of {@code POST /login}. On success carries a fresh access/refresh token pair.
 *
 * @param success      whether the credentials were accepted
 * @param errors       failure reasons, empty on success
 * @param user         the authenticated user
 * @param accessToken  short-lived signed token for the {@code Authorization} header
 * @param refreshToken long-lived opaque token accepted by {@code POST /token}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("user") UserView user,
    @JsonProperty("accessToken") Token accessToken,
    @JsonProperty("refreshToken") Token refreshToken) {

  public static LoginResponse failed(List<String> errors) {
    return new LoginResponse(false, errors, null, null, null);
  }
}
