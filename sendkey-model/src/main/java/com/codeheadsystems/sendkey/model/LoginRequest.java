package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /login}
 *
 * @param email    account email
 * @param password account password
 */
public record LoginRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password) {
}
