package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /users}
 *
 * @param email     account email, unique across users
 * @param password  plaintext password, hashed before it is stored
 * @param firstName optional first name
 * @param lastName  optional last name
 */
public record CreateUserRequest(
    @JsonProperty("email") String email,
    @JsonProperty("password") String password,
    @JsonProperty("firstName") String firstName,
    @JsonProperty("lastName") String lastName) {
}
