package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateUserResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("user") UserView user) {

  public static CreateUserResponse created(UserView user) {
    return new CreateUserResponse(true, List.of(), user);
  }

  public static CreateUserResponse failed(List<String> errors) {
    return new CreateUserResponse(false, errors, null);
  }
}
