package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Generic error body for failures that are not validation results.
 *
 * @param statusCode the HTTP status code
 * @param message    a short, non-sensitive description
 */
public record ErrorResponse(
    @JsonProperty("statusCode") int statusCode,
    @JsonProperty("message") String message) {
}
