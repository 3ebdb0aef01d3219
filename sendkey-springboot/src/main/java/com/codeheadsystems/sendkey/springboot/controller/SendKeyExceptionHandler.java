package com.codeheadsystems.sendkey.springboot.controller;

import com.codeheadsystems.sendkey.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * Renders controller failures as {@link ErrorResponse} bodies, following the manager exception
 * contract: {@link IllegalArgumentException} is 400, {@link SecurityException} is 401 and
 * {@link IllegalStateException} is 503. Exception messages are logged, never sent to the client.
 */
@RestControllerAdvice(assignableTypes = {EntryController.class, UserController.class})
public class SendKeyExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(SendKeyExceptionHandler.class);

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException e) {
    return error(HttpStatus.valueOf(e.getStatusCode().value()), e.getReason());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException e) {
    log.debug("Bad request: {}", e.getMessage());
    return error(HttpStatus.BAD_REQUEST, "Bad request");
  }

  @ExceptionHandler(SecurityException.class)
  public ResponseEntity<ErrorResponse> handleUnauthorized(SecurityException e) {
    return error(HttpStatus.UNAUTHORIZED, "Authentication required");
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleUnavailable(IllegalStateException e) {
    log.error("Service unavailable", e);
    return error(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable");
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(status.value(), message));
  }
}
