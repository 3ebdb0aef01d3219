package com.codeheadsystems.sendkey.client.exceptions;

/**
 * Raised when a call to the sendkey server fails for a reason other than authentication:
 * I/O errors, interruption, or an unexpected HTTP status.
 */
public class SendKeyAccessorException extends RuntimeException {

  private final int statusCode;

  /**
   * Instantiates a new accessor exception for a transport failure.
   *
   * @param message the message
   * @param cause   the cause
   */
  public SendKeyAccessorException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  /**
   * Instantiates a new accessor exception for an unexpected HTTP status.
   *
   * @param message    the message
   * @param statusCode the status the server returned
   */
  public SendKeyAccessorException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * @return the HTTP status, or -1 if no response was received
   */
  public int statusCode() {
    return statusCode;
  }
}
