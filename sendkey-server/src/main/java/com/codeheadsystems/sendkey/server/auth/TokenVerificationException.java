package com.codeheadsystems.sendkey.server.auth;

/**
 * Raised when an access token is rejected. {@link #reason()} is stable and safe to log;
 * the HTTP layer maps every reason to 401.
 */
public class TokenVerificationException extends SecurityException {

  /**
   * Why a token was rejected.
   */
  public enum Reason {
    /** No token was presented. */
    MISSING_TOKEN,
    /** Signature does not verify, or the header names a different algorithm. */
    INVALID_SIGNATURE,
    /** The {@code exp} claim is in the past. */
    EXPIRED,
    /** The value is not a decodable JWT. */
    MALFORMED,
    /** Issuer is wrong, or the subject is missing or not a user id. */
    INVALID_CLAIMS
  }

  private final Reason reason;

  public TokenVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
