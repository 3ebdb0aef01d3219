package com.codeheadsystems.sendkey.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.AlgorithmMismatchException;
import com.auth0.jwt.exceptions.InvalidClaimException;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.SignatureVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.sendkey.server.auth.TokenVerificationException.Reason;
import com.codeheadsystems.sendkey.server.crypto.RandomProvider;
import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.store.RefreshTokenStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies access and refresh tokens.
 * <p>
 * Access tokens are HS256 JWTs whose subject is the user id. They are verified by signature
 * alone; nothing is looked up. Refresh tokens are {@value #REFRESH_TOKEN_BYTES} random bytes in
 * lowercase hex, bound to a user only through the {@link RefreshTokenStore} record.
 */
public class TokenManager {

  private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

  /**
   * Entropy of a refresh token value.
   */
  public static final int REFRESH_TOKEN_BYTES = 25;

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration accessTokenTtl;
  private final Duration refreshTokenTtl;
  private final RefreshTokenStore refreshTokenStore;
  private final RandomProvider randomProvider;
  private final Clock clock;

  /**
   * Creates a new TokenManager.
   *
   * @param secret            HMAC-SHA256 signing secret
   * @param issuer            JWT issuer claim
   * @param accessTokenTtl    access token lifetime
   * @param refreshTokenTtl   refresh token lifetime
   * @param refreshTokenStore backing store for refresh tokens
   * @param randomProvider    source of refresh token entropy
   * @param clock             time source for issue and expiry instants
   */
  public TokenManager(byte[] secret, String issuer, Duration accessTokenTtl, Duration refreshTokenTtl,
                      RefreshTokenStore refreshTokenStore, RandomProvider randomProvider, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = JWT.require(algorithm).withIssuer(issuer).build();
    this.issuer = issuer;
    this.accessTokenTtl = accessTokenTtl;
    this.refreshTokenTtl = refreshTokenTtl;
    this.refreshTokenStore = refreshTokenStore;
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  // ── Access tokens ─────────────────────────────────────────────────────────

  /**
   * Issues a signed access token for a user.
   *
   * @param userId the user
   * @return the token and its expiry
   */
  public IssuedToken issueAccessToken(UUID userId) {
    Instant now = clock.instant();
    Instant expiresAt = now.plus(accessTokenTtl);
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withSubject(userId.toString())
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);
    log.debug("Issued access token for user {}", userId);
    return new IssuedToken(token, expiresAt);
  }

  /**
   * Verifies an access token and returns the user it was issued to.
   *
   * @param token the bearer token, without the {@code Bearer } prefix
   * @return the user id
   * @throws TokenVerificationException with a reason describing the rejection
   */
  public UUID verifyAccessToken(String token) {
    if (token == null || token.isBlank()) {
      throw new TokenVerificationException(Reason.MISSING_TOKEN, "No token provided");
    }
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(token);
    } catch (AlgorithmMismatchException | SignatureVerificationException e) {
      throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Token signature is invalid", e);
    } catch (TokenExpiredException e) {
      throw new TokenVerificationException(Reason.EXPIRED, "Token has expired", e);
    } catch (JWTDecodeException e) {
      throw new TokenVerificationException(Reason.MALFORMED, "Token could not be parsed", e);
    } catch (InvalidClaimException e) {
      throw new TokenVerificationException(Reason.INVALID_CLAIMS, "Invalid token claims", e);
    } catch (JWTVerificationException e) {
      throw new TokenVerificationException(Reason.INVALID_SIGNATURE, "Token is invalid", e);
    }
    String subject = decoded.getSubject();
    if (subject == null) {
      throw new TokenVerificationException(Reason.INVALID_CLAIMS, "Invalid token claims");
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      throw new TokenVerificationException(Reason.INVALID_CLAIMS, "Invalid token claims", e);
    }
  }

  /**
   * Verifies an access token, reporting any rejection as empty.
   *
   * @param token the bearer token
   * @return the user id if the token is valid
   */
  public Optional<UUID> verify(String token) {
    try {
      return Optional.of(verifyAccessToken(token));
    } catch (TokenVerificationException e) {
      log.debug("Access token rejected: {}", e.reason());
      return Optional.empty();
    }
  }

  // ── Refresh tokens ────────────────────────────────────────────────────────

  /**
   * Generates a refresh token value. Nothing is persisted.
   *
   * @return the value and its expiry
   */
  public IssuedToken issueRefreshToken() {
    return new IssuedToken(randomProvider.randomHex(REFRESH_TOKEN_BYTES), clock.instant().plus(refreshTokenTtl));
  }

  /**
   * Generates a refresh token for a user and persists the binding.
   *
   * @param userId the owner
   * @return the stored record
   */
  public RefreshToken createRefreshToken(UUID userId) {
    IssuedToken issued = issueRefreshToken();
    RefreshToken refreshToken = new RefreshToken(UUID.randomUUID(), userId, issued.value(),
        clock.instant(), issued.expiresAt());
    refreshTokenStore.create(refreshToken);
    log.debug("Created refresh token {} for user {}", refreshToken.id(), userId);
    return refreshToken;
  }

  /**
   * Looks up a presented refresh token. Both the exact value and the owner must match.
   * A matching record past its expiry is deleted and refused.
   *
   * @param token  the presented value
   * @param userId the claimed owner
   * @return the record if it is valid
   */
  public Optional<RefreshToken> verifyRefreshToken(String token, UUID userId) {
    if (token == null || token.isBlank() || userId == null) {
      return Optional.empty();
    }
    Optional<RefreshToken> found = refreshTokenStore.findByTokenAndUser(token, userId);
    if (found.isPresent() && !found.get().expiresAt().isAfter(clock.instant())) {
      log.debug("Refresh token {} expired, deleting", found.get().id());
      refreshTokenStore.delete(found.get().id());
      return Optional.empty();
    }
    return found;
  }

  /**
   * Issues a new access token for the owner of a verified refresh token. The refresh token
   * itself is left untouched.
   *
   * @param refreshToken a record returned by {@link #verifyRefreshToken}
   * @return the new access token
   */
  public IssuedToken refreshAccessToken(RefreshToken refreshToken) {
    return issueAccessToken(refreshToken.userId());
  }
}
