package com.codeheadsystems.sendkey.server.store;

import com.codeheadsystems.sendkey.server.model.RefreshToken;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage abstraction for refresh tokens. Implementations must be thread-safe.
 */
public interface RefreshTokenStore {

  void create(RefreshToken refreshToken);

  /**
   * Finds a token by exact value, scoped to the user it was issued to.
   *
   * @param token  the presented value
   * @param userId the claimed owner
   * @return the record, or empty if the value is unknown or belongs to another user
   */
  Optional<RefreshToken> findByTokenAndUser(String token, UUID userId);

  void delete(UUID id);
}
