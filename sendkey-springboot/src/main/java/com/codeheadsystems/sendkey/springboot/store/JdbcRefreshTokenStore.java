package com.codeheadsystems.sendkey.springboot.store;

import com.codeheadsystems.sendkey.server.model.RefreshToken;
import com.codeheadsystems.sendkey.server.store.RefreshTokenStore;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link RefreshTokenStore} over the {@code refresh_tokens} table.
 */
public class JdbcRefreshTokenStore implements RefreshTokenStore {

  private final JdbcClient jdbc;

  public JdbcRefreshTokenStore(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public void create(RefreshToken refreshToken) {
    jdbc.sql("INSERT INTO refresh_tokens (id, user_id, token, created_at, expires_at) VALUES (?, ?, ?, ?, ?)")
        .params(refreshToken.id(), refreshToken.userId(), refreshToken.token(),
            Timestamp.from(refreshToken.createdAt()), Timestamp.from(refreshToken.expiresAt()))
        .update();
  }

  @Override
  public Optional<RefreshToken> findByTokenAndUser(String token, UUID userId) {
    return jdbc.sql("""
            SELECT id, user_id, token, created_at, expires_at
            FROM refresh_tokens WHERE token = ? AND user_id = ?""")
        .params(token, userId)
        .query((rs, rowNum) -> new RefreshToken(
            rs.getObject("id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getString("token"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("expires_at").toInstant()))
        .optional();
  }

  @Override
  public void delete(UUID id) {
    jdbc.sql("DELETE FROM refresh_tokens WHERE id = ?").param(id).update();
  }
}
