package com.codeheadsystems.sendkey.springboot.store;

import com.codeheadsystems.sendkey.server.model.User;
import com.codeheadsystems.sendkey.server.store.UserStore;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * {@link UserStore} over the {@code users} table. The unique index on {@code email} decides
 * which of two concurrent registrations wins.
 */
public class JdbcUserStore implements UserStore {

  private static final Logger log = LoggerFactory.getLogger(JdbcUserStore.class);

  private static final String USER_COLUMNS =
      "id, email, email_verified, first_name, last_name, password_hash, created_at";

  private final JdbcClient jdbc;

  public JdbcUserStore(JdbcClient jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public Optional<User> find(UUID id) {
    return jdbc.sql("SELECT " + USER_COLUMNS + " FROM users WHERE id = ?")
        .param(id)
        .query(JdbcUserStore::user)
        .optional();
  }

  @Override
  public Optional<User> findByEmail(String email) {
    return jdbc.sql("SELECT " + USER_COLUMNS + " FROM users WHERE email = ?")
        .param(email)
        .query(JdbcUserStore::user)
        .optional();
  }

  @Override
  public boolean create(User user) {
    try {
      jdbc.sql("INSERT INTO users (" + USER_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)")
          .params(user.id(), user.email(), user.emailVerified(), user.firstName(), user.lastName(),
              user.passwordHash(), Timestamp.from(user.createdAt()))
          .update();
      return true;
    } catch (DuplicateKeyException e) {
      log.debug("Email already registered: {}", e.getMessage());
      return false;
    }
  }

  private static User user(ResultSet rs, int rowNum) throws SQLException {
    return new User(
        rs.getObject("id", UUID.class),
        rs.getString("email"),
        rs.getBoolean("email_verified"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("password_hash"),
        rs.getTimestamp("created_at").toInstant());
  }
}
