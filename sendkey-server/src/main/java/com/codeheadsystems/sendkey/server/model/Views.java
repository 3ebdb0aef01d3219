package com.codeheadsystems.sendkey.server.model;

import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.Token;
import com.codeheadsystems.sendkey.model.UserView;
import com.codeheadsystems.sendkey.server.auth.IssuedToken;

/**
 * Conversions from domain records to their wire views, shared by the JAX-RS resources and
 * the Spring controllers.
 */
public final class Views {

  private Views() {
  }

  public static EntryView entry(Entry entry) {
    return new EntryView(entry.id(), entry.name(), entry.sentByUserId(), entry.sentToEmail(),
        entry.createdAt(), entry.expiresAt());
  }

  public static UserView user(User user) {
    return new UserView(user.id(), user.email(), user.emailVerified(), user.firstName(),
        user.lastName(), user.createdAt());
  }

  public static Token token(IssuedToken token) {
    return new Token(token.value(), token.expiresAt().getEpochSecond());
  }

  public static Token token(RefreshToken token) {
    return new Token(token.token(), token.expiresAt().getEpochSecond());
  }
}
