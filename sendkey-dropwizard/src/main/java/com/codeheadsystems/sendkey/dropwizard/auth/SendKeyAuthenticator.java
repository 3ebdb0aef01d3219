package com.codeheadsystems.sendkey.dropwizard.auth;

import com.codeheadsystems.sendkey.server.auth.TokenManager;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;

/**
 * Dropwizard {@link Authenticator} that validates access tokens using {@link TokenManager}.
 */
public class SendKeyAuthenticator implements Authenticator<String, SendKeyPrincipal> {

  private final TokenManager tokenManager;

  public SendKeyAuthenticator(TokenManager tokenManager) {
    this.tokenManager = tokenManager;
  }

  @Override
  public Optional<SendKeyPrincipal> authenticate(String token) throws AuthenticationException {
    return tokenManager.verify(token).map(SendKeyPrincipal::new);
  }
}
