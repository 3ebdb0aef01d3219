package com.codeheadsystems.sendkey.client.manager;

import com.codeheadsystems.sendkey.client.accessor.SendKeyAccessor;
import com.codeheadsystems.sendkey.client.model.Session;
import com.codeheadsystems.sendkey.client.session.SessionFileStore;
import com.codeheadsystems.sendkey.model.CreateEntryRequest;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.CreateUserRequest;
import com.codeheadsystems.sendkey.model.CreateUserResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.LoginRequest;
import com.codeheadsystems.sendkey.model.LoginResponse;
import com.codeheadsystems.sendkey.model.RefreshTokenRequest;
import com.codeheadsystems.sendkey.model.RefreshTokenResponse;
import com.codeheadsystems.sendkey.model.RevealEntryRequest;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session-aware client for the sendkey server.
 * <p>
 * A successful {@link #login} saves the user id and token pair through the
 * {@link SessionFileStore}. Calls that need a bearer token use the saved access token; if the
 * server rejects it, the refresh token is exchanged for a new access token once, the session is
 * re-saved and the call is retried. A second rejection propagates as a {@link SecurityException}.
 */
@Singleton
public class SendKeyClientManager {

  private static final Logger log = LoggerFactory.getLogger(SendKeyClientManager.class);

  private final SendKeyAccessor accessor;
  private final SessionFileStore sessionStore;

  @Inject
  public SendKeyClientManager(final SendKeyAccessor accessor, final SessionFileStore sessionStore) {
    this.accessor = accessor;
    this.sessionStore = sessionStore;
  }

  public CreateUserResponse createUser(String email, String password, String firstName, String lastName) {
    log.debug("createUser()");
    return accessor.createUser(new CreateUserRequest(email, password, firstName, lastName));
  }

  /**
   * Logs in and, on success, replaces the saved session.
   *
   * @param email    account email
   * @param password account password
   * @return the server's response
   */
  public LoginResponse login(String email, String password) {
    log.debug("login()");
    LoginResponse response = accessor.login(new LoginRequest(email, password));
    if (response.success()) {
      sessionStore.save(new Session(response.user().id(), response.accessToken().token(),
          response.refreshToken().token()));
    }
    return response;
  }

  public void logout() {
    sessionStore.clear();
  }

  public CreateEntryResponse createEntry(String name, String sendToEmail, String value, String secret,
                                         long durationMinutes) {
    log.debug("createEntry()");
    CreateEntryRequest request = new CreateEntryRequest(name, sendToEmail, value, secret, durationMinutes);
    return authenticated(session -> accessor.createEntry(session.accessToken(), request));
  }

  public List<EntryView> listEntries() {
    log.debug("listEntries()");
    return authenticated(session -> accessor.listEntries(session.accessToken(), session.userId()));
  }

  public Optional<EntryView> findEntry(UUID id, String nonceHex) {
    return accessor.findEntry(id, nonceHex);
  }

  public RevealEntryResponse revealEntry(UUID id, String nonceHex, String secret) {
    return accessor.revealEntry(id, new RevealEntryRequest(nonceHex, secret));
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private <T> T authenticated(Function<Session, T> call) {
    Session session = sessionStore.load()
        .orElseThrow(() -> new IllegalStateException("Not logged in"));
    try {
      return call.apply(session);
    } catch (SecurityException e) {
      log.debug("Access token rejected, refreshing");
      return call.apply(refresh(session));
    }
  }

  private Session refresh(Session session) {
    RefreshTokenResponse response = accessor.refresh(
        new RefreshTokenRequest(session.userId().toString(), session.refreshToken()));
    if (!response.success()) {
      throw new SecurityException("Session expired, log in again: " + String.join(" ", response.errors()));
    }
    Session refreshed = session.withAccessToken(response.accessToken().token());
    sessionStore.save(refreshed);
    return refreshed;
  }
}
