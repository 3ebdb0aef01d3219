package com.codeheadsystems.sendkey.client.accessor;

import com.codeheadsystems.sendkey.client.exceptions.SendKeyAccessorException;
import com.codeheadsystems.sendkey.client.model.ServerConnectionInfo;
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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the sendkey REST endpoints.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking, and response
 * deserialization. The {@code endpoint} in {@link ServerConnectionInfo} is the base URL of the
 * server; path segments are appended per endpoint. This class holds no session state: callers
 * pass the access token for authenticated routes.
 * <p>
 * Routes that answer validation failures with a structured body (create user, login, refresh,
 * create entry, reveal) return that body instead of throwing. Otherwise a 401 is surfaced as a
 * {@link SecurityException}, and other error statuses, I/O errors and interruptions as
 * {@link SendKeyAccessorException}.
 */
@Singleton
public class SendKeyAccessor {

  private static final Logger log = LoggerFactory.getLogger(SendKeyAccessor.class);
  private static final TypeReference<List<EntryView>> ENTRY_LIST = new TypeReference<>() {
  };

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final ServerConnectionInfo connectionInfo;

  /**
   * Instantiates a new sendkey accessor.
   *
   * @param httpClient     the http client
   * @param objectMapper   the object mapper, able to read {@code java.time} types
   * @param connectionInfo the server to talk to
   */
  @Inject
  public SendKeyAccessor(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final ServerConnectionInfo connectionInfo) {
    log.info("SendKeyAccessor({})", connectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  /**
   * An object mapper configured for the sendkey wire format.
   *
   * @return a new mapper
   */
  public static ObjectMapper defaultObjectMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  // ── Users ─────────────────────────────────────────────────────────────────

  public CreateUserResponse createUser(final CreateUserRequest request) {
    log.debug("createUser()");
    return post(uri("/users"), request, null, CreateUserResponse.class, Set.of(400));
  }

  /**
   * Exchanges credentials for a token pair. Rejected credentials come back as an unsuccessful
   * response rather than an exception.
   *
   * @param request the credentials
   * @return the login response
   */
  public LoginResponse login(final LoginRequest request) {
    log.debug("login()");
    return post(uri("/login"), request, null, LoginResponse.class, Set.of(400, 401));
  }

  /**
   * Exchanges a refresh token for a new access token.
   *
   * @param request the user id and refresh token
   * @return the refresh response; unsuccessful if the refresh token was refused
   */
  public RefreshTokenResponse refresh(final RefreshTokenRequest request) {
    log.debug("refresh()");
    return post(uri("/token"), request, null, RefreshTokenResponse.class, Set.of(400, 401));
  }

  // ── Entries ───────────────────────────────────────────────────────────────

  /**
   * Creates an entry sent by the owner of the access token.
   *
   * @param accessToken the bearer token
   * @param request     the entry to create
   * @return the created entry, or the validation errors
   * @throws SecurityException if the access token is rejected
   */
  public CreateEntryResponse createEntry(final String accessToken, final CreateEntryRequest request) {
    log.debug("createEntry()");
    return post(uri("/entries"), request, accessToken, CreateEntryResponse.class, Set.of(400));
  }

  /**
   * Looks up an entry by id and nonce.
   *
   * @param id       the entry id
   * @param nonceHex the nonce the recipient was sent
   * @return the entry, or empty if it is unknown, expired, or the nonce does not match
   */
  public Optional<EntryView> findEntry(final UUID id, final String nonceHex) {
    log.debug("findEntry(id={})", id);
    URI uri = uri("/entries/" + id + "?nonce=" + URLEncoder.encode(nonceHex, StandardCharsets.UTF_8));
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(uri)
        .header("Accept", "application/json")
        .GET(), Set.of(404));
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    return Optional.of(read(response.body(), EntryView.class));
  }

  /**
   * Attempts to reveal an entry's value. At most one call ever succeeds per entry.
   *
   * @param id      the entry id
   * @param request nonce and secret phrase
   * @return the value, or the errors and whether the entry is now expired
   */
  public RevealEntryResponse revealEntry(final UUID id, final RevealEntryRequest request) {
    log.debug("revealEntry(id={})", id);
    return post(uri("/entries/" + id + "/value"), request, null, RevealEntryResponse.class, Set.of(400));
  }

  /**
   * Lists the active entries sent by a user, oldest first.
   *
   * @param accessToken the bearer token, which must belong to {@code userId}
   * @param userId      the sender
   * @return the entries
   * @throws SecurityException if the access token is rejected
   */
  public List<EntryView> listEntries(final String accessToken, final UUID userId) {
    log.debug("listEntries(userId={})", userId);
    HttpResponse<String> response = send(authorize(HttpRequest.newBuilder()
        .uri(uri("/users/" + userId + "/entries"))
        .header("Accept", "application/json")
        .GET(), accessToken), Set.of());
    return read(response.body(), ENTRY_LIST);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private URI uri(String path) {
    URI base = connectionInfo.endpoint();
    String basePath = base.getPath() == null ? "" : base.getPath();
    if (basePath.endsWith("/")) {
      basePath = basePath.substring(0, basePath.length() - 1);
    }
    return base.resolve(basePath + path);
  }

  private <T> T post(URI uri, Object body, String accessToken, Class<T> responseType,
                     Set<Integer> bodyStatuses) {
    String requestBody;
    try {
      requestBody = objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new SendKeyAccessorException("Could not serialize request for " + uri.getPath(), e);
    }
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(uri)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody));
    HttpResponse<String> response = send(authorize(builder, accessToken), bodyStatuses);
    return read(response.body(), responseType);
  }

  private static HttpRequest.Builder authorize(HttpRequest.Builder builder, String accessToken) {
    if (accessToken != null) {
      builder.header("Authorization", "Bearer " + accessToken);
    }
    return builder;
  }

  private HttpResponse<String> send(HttpRequest.Builder builder, Set<Integer> bodyStatuses) {
    HttpRequest request = builder.build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      if (!bodyStatuses.contains(response.statusCode())) {
        checkStatus(request.uri(), response.statusCode());
      }
      return response;
    } catch (IOException e) {
      throw new SendKeyAccessorException("HTTP request failed: " + request.uri().getPath(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SendKeyAccessorException("HTTP request interrupted: " + request.uri().getPath(), e);
    }
  }

  private <T> T read(String body, Class<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new SendKeyAccessorException("Could not parse " + type.getSimpleName(), e);
    }
  }

  private <T> T read(String body, TypeReference<T> type) {
    try {
      return objectMapper.readValue(body, type);
    } catch (IOException e) {
      throw new SendKeyAccessorException("Could not parse response", e);
    }
  }

  private void checkStatus(URI uri, int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401): " + uri.getPath());
    }
    if (statusCode >= 400) {
      throw new SendKeyAccessorException("Server returned HTTP " + statusCode + ": " + uri.getPath(), statusCode);
    }
  }
}
