package com.codeheadsystems.sendkey.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sendkey.client.accessor.SendKeyAccessor;
import com.codeheadsystems.sendkey.client.manager.SendKeyClientManager;
import com.codeheadsystems.sendkey.client.model.ServerConnectionInfo;
import com.codeheadsystems.sendkey.client.session.SessionFileStore;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.CreateUserResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.LoginResponse;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import com.codeheadsystems.sendkey.server.store.EntryStore;
import com.codeheadsystems.sendkey.springboot.store.JdbcEntryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

/**
 * Runs the entry lifecycle against the Spring Boot controllers backed by the JDBC stores on H2.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class SendKeyIntegrationTest {

  private static final String PASSWORD = "correct-horse-battery-staple";

  @LocalServerPort
  private int port;

  @Autowired
  private RecordingEntryNotifier notifier;

  @Autowired
  private EntryStore entryStore;

  @TempDir
  Path dir;

  private HttpClient httpClient;
  private SendKeyClientManager manager;
  private String email;
  private UUID userId;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    ObjectMapper objectMapper = SendKeyAccessor.defaultObjectMapper();
    SendKeyAccessor accessor = new SendKeyAccessor(httpClient, objectMapper,
        new ServerConnectionInfo(URI.create(baseUrl())));
    manager = new SendKeyClientManager(accessor, new SessionFileStore(dir.resolve("session"), objectMapper));

    email = "carol-" + UUID.randomUUID() + "@example.com";
    assertThat(manager.createUser(email, PASSWORD, "Carol", "Jones").success()).isTrue();
    LoginResponse login = manager.login(email, PASSWORD);
    assertThat(login.success()).isTrue();
    userId = login.user().id();
  }

  private EntryView createEntry(String value, String secret) {
    CreateEntryResponse response = manager.createEntry("door code", "dave@example.com", value, secret, 10);
    assertThat(response.success()).as("errors: %s", response.errors()).isTrue();
    return response.entry();
  }

  @Test
  void usesJdbcStore() {
    assertThat(entryStore).isInstanceOf(JdbcEntryStore.class);
  }

  // ── Lifecycle ─────────────────────────────────────────────────────────────

  @Test
  void createFindRevealOnce() {
    EntryView entry = createEntry("4711", "red door");
    String nonce = notifier.nonceHex(entry.id());

    assertThat(entry.sentByUserId()).isEqualTo(userId);
    assertThat(manager.findEntry(entry.id(), nonce)).contains(entry);
    assertThat(manager.listEntries()).extracting(EntryView::id).containsExactly(entry.id());

    RevealEntryResponse revealed = manager.revealEntry(entry.id(), nonce, "red door");
    assertThat(revealed.success()).isTrue();
    assertThat(revealed.value()).isEqualTo("4711");

    assertThat(manager.revealEntry(entry.id(), nonce, "red door").errors()).containsExactly("Invalid entry ID.");
    assertThat(manager.findEntry(entry.id(), nonce)).isEmpty();
    assertThat(entryStore.findClaimed(entry.id())).isPresent();
    assertThat(manager.listEntries()).isEmpty();
  }

  @Test
  void wrongSecret_expiresAfterLimit() {
    EntryView entry = createEntry("4711", "red door");
    String nonce = notifier.nonceHex(entry.id());

    assertThat(manager.revealEntry(entry.id(), nonce, "blue door").expired()).isFalse();
    manager.revealEntry(entry.id(), nonce, "blue door");
    RevealEntryResponse third = manager.revealEntry(entry.id(), nonce, "blue door");

    assertThat(third.expired()).isTrue();
    assertThat(entryStore.findExpired(entry.id()))
        .hasValueSatisfying(expired -> assertThat(expired.tooManyAttempts()).isTrue());
    assertThat(manager.revealEntry(entry.id(), nonce, "red door").errors()).containsExactly("Invalid entry ID.");
  }

  @Test
  void createEntry_invalid_reportsErrors() {
    CreateEntryResponse response = manager.createEntry("door code", "", "4711", "", 5);

    assertThat(response.success()).isFalse();
    assertThat(response.errors()).contains("A send to email is required.", "A secret is required.");
  }

  @Test
  void createEntry_hugeDuration_reportsError() {
    CreateEntryResponse response = manager.createEntry("door code", "dave@example.com", "4711", "red door",
        Long.MAX_VALUE);

    assertThat(response.success()).isFalse();
    assertThat(response.errors()).containsExactly("Duration must be at most 525600 minutes.");
    assertThat(manager.listEntries()).isEmpty();
  }

  @Test
  void createUser_overlongEmail_reportsErrorInsteadOfStoreFailure() {
    CreateUserResponse response = manager.createUser("a".repeat(120) + "@example.com", PASSWORD, null, null);

    assertThat(response.success()).isFalse();
    assertThat(response.errors()).containsExactly("Email must be at most 100 characters.");
  }

  @Test
  void createUser_duplicateEmail_rejected() {
    CreateUserResponse second = manager.createUser(" " + email.toUpperCase() + " ", PASSWORD, null, null);

    assertThat(second.success()).isFalse();
    assertThat(second.errors()).containsExactly("An account with the specified email already exists.");
  }

  // ── Raw HTTP status codes ─────────────────────────────────────────────────

  @Test
  void createEntry_noToken_returns401() throws Exception {
    HttpResponse<String> response = post("/entries", "{\"name\":\"door code\"}");

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void findEntry_noNonce_returns400() throws Exception {
    HttpResponse<String> response = get("/entries/" + UUID.randomUUID(), null);

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("A nonce is required.");
  }

  @Test
  void findEntry_unknown_returns404() throws Exception {
    HttpResponse<String> response = get("/entries/" + UUID.randomUUID() + "?nonce=00112233445566778899aabb", null);

    assertThat(response.statusCode()).isEqualTo(404);
  }

  @Test
  void revealEntry_badId_returns400() throws Exception {
    HttpResponse<String> response = post("/entries/not-a-uuid/value",
        "{\"nonce\":\"00112233445566778899aabb\",\"secret\":\"x\"}");

    assertThat(response.statusCode()).isEqualTo(400);
    assertThat(response.body()).contains("Invalid entry ID.");
  }

  @Test
  void listEntries_otherUser_returns403() throws Exception {
    LoginResponse login = manager.login(email, PASSWORD);

    HttpResponse<String> response = get("/users/" + UUID.randomUUID() + "/entries",
        login.accessToken().token());

    assertThat(response.statusCode()).isEqualTo(403);
  }

  @Test
  void refresh_issuesNewAccessToken() throws Exception {
    LoginResponse login = manager.login(email, PASSWORD);

    HttpResponse<String> response = post("/token",
        "{\"userId\":\"" + userId + "\",\"refreshToken\":\"" + login.refreshToken().token() + "\"}");
    HttpResponse<String> bogus = post("/token", "{\"userId\":\"" + userId + "\",\"refreshToken\":\"abc\"}");

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("accessToken");
    assertThat(bogus.statusCode()).isEqualTo(401);
    assertThat(bogus.body()).contains("Invalid refresh token.");
  }

  @Test
  void login_unknownEmail_returns401() throws Exception {
    HttpResponse<String> response = post("/login",
        "{\"email\":\"nobody@example.com\",\"password\":\"" + PASSWORD + "\"}");

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.body()).contains("No user could be found with the specified email.");
  }

  @Test
  void health_reportsUp() throws Exception {
    HttpResponse<String> response = get("/actuator/health", null);

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("\"status\":\"UP\"").contains("sendKey");
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpResponse<String> post(String path, String json) throws Exception {
    return httpClient.send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(json))
        .build(), HttpResponse.BodyHandlers.ofString());
  }

  private HttpResponse<String> get(String path, String accessToken) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + path))
        .GET();
    if (accessToken != null) {
      builder.header("Authorization", "Bearer " + accessToken);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", port);
  }
}
