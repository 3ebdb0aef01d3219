package com.codeheadsystems.sendkey.client.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.sendkey.client.exceptions.SendKeyAccessorException;
import com.codeheadsystems.sendkey.client.model.ServerConnectionInfo;
import com.codeheadsystems.sendkey.model.CreateEntryRequest;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.LoginRequest;
import com.codeheadsystems.sendkey.model.LoginResponse;
import com.codeheadsystems.sendkey.model.RevealEntryRequest;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SendKeyAccessorTest {

  private static final URI BASE_URI = URI.create("http://localhost:8080/api");
  private static final UUID ENTRY_ID = UUID.fromString("4f3c2a10-8f5e-4d61-9d3a-5b2f1c0e7a11");

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;
  @Mock private ObjectMapper objectMapper;

  private SendKeyAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = new SendKeyAccessor(httpClient, objectMapper, new ServerConnectionInfo(BASE_URI));
  }

  private HttpRequest sentRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any());
    return captor.getValue();
  }

  // ── Create entry ──────────────────────────────────────────────────────────

  @Test
  void createEntry_success_sendsBearerTokenAndReturnsResponse() throws Exception {
    CreateEntryResponse expected = CreateEntryResponse.created(new EntryView(ENTRY_ID, "wifi",
        UUID.randomUUID(), "bob@example.com", Instant.EPOCH, Instant.EPOCH.plusSeconds(60)));
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(201);
    when(httpResponse.body()).thenReturn("body");
    when(objectMapper.readValue(eq("body"), eq(CreateEntryResponse.class))).thenReturn(expected);

    CreateEntryResponse result = accessor.createEntry("access-token",
        new CreateEntryRequest("wifi", "bob@example.com", "hunter2", "phrase", 10));

    assertThat(result).isEqualTo(expected);
    HttpRequest request = sentRequest();
    assertThat(request.uri()).isEqualTo(URI.create("http://localhost:8080/api/entries"));
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.headers().firstValue("Authorization")).contains("Bearer access-token");
  }

  @Test
  void createEntry_validationFailure_returnsErrorBody() throws Exception {
    CreateEntryResponse expected = CreateEntryResponse.failed(List.of("A name is required."));
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(400);
    when(httpResponse.body()).thenReturn("errors");
    when(objectMapper.readValue(eq("errors"), eq(CreateEntryResponse.class))).thenReturn(expected);

    CreateEntryResponse result = accessor.createEntry("access-token",
        new CreateEntryRequest("", "bob@example.com", "hunter2", "phrase", 10));

    assertThat(result.success()).isFalse();
    assertThat(result.errors()).containsExactly("A name is required.");
  }

  @Test
  void createEntry_401_throwsSecurityException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);

    assertThatThrownBy(() -> accessor.createEntry("stale",
        new CreateEntryRequest("wifi", "bob@example.com", "hunter2", "phrase", 10)))
        .isInstanceOf(SecurityException.class)
        .hasMessageContaining("401");
  }

  // ── Login ─────────────────────────────────────────────────────────────────

  @Test
  void login_401_returnsFailedResponse() throws Exception {
    LoginResponse expected = LoginResponse.failed(List.of("The specified password is invalid."));
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(401);
    when(httpResponse.body()).thenReturn("failed");
    when(objectMapper.readValue(eq("failed"), eq(LoginResponse.class))).thenReturn(expected);

    LoginResponse result = accessor.login(new LoginRequest("alice@example.com", "wrong"));

    assertThat(result.success()).isFalse();
    assertThat(sentRequest().headers().firstValue("Authorization")).isEmpty();
  }

  // ── Find entry ────────────────────────────────────────────────────────────

  @Test
  void findEntry_404_returnsEmpty() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(404);

    assertThat(accessor.findEntry(ENTRY_ID, "abcd")).isEmpty();
    assertThat(sentRequest().uri())
        .isEqualTo(URI.create("http://localhost:8080/api/entries/" + ENTRY_ID + "?nonce=abcd"));
  }

  @Test
  void findEntry_500_throwsAccessorExceptionWithStatus() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(500);

    assertThatThrownBy(() -> accessor.findEntry(ENTRY_ID, "abcd"))
        .isInstanceOf(SendKeyAccessorException.class)
        .satisfies(e -> assertThat(((SendKeyAccessorException) e).statusCode()).isEqualTo(500));
  }

  // ── Reveal ────────────────────────────────────────────────────────────────

  @Test
  void revealEntry_wrongSecret_returnsErrorBody() throws Exception {
    RevealEntryResponse expected = RevealEntryResponse.failed(List.of("Invalid secret."), false);
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(400);
    when(httpResponse.body()).thenReturn("failed");
    when(objectMapper.readValue(eq("failed"), eq(RevealEntryResponse.class))).thenReturn(expected);

    RevealEntryResponse result = accessor.revealEntry(ENTRY_ID, new RevealEntryRequest("abcd", "nope"));

    assertThat(result.expired()).isFalse();
    assertThat(sentRequest().uri().getPath()).isEqualTo("/api/entries/" + ENTRY_ID + "/value");
  }

  // ── List ──────────────────────────────────────────────────────────────────

  @Test
  void listEntries_403_throwsAccessorException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(403);

    assertThatThrownBy(() -> accessor.listEntries("token", UUID.randomUUID()))
        .isInstanceOf(SendKeyAccessorException.class)
        .hasMessageContaining("403");
  }

  @Test
  @SuppressWarnings("unchecked")
  void listEntries_success_readsList() throws Exception {
    List<EntryView> expected = List.of(new EntryView(ENTRY_ID, "wifi", UUID.randomUUID(),
        "bob@example.com", Instant.EPOCH, Instant.EPOCH.plusSeconds(60)));
    doReturn(httpResponse).when(httpClient).send(any(), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("[]");
    when(objectMapper.readValue(eq("[]"), any(TypeReference.class))).thenReturn(expected);

    assertThat(accessor.listEntries("token", UUID.randomUUID())).isEqualTo(expected);
  }

  // ── Transport failures ────────────────────────────────────────────────────

  @Test
  void createUser_ioException_throwsAccessorException() throws Exception {
    when(objectMapper.writeValueAsString(any())).thenReturn("{}");
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> accessor.createUser(null))
        .isInstanceOf(SendKeyAccessorException.class)
        .hasMessageContaining("/api/users")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void findEntry_interrupted_throwsAccessorExceptionAndRestoresInterruptFlag() throws Exception {
    doThrow(new InterruptedException("interrupted")).when(httpClient).send(any(), any());

    try {
      assertThatThrownBy(() -> accessor.findEntry(ENTRY_ID, "abcd"))
          .isInstanceOf(SendKeyAccessorException.class)
          .hasCauseInstanceOf(InterruptedException.class);

      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }
}
