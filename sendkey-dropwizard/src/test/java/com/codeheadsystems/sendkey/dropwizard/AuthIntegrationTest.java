package com.codeheadsystems.sendkey.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.sendkey.client.accessor.SendKeyAccessor;
import com.codeheadsystems.sendkey.client.model.ServerConnectionInfo;
import com.codeheadsystems.sendkey.model.CreateUserRequest;
import com.codeheadsystems.sendkey.model.LoginRequest;
import com.codeheadsystems.sendkey.model.LoginResponse;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Integration tests for bearer authentication on consumer resources, running the bundle with its
 * zero-configuration defaults (in-memory stores, random keys, reaper enabled).
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class AuthIntegrationTest {

  static final DropwizardAppExtension<SendKeyConfiguration> APP =
      new DropwizardAppExtension<>(
          DefaultBundleApplication.class,
          ResourceHelpers.resourceFilePath("test-config-defaults.yml"));

  private HttpClient httpClient;
  private SendKeyAccessor accessor;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newHttpClient();
    accessor = new SendKeyAccessor(httpClient, SendKeyAccessor.defaultObjectMapper(),
        new ServerConnectionInfo(URI.create(baseUrl())));
  }

  @Test
  void loginAndCallProtectedEndpoint_returns200() throws Exception {
    accessor.createUser(new CreateUserRequest("whoami@example.com", "hunter2", null, null));
    LoginResponse login = accessor.login(new LoginRequest("whoami@example.com", "hunter2"));

    HttpResponse<String> response = whoAmI("Bearer " + login.accessToken().token());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains(login.user().id().toString());
  }

  @Test
  void callProtectedEndpoint_noToken_returns401() throws Exception {
    assertThat(whoAmI(null).statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_bogusToken_returns401() throws Exception {
    assertThat(whoAmI("Bearer not-a-real-token").statusCode()).isEqualTo(401);
  }

  @Test
  void callProtectedEndpoint_refreshTokenAsBearer_returns401() throws Exception {
    accessor.createUser(new CreateUserRequest("refresh-as-bearer@example.com", "hunter2", null, null));
    LoginResponse login = accessor.login(new LoginRequest("refresh-as-bearer@example.com", "hunter2"));

    assertThat(whoAmI("Bearer " + login.refreshToken().token()).statusCode()).isEqualTo(401);
  }

  private HttpResponse<String> whoAmI(String authorization) throws Exception {
    HttpRequest.Builder builder = HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .GET();
    if (authorization != null) {
      builder.header("Authorization", authorization);
    }
    return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}
