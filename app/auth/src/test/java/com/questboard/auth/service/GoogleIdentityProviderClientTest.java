package com.questboard.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.questboard.auth.config.GoogleProviderProperties;
import com.questboard.auth.model.ExternalIdentity;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class GoogleIdentityProviderClientTest {

  private static final String TOKEN_URL = "http://google.test/token";
  private static final String USERINFO_URL = "http://google.test/userinfo";

  @Test
  void providerNameIsGoogle() {
    assertThat(newFixture().client.provider()).isEqualTo("google");
  }

  @Test
  void authorizationUriCarriesClientAndCallback() {
    final URI uri = newFixture().client.authorizationUri();

    assertThat(uri.getHost()).isEqualTo("google.test");
    assertThat(uri.getPath()).isEqualTo("/auth");
    assertThat(uri.getRawQuery())
        .contains("client_id=client-1")
        .contains("redirect_uri=http://localhost:8080/auth/google/callback")
        .contains("response_type=code")
        .contains("scope=openid%20email%20profile");
  }

  @Test
  void exchangeRequestsTokenThenUserInfo() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andExpect(method(POST))
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_FORM_URLENCODED))
        .andExpect(
            content()
                .formDataContains(
                    Map.of(
                        "code", "code-1",
                        "client_id", "client-1",
                        "client_secret", "secret-1",
                        "grant_type", "authorization_code")))
        .andRespond(
            withSuccess(
                """
                {"access_token":"access-1","token_type":"Bearer","expires_in":3599}
                """,
                MediaType.APPLICATION_JSON));
    fixture
        .server
        .expect(requestTo(USERINFO_URL))
        .andExpect(method(GET))
        .andExpect(header("Authorization", "Bearer access-1"))
        .andRespond(
            withSuccess(
                """
                {"id":"1098765","email":"a@example.com","verified_email":true,
                 "name":"Alice","picture":"https://img.test/a.png"}
                """,
                MediaType.APPLICATION_JSON));

    final ExternalIdentity identity = fixture.client.exchange("code-1");

    assertThat(identity)
        .isEqualTo(
            new ExternalIdentity(
                "google", "1098765", "a@example.com", "Alice", "https://img.test/a.png"));
    fixture.server.verify();
  }

  @Test
  void exchangeToleratesMissingOptionalProfileFields() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(USERINFO_URL))
        .andRespond(withSuccess("{\"id\":\"42\"}", MediaType.APPLICATION_JSON));

    final ExternalIdentity identity = fixture.client.exchange("code-1");

    assertThat(identity.externalId()).isEqualTo("42");
    assertThat(identity.email()).isNull();
    assertThat(identity.avatarUrl()).isNull();
  }

  @Test
  void blankCodeFailsWithoutCallingProvider() {
    final ClientFixture fixture = newFixture();

    assertReason(fixture, " ", IdentityExchangeException.Reason.MISSING_CODE);
    assertReason(fixture, null, IdentityExchangeException.Reason.MISSING_CODE);
    fixture.server.verify();
  }

  @Test
  void rejectedCodeMapsToInvalidCode() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(
            withStatus(HttpStatus.BAD_REQUEST)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":\"invalid_grant\"}"));

    assertReason(fixture, "used-code", IdentityExchangeException.Reason.INVALID_CODE);
  }

  @Test
  void providerServerErrorMapsToUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture.server.expect(requestTo(TOKEN_URL)).andRespond(withServerError());

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.PROVIDER_UNAVAILABLE);
  }

  @Test
  void timeoutMapsToUnavailable() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.PROVIDER_UNAVAILABLE);
  }

  @Test
  void connectionFailureOnUserInfoMapsToUnavailable() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(USERINFO_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.PROVIDER_UNAVAILABLE);
  }

  @Test
  void missingAccessTokenMapsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(withSuccess("{\"token_type\":\"Bearer\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.INVALID_RESPONSE);
  }

  @Test
  void userInfoWithoutSubjectMapsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(USERINFO_URL))
        .andRespond(withSuccess("{\"email\":\"a@example.com\"}", MediaType.APPLICATION_JSON));

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.INVALID_RESPONSE);
  }

  @Test
  void unparsableBodyMapsToInvalidResponse() {
    final ClientFixture fixture = newFixture();
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(withSuccess("not-json", MediaType.APPLICATION_JSON));

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.INVALID_RESPONSE);
  }

  @Test
  void expiredAccessTokenOnUserInfoMapsToInvalidCode() {
    final ClientFixture fixture = newFixture();
    expectToken(fixture);
    fixture
        .server
        .expect(requestTo(USERINFO_URL))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertReason(fixture, "code-1", IdentityExchangeException.Reason.INVALID_CODE);
  }

  private void expectToken(ClientFixture fixture) {
    fixture
        .server
        .expect(requestTo(TOKEN_URL))
        .andRespond(withSuccess("{\"access_token\":\"access-1\"}", MediaType.APPLICATION_JSON));
  }

  private void assertReason(
      ClientFixture fixture, String code, IdentityExchangeException.Reason reason) {
    assertThatThrownBy(() -> fixture.client.exchange(code))
        .isInstanceOf(IdentityExchangeException.class)
        .extracting(ex -> ((IdentityExchangeException) ex).reason())
        .isEqualTo(reason);
  }

  private ClientFixture newFixture() {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final GoogleProviderProperties properties =
        new GoogleProviderProperties(
            "client-1",
            "secret-1",
            "http://localhost:8080/auth/google/callback",
            "http://google.test/auth",
            TOKEN_URL,
            USERINFO_URL,
            null,
            null,
            null);
    return new ClientFixture(
        new GoogleIdentityProviderClient(builder.build(), properties), server);
  }

  private record ClientFixture(GoogleIdentityProviderClient client, MockRestServiceServer server) {}
}
