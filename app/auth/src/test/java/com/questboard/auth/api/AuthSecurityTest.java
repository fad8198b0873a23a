/*
 * どこで: Auth API のセキュリティテスト
 * 何を: Bearer 検証、統一 401 応答、CORS、未定義ルートの拒否を検証する
 * なぜ: 公開ルート以外が必ず閉じていることを保証するため
 */
package com.questboard.auth.api;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.questboard.auth.config.AuthSecurityConfig;
import com.questboard.auth.config.CorsConfig;
import com.questboard.auth.config.CorsProperties;
import com.questboard.auth.config.LoginRedirectProperties;
import com.questboard.auth.model.UserRecord;
import com.questboard.auth.model.VerifiedSession;
import com.questboard.auth.service.AuthMetrics;
import com.questboard.auth.service.AuthenticationService;
import com.questboard.auth.service.IdentityProviderRegistry;
import com.questboard.auth.service.TokenService;
import com.questboard.auth.service.TokenVerificationException;
import com.questboard.auth.service.UserProfileService;
import com.questboard.auth.support.StubIdentityProviderClient;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@WebMvcTest(AuthController.class)
@Import({
  AuthSecurityConfig.class,
  CorsConfig.class,
  AuthApiExceptionHandler.class,
  AuthSecurityTest.PropertiesConfig.class
})
class AuthSecurityTest {

  private static final String UNAUTHORIZED_BODY =
      "{\"code\":\"UNAUTHORIZED\",\"message\":\"unauthorized\"}";
  private static final String FRONTEND_ORIGIN = "http://app.test";
  private static final Instant EXPIRES_AT = Instant.parse("2026-09-01T00:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private TokenService tokenService;
  @MockitoBean private AuthMetrics authMetrics;
  @MockitoBean private IdentityProviderRegistry identityProviderRegistry;
  @MockitoBean private AuthenticationService authenticationService;
  @MockitoBean private UserProfileService userProfileService;

  @Test
  void meWithoutHeaderIsRejected() throws Exception {
    assertUnauthorized(mockMvc.perform(get("/auth/me")));
    verify(authMetrics).recordSessionRejected("NO_CREDENTIAL");
    verify(userProfileService, never()).getUser(anyLong());
  }

  @Test
  void meWithMalformedHeaderIsRejected() throws Exception {
    assertUnauthorized(mockMvc.perform(get("/auth/me").header("Authorization", "Token abc")));
    verify(authMetrics).recordSessionRejected("NO_CREDENTIAL");
  }

  @Test
  void meWithInvalidTokenIsRejected() throws Exception {
    when(tokenService.verify("tampered"))
        .thenThrow(
            new TokenVerificationException(TokenVerificationException.Reason.INVALID, "bad mac"));

    assertUnauthorized(
        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer tampered")));
    verify(authMetrics).recordSessionRejected("TOKEN_INVALID");
  }

  @Test
  void meWithExpiredTokenIsRejectedWithSameBody() throws Exception {
    when(tokenService.verify("expired"))
        .thenThrow(
            new TokenVerificationException(TokenVerificationException.Reason.EXPIRED, "expired"));

    assertUnauthorized(
        mockMvc.perform(get("/auth/me").header("Authorization", "Bearer expired")));
    verify(authMetrics).recordSessionRejected("TOKEN_EXPIRED");
  }

  @Test
  void meWithValidTokenReachesHandler() throws Exception {
    final Instant createdAt = Instant.parse("2026-01-01T00:00:00Z");
    when(tokenService.verify("valid"))
        .thenReturn(new VerifiedSession(8L, EXPIRES_AT.minusSeconds(3600), EXPIRES_AT));
    when(userProfileService.getUser(8L))
        .thenReturn(new UserRecord(8L, "h@example.com", "Hana", null, createdAt, createdAt));

    mockMvc
        .perform(get("/auth/me").header("Authorization", "Bearer valid"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(8))
        .andExpect(jsonPath("$.name").value("Hana"));
  }

  @Test
  void preflightFromFrontendIsAllowedWithCredentials() throws Exception {
    mockMvc
        .perform(
            options("/auth/me")
                .header("Origin", FRONTEND_ORIGIN)
                .header("Access-Control-Request-Method", "GET")
                .header("Access-Control-Request-Headers", "Authorization"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", FRONTEND_ORIGIN))
        .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
    verify(authMetrics, never()).recordSessionRejected(anyString());
  }

  @Test
  void preflightFromOtherOriginIsRefused() throws Exception {
    mockMvc
        .perform(
            options("/auth/me")
                .header("Origin", "http://evil.test")
                .header("Access-Control-Request-Method", "GET"))
        .andExpect(status().isForbidden())
        .andExpect(header().doesNotExist("Access-Control-Allow-Origin"));
  }

  @Test
  void authenticatedCrossOriginResponseCarriesCorsHeaders() throws Exception {
    final Instant createdAt = Instant.parse("2026-01-01T00:00:00Z");
    when(tokenService.verify("valid"))
        .thenReturn(new VerifiedSession(9L, EXPIRES_AT.minusSeconds(3600), EXPIRES_AT));
    when(userProfileService.getUser(9L))
        .thenReturn(new UserRecord(9L, null, "Iori", null, createdAt, createdAt));

    mockMvc
        .perform(
            get("/auth/me")
                .header("Origin", FRONTEND_ORIGIN)
                .header("Authorization", "Bearer valid"))
        .andExpect(status().isOk())
        .andExpect(header().string("Access-Control-Allow-Origin", FRONTEND_ORIGIN));
  }

  @Test
  void loginRouteIsPublic() throws Exception {
    when(identityProviderRegistry.get("google"))
        .thenReturn(new StubIdentityProviderClient("google"));

    mockMvc.perform(get("/auth/google")).andExpect(status().isFound());
  }

  @Test
  void unknownRoutesFailClosed() throws Exception {
    assertUnauthorized(mockMvc.perform(get("/admin/users")));
    assertUnauthorized(mockMvc.perform(post("/auth/google")));
  }

  private void assertUnauthorized(ResultActions result) throws Exception {
    result
        .andExpect(status().isUnauthorized())
        .andExpect(header().string("WWW-Authenticate", "Bearer"))
        .andExpect(content().json(UNAUTHORIZED_BODY, true));
  }

  @TestConfiguration
  static class PropertiesConfig {

    @Bean
    LoginRedirectProperties loginRedirectProperties() {
      return new LoginRedirectProperties("http://app.test/login");
    }

    @Bean
    CorsProperties corsProperties() {
      return new CorsProperties(FRONTEND_ORIGIN);
    }
  }
}
