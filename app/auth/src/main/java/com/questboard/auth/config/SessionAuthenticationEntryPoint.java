/*
 * どこで: Auth セキュリティ設定
 * 何を: セッション拒否時の 401 応答を書き出す
 * なぜ: 拒否理由をクライアントへ見せず、ログと auth.session.rejected.total にだけ残すため
 */
package com.questboard.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questboard.auth.api.ApiErrorResponse;
import com.questboard.auth.service.AuthMetrics;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

public class SessionAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger logger =
      LoggerFactory.getLogger(SessionAuthenticationEntryPoint.class);
  static final ApiErrorResponse UNAUTHORIZED_BODY =
      new ApiErrorResponse("UNAUTHORIZED", "unauthorized");

  private final ObjectMapper objectMapper;
  private final AuthMetrics authMetrics;

  public SessionAuthenticationEntryPoint(ObjectMapper objectMapper, AuthMetrics authMetrics) {
    this.objectMapper = objectMapper;
    this.authMetrics = authMetrics;
  }

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException)
      throws IOException {
    final SessionAuthenticationException.Reason reason = reasonOf(authException);
    logger.info(
        "session rejected reason={} method={} path={} detail={}",
        reason,
        request.getMethod(),
        request.getRequestURI(),
        authException.getMessage());
    authMetrics.recordSessionRejected(reason.name());

    response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
    response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    response.setCharacterEncoding(StandardCharsets.UTF_8.name());
    objectMapper.writeValue(response.getOutputStream(), UNAUTHORIZED_BODY);
  }

  private SessionAuthenticationException.Reason reasonOf(AuthenticationException exception) {
    if (exception instanceof SessionAuthenticationException sessionException) {
      return sessionException.reason();
    }
    // 認可層からの拒否 (Authentication なし) は資格情報なしと同じ扱い
    return SessionAuthenticationException.Reason.NO_CREDENTIAL;
  }
}
