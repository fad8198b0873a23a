/*
 * どこで: Auth セキュリティ設定
 * 何を: 非公開ルートで Authorization: Bearer のセッショントークンを検証し、認証主体を設定する
 * なぜ: 検証できないリクエストをコントローラーへ到達させず、拒否理由付きで EntryPoint へ渡すため
 */
package com.questboard.auth.config;

import com.questboard.auth.model.SessionPrincipal;
import com.questboard.auth.model.VerifiedSession;
import com.questboard.auth.service.TokenService;
import com.questboard.auth.service.TokenVerificationException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger logger =
      LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
  private static final String BEARER_PREFIX = "Bearer ";
  private static final String USER_ROLE = "ROLE_USER";

  private final TokenService tokenService;
  private final AuthenticationEntryPoint authenticationEntryPoint;
  private final List<String> publicPaths;
  private final List<String> protectedPaths;
  private final AntPathMatcher pathMatcher = new AntPathMatcher();

  public BearerTokenAuthenticationFilter(
      TokenService tokenService,
      AuthenticationEntryPoint authenticationEntryPoint,
      List<String> publicPaths,
      List<String> protectedPaths) {
    this.tokenService = tokenService;
    this.authenticationEntryPoint = authenticationEntryPoint;
    this.publicPaths = List.copyOf(publicPaths);
    this.protectedPaths = List.copyOf(protectedPaths);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    final String path = pathWithinApplication(request);
    if (matchesAny(protectedPaths, path)) {
      return false;
    }
    return matchesAny(publicPaths, path);
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    final String token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
    if (token == null) {
      reject(
          request,
          response,
          new SessionAuthenticationException(
              SessionAuthenticationException.Reason.NO_CREDENTIAL, "bearer token is missing"));
      return;
    }

    final VerifiedSession session;
    try {
      session = tokenService.verify(token);
    } catch (TokenVerificationException ex) {
      final SessionAuthenticationException.Reason reason =
          ex.reason() == TokenVerificationException.Reason.EXPIRED
              ? SessionAuthenticationException.Reason.TOKEN_EXPIRED
              : SessionAuthenticationException.Reason.TOKEN_INVALID;
      reject(request, response, new SessionAuthenticationException(reason, ex.getMessage(), ex));
      return;
    }

    final UsernamePasswordAuthenticationToken authentication =
        UsernamePasswordAuthenticationToken.authenticated(
            new SessionPrincipal(session.userId(), session.expiresAt()),
            "N/A",
            List.of(new SimpleGrantedAuthority(USER_ROLE)));
    SecurityContextHolder.getContext().setAuthentication(authentication);
    logger.debug(
        "session authenticated userId={} path={}", session.userId(), request.getRequestURI());
    filterChain.doFilter(request, response);
  }

  private void reject(
      HttpServletRequest request,
      HttpServletResponse response,
      SessionAuthenticationException exception)
      throws IOException, ServletException {
    SecurityContextHolder.clearContext();
    authenticationEntryPoint.commence(request, response, exception);
  }

  // "Bearer" 以外のスキームや空トークンは資格情報なしとして扱う
  static String extractBearerToken(String header) {
    if (header == null
        || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    final String token = header.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }

  private boolean matchesAny(List<String> patterns, String path) {
    for (String pattern : patterns) {
      if (pathMatcher.match(pattern, path)) {
        return true;
      }
    }
    return false;
  }

  private String pathWithinApplication(HttpServletRequest request) {
    final String uri = request.getRequestURI();
    final String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
