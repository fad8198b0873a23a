/*
 * どこで: Auth セキュリティ設定
 * 何を: 公開/保護ルートとステートレスな SecurityFilterChain を定義する
 * なぜ: 未定義ルートを含め、公開ルート以外を認証必須で閉じるため
 */
package com.questboard.auth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questboard.auth.service.AuthMetrics;
import com.questboard.auth.service.TokenService;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;
import org.springframework.web.cors.CorsConfigurationSource;

@Configuration
public class AuthSecurityConfig {

  static final List<String> PROTECTED_PATHS = List.of("/auth/me");

  static final List<String> PUBLIC_PATHS =
      List.of(
          "/",
          "/error",
          "/auth/{provider}",
          "/auth/{provider}/callback",
          "/actuator/health",
          "/actuator/health/**",
          "/actuator/info",
          "/actuator/prometheus");

  @Bean
  SessionAuthenticationEntryPoint sessionAuthenticationEntryPoint(
      ObjectMapper objectMapper, AuthMetrics authMetrics) {
    return new SessionAuthenticationEntryPoint(objectMapper, authMetrics);
  }

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(
      TokenService tokenService, SessionAuthenticationEntryPoint sessionAuthenticationEntryPoint) {
    return new BearerTokenAuthenticationFilter(
        tokenService, sessionAuthenticationEntryPoint, PUBLIC_PATHS, PROTECTED_PATHS);
  }

  // SecurityFilterChain 内でのみ実行する
  @Bean
  FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration(
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter) {
    final FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
        new FilterRegistrationBean<>(bearerTokenAuthenticationFilter);
    registration.setEnabled(false);
    return registration;
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      SessionAuthenticationEntryPoint sessionAuthenticationEntryPoint,
      CorsConfigurationSource corsConfigurationSource)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .cors(cors -> cors.configurationSource(corsConfigurationSource))
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(ex -> ex.authenticationEntryPoint(sessionAuthenticationEntryPoint))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(PROTECTED_PATHS.toArray(String[]::new))
                    .authenticated()
                    .requestMatchers(HttpMethod.GET, PUBLIC_PATHS.toArray(String[]::new))
                    .permitAll()
                    .requestMatchers("/error")
                    .permitAll()
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
