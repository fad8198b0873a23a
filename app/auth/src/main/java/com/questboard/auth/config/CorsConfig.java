/*
 * どこで: Auth セキュリティ設定
 * 何を: フロントエンドのオリジンに対する CORS 設定を提供する
 * なぜ: ブラウザの SPA が Bearer ヘッダー付きで /auth/me を呼べるようにするため
 */
package com.questboard.auth.config;

import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

@Configuration
public class CorsConfig {

  static final long PREFLIGHT_MAX_AGE_SECONDS = 3600L;

  /**
   * 役割: フロントエンドからの API 呼び出しに CORS を適用する。
   * 動作: 設定済みオリジン 1 つだけを資格情報付きで許可し、Authorization ヘッダーを受け付ける。
   * 前提: SecurityFilterChain の cors 設定から参照される。
   */
  @Bean
  CorsConfigurationSource corsConfigurationSource(CorsProperties properties) {
    final CorsConfiguration config = new CorsConfiguration();
    config.setAllowedOrigins(List.of(properties.allowedOrigin()));
    config.setAllowedMethods(List.of("GET", "POST", "OPTIONS"));
    config.setAllowedHeaders(List.of("Authorization", "Content-Type"));
    config.setAllowCredentials(true);
    // プリフライト結果のキャッシュ時間
    config.setMaxAge(PREFLIGHT_MAX_AGE_SECONDS);

    final UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
    source.registerCorsConfiguration("/**", config);
    return source;
  }
}
