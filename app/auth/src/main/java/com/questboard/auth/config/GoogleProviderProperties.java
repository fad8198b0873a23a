/*
 * どこで: Auth アプリの設定バインド
 * 何を: Google OAuth クライアントの資格情報とエンドポイントを保持する
 * なぜ: 必須値の欠落を起動時に検出するため
 */
package com.questboard.auth.config;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "auth.providers.google")
@Validated
public record GoogleProviderProperties(
    @NotBlank String clientId,
    @NotBlank String clientSecret,
    @NotBlank String callbackUrl,
    String authorizationEndpoint,
    String tokenEndpoint,
    String userInfoEndpoint,
    String scope,
    Duration connectTimeout,
    Duration readTimeout) {

  public GoogleProviderProperties {
    authorizationEndpoint =
        isBlank(authorizationEndpoint)
            ? "https://accounts.google.com/o/oauth2/v2/auth"
            : authorizationEndpoint;
    tokenEndpoint = isBlank(tokenEndpoint) ? "https://oauth2.googleapis.com/token" : tokenEndpoint;
    userInfoEndpoint =
        isBlank(userInfoEndpoint)
            ? "https://www.googleapis.com/oauth2/v2/userinfo"
            : userInfoEndpoint;
    scope = isBlank(scope) ? "openid email profile" : scope;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  @Override
  public String toString() {
    return "GoogleProviderProperties[clientId="
        + clientId
        + ", clientSecret=****, callbackUrl="
        + callbackUrl
        + "]";
  }
}
