/*
 * どこで: Auth アプリの設定バインド
 * 何を: セッショントークンの署名鍵/TTL/issuer を保持する
 * なぜ: 起動時に一度だけ構築し、TokenService へ値として渡すため
 */
package com.questboard.auth.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "auth.token")
@Validated
public record TokenProperties(
    @NotBlank String signingSecret, @NotNull Duration ttl, String issuer) {

  static final int MIN_SECRET_BYTES = 32;

  public TokenProperties {
    issuer = issuer == null || issuer.isBlank() ? "questboard" : issuer;
  }

  @AssertTrue(message = "auth.token.signing-secret must be at least 32 bytes")
  public boolean isSigningSecretLongEnough() {
    // HS256 は 256bit 未満の鍵を受け付けない。
    return signingSecret == null
        || signingSecret.getBytes(StandardCharsets.UTF_8).length >= MIN_SECRET_BYTES;
  }

  @AssertTrue(message = "auth.token.ttl must be positive")
  public boolean isTtlPositive() {
    return ttl == null || (!ttl.isZero() && !ttl.isNegative());
  }

  @AssertTrue(message = "auth.token.ttl must be a whole number of seconds")
  public boolean isTtlWholeSeconds() {
    // exp は秒精度で署名されるため、端数があると発行時に返す expiresAt とずれる
    return ttl == null || ttl.getNano() == 0;
  }

  @Override
  public String toString() {
    return "TokenProperties[signingSecret=****, ttl=" + ttl + ", issuer=" + issuer + "]";
  }
}
