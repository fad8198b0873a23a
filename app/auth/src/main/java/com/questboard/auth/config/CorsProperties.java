/*
 * どこで: Auth アプリの設定バインド
 * 何を: ブラウザ SPA のオリジンを保持する
 * なぜ: 資格情報付き CORS を許可するオリジンを 1 つに固定し、未設定なら起動を止めるため
 */
package com.questboard.auth.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "auth.cors")
@Validated
public record CorsProperties(@NotBlank String allowedOrigin) {}
