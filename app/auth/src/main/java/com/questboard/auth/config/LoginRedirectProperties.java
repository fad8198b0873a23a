/*
 * どこで: Auth アプリの設定バインド
 * 何を: コールバック失敗時にブラウザを戻すログイン画面の URL を保持する
 * なぜ: 失敗理由をクエリで渡す先をフロントエンドに合わせて切り替えられるようにするため
 */
package com.questboard.auth.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "auth.login")
@Validated
public record LoginRedirectProperties(@NotBlank String redirectUrl) {}
