/*
 * どこで: Auth アプリの設定バインド
 * 何を: auth.* の設定レコードを有効化する
 * なぜ: 必須設定の欠落を起動時の検証で止めるため
 */
package com.questboard.auth.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
  TokenProperties.class,
  GoogleProviderProperties.class,
  LoginRedirectProperties.class,
  BootstrapProperties.class,
  CorsProperties.class
})
public class AuthPropertiesConfig {}
