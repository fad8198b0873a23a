/*
 * どこで: Auth 外部連携設定
 * 何を: Google OAuth 呼び出し用 RestClient を構築する
 * なぜ: タイムアウトをこのクライアントだけに閉じ込めるため
 */
package com.questboard.auth.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class IdentityProviderClientConfig {

  @Bean
  RestClient googleRestClient(RestClient.Builder builder, GoogleProviderProperties properties) {
    // Google OAuth 呼び出し専用 RestClient。リトライはしない。
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
