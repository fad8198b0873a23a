/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: トークン発行や行のタイムスタンプで同一の時刻源を使うため
 */
package com.questboard.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
