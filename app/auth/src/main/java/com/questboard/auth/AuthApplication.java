/*
 * どこで: Auth アプリ起動クラス
 * 何を: Spring Boot の起動と疎通確認用の / を提供する
 * なぜ: auth サービス単体で起動・ヘルスチェックできるようにするため
 */
package com.questboard.auth;

import com.questboard.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@Import(TimeConfig.class)
@RestController
public class AuthApplication {

  public static void main(String[] args) {
    SpringApplication.run(AuthApplication.class, args);
  }

  @GetMapping("/")
  public String home() {
    return "auth: ok";
  }
}
