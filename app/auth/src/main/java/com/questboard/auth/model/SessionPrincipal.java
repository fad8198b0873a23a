/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/SessionPrincipal.java
 * 何を: 検証済みセッショントークンから得た認証主体
 * なぜ: ハンドラーが @AuthenticationPrincipal で userId を受け取れるようにするため
 */
package com.questboard.auth.model;

import java.time.Instant;
import org.springframework.security.core.AuthenticatedPrincipal;

public record SessionPrincipal(long userId, Instant expiresAt) implements AuthenticatedPrincipal {

  @Override
  public String getName() {
    return Long.toString(userId);
  }
}
