/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/IssuedToken.java
 * 何を: 発行済みセッショントークンと有効期間
 * なぜ: 発行時の値と期限を呼び出し側へそのまま返すため
 */
package com.questboard.auth.model;

import java.time.Instant;

public record IssuedToken(String value, long userId, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedToken[userId=" + userId + ", issuedAt=" + issuedAt + ", expiresAt=" + expiresAt
        + "]";
  }
}
