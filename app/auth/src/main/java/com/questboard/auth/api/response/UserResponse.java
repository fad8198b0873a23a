/*
 * どこで: app/auth/src/main/java/com/questboard/auth/api/response/UserResponse.java
 * 何を: 公開してよいユーザー情報の応答 DTO
 * なぜ: 内部レコードの項目をそのまま外部へ出さないため
 */
package com.questboard.auth.api.response;

import com.questboard.auth.model.UserRecord;
import java.time.Instant;

public record UserResponse(
    long id, String email, String name, String avatarUrl, Instant createdAt) {

  public static UserResponse from(UserRecord user) {
    return new UserResponse(
        user.userId(), user.email(), user.name(), user.avatarUrl(), user.createdAt());
  }
}
