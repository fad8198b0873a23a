/*
 * どこで: app/auth/src/main/java/com/questboard/auth/api/response/AuthCallbackResponse.java
 * 何を: ログイン成功時のトークンとユーザー情報の応答 DTO
 * なぜ: フロントエンドが初回登録かどうかを判定できるようにするため
 */
package com.questboard.auth.api.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.questboard.auth.model.AuthenticationResult;
import java.time.Instant;

public record AuthCallbackResponse(
    String token,
    String tokenType,
    Instant expiresAt,
    @JsonProperty("isNewAccount") boolean newAccount,
    UserResponse user) {

  public static final String TOKEN_TYPE_BEARER = "Bearer";

  public static AuthCallbackResponse from(AuthenticationResult result) {
    return new AuthCallbackResponse(
        result.token().value(),
        TOKEN_TYPE_BEARER,
        result.token().expiresAt(),
        result.newAccount(),
        UserResponse.from(result.user()));
  }

  @Override
  public String toString() {
    return "AuthCallbackResponse[tokenType=" + tokenType + ", expiresAt=" + expiresAt
        + ", newAccount=" + newAccount + ", user=" + user + "]";
  }
}
