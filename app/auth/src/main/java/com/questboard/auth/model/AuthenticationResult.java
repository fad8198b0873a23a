/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/AuthenticationResult.java
 * 何を: ログイン 1 回分の結果 (トークン/新規作成か/ユーザー)
 * なぜ: コントローラーが応答を組み立てるのに必要な値をまとめるため
 */
package com.questboard.auth.model;

public record AuthenticationResult(IssuedToken token, boolean newAccount, UserRecord user) {

  public long userId() {
    return user.userId();
  }
}
