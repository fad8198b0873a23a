/*
 * どこで: Auth セキュリティ設定
 * 何を: セッション拒否の理由を保持する認証例外
 * なぜ: 拒否理由をログとメトリクスへ渡すため
 */
package com.questboard.auth.config;

import org.springframework.security.core.AuthenticationException;

/** {@link BearerTokenAuthenticationFilter} がセッションを拒否した理由を運ぶ例外。 */
public class SessionAuthenticationException extends AuthenticationException {

  public enum Reason {
    NO_CREDENTIAL,
    TOKEN_INVALID,
    TOKEN_EXPIRED
  }

  private final Reason reason;

  public SessionAuthenticationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SessionAuthenticationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
