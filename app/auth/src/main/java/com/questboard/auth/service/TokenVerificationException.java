package com.questboard.auth.service;

public class TokenVerificationException extends RuntimeException {

  public enum Reason {
    /** 形式不正、改ざん、別鍵での署名、必須クレームの欠落。 */
    INVALID,
    /** 署名は正しいが期限に達している。 */
    EXPIRED
  }

  private final Reason reason;

  public TokenVerificationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TokenVerificationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
