package com.questboard.auth.service;

/** 認可コードを検証済みの外部 ID に交換できなかったことを理由付きで表す。 */
public class IdentityExchangeException extends RuntimeException {

  public enum Reason {
    MISSING_CODE,
    CONSENT_DENIED,
    INVALID_CODE,
    PROVIDER_UNAVAILABLE,
    INVALID_RESPONSE
  }

  private final Reason reason;

  public IdentityExchangeException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public IdentityExchangeException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
