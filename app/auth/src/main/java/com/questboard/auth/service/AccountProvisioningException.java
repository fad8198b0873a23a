package com.questboard.auth.service;

/** 一意制約の競合以外の理由で初回アカウント作成に失敗したことを表す。 */
public class AccountProvisioningException extends RuntimeException {

  public AccountProvisioningException(String message) {
    super(message);
  }

  public AccountProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
