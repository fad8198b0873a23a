package com.questboard.auth.service;

public class UnknownIdentityProviderException extends RuntimeException {

  public UnknownIdentityProviderException(String provider) {
    super("identity provider is not supported: " + provider);
  }
}
