package com.questboard.auth.service;

public class UserNotFoundException extends RuntimeException {

  public UserNotFoundException(long userId) {
    super("user not found: " + userId);
  }
}
