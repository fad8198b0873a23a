/*
 * どこで: app/auth/src/main/java/com/questboard/auth/api/AuthApiExceptionHandler.java
 * 何を: Auth API の例外を標準エラー形式またはログイン画面へのリダイレクトへ変換する
 * なぜ: 失敗時の契約を一定に保ち、プロバイダー側の詳細をクライアントへ漏らさないため
 */
package com.questboard.auth.api;

import com.questboard.auth.config.LoginRedirectProperties;
import com.questboard.auth.service.AccountProvisioningException;
import com.questboard.auth.service.IdentityExchangeException;
import com.questboard.auth.service.UnknownIdentityProviderException;
import com.questboard.auth.service.UserNotFoundException;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.util.UriComponentsBuilder;

@RestControllerAdvice
@RequiredArgsConstructor
public class AuthApiExceptionHandler {

  static final String ERROR_AUTHENTICATION_FAILED = "authentication_failed";
  static final String ERROR_SERVER_ERROR = "server_error";

  private static final Logger logger = LoggerFactory.getLogger(AuthApiExceptionHandler.class);

  private final LoginRedirectProperties loginRedirectProperties;

  @ExceptionHandler(IdentityExchangeException.class)
  public ResponseEntity<Void> handleIdentityExchange(IdentityExchangeException ex) {
    logger.warn("identity exchange failed reason={} message={}", ex.reason(), ex.getMessage());
    return redirectToLogin(ERROR_AUTHENTICATION_FAILED);
  }

  @ExceptionHandler(AccountProvisioningException.class)
  public ResponseEntity<Void> handleAccountProvisioning(AccountProvisioningException ex) {
    logger.error("account provisioning failed: {}", ex.getMessage(), ex);
    return redirectToLogin(ERROR_SERVER_ERROR);
  }

  @ExceptionHandler(UnknownIdentityProviderException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownProvider(
      UnknownIdentityProviderException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("PROVIDER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    logger.warn("authenticated user is missing: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("USER_NOT_FOUND", "user not found"));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", "internal error"));
  }

  private ResponseEntity<Void> redirectToLogin(String error) {
    final URI location =
        UriComponentsBuilder.fromUriString(loginRedirectProperties.redirectUrl())
            .queryParam("error", error)
            .build()
            .toUri();
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }
}
