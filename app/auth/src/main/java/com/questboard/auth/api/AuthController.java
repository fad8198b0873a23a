/*
 * どこで: app/auth/src/main/java/com/questboard/auth/api/AuthController.java
 * 何を: ログイン開始/コールバック/自分情報 API を提供
 * なぜ: OAuth 連携とセッショントークン発行の入口を 1 か所に集約するため
 */
package com.questboard.auth.api;

import com.questboard.auth.api.response.AuthCallbackResponse;
import com.questboard.auth.api.response.UserResponse;
import com.questboard.auth.model.AuthenticationResult;
import com.questboard.auth.model.SessionPrincipal;
import com.questboard.auth.service.AuthenticationService;
import com.questboard.auth.service.IdentityProviderRegistry;
import com.questboard.auth.service.UserProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

  private final IdentityProviderRegistry identityProviderRegistry;
  private final AuthenticationService authenticationService;
  private final UserProfileService userProfileService;

  /**
   * 役割: ログインを開始する。
   * 動作: provider の同意画面へ 302 でリダイレクトし、未対応 provider は 404 とする。
   */
  @GetMapping("/{provider}")
  public ResponseEntity<Void> login(@PathVariable("provider") String provider) {
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(identityProviderRegistry.get(provider).authorizationUri())
        .build();
  }

  /**
   * 役割: 認可コードを受け取り、アカウント解決とセッショントークン発行を行う。
   * 動作: provider が error を返した場合は同意拒否として扱う。
   * 前提: 失敗時のログイン画面へのリダイレクトは {@link AuthApiExceptionHandler} が行う。
   */
  @GetMapping("/{provider}/callback")
  public ResponseEntity<AuthCallbackResponse> callback(
      @PathVariable("provider") String provider,
      @RequestParam(name = "code", required = false) String code,
      @RequestParam(name = "error", required = false) String error) {
    if (error != null && !error.isBlank()) {
      authenticationService.rejectConsent(provider, error);
    }
    final AuthenticationResult result = authenticationService.authenticate(provider, code);
    return ResponseEntity.ok(AuthCallbackResponse.from(result));
  }

  @GetMapping("/me")
  public ResponseEntity<UserResponse> me(@AuthenticationPrincipal SessionPrincipal principal) {
    return ResponseEntity.ok(UserResponse.from(userProfileService.getUser(principal.userId())));
  }
}
