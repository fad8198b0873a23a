/*
 * どこで: Auth サービス層
 * 何を: 署名付き・期限付きのセッショントークンの発行と検証を定義する
 * なぜ: サーバー側にセッション状態を持たずに認証を成立させるため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.IssuedToken;
import com.questboard.auth.model.VerifiedSession;

public interface TokenService {

  IssuedToken issue(long userId);

  /**
   * 役割: トークンの署名と期限を検証する。
   * 動作: 失敗時は INVALID または EXPIRED の {@link TokenVerificationException} を送出する。
   * 前提: ストレージは参照しない。
   */
  VerifiedSession verify(String token);
}
