/*
 * どこで: Auth サービス層
 * 何を: 外部 OAuth プロバイダーとの認可コード交換の境界を定義する
 * なぜ: プロバイダー固有の HTTP 呼び出しを業務処理から切り離し、テストでスタブに差し替えるため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.ExternalIdentity;
import java.net.URI;

public interface IdentityProviderClient {

  /** /auth/ 配下で provider を選ぶパスセグメント。 */
  String provider();

  /** ログイン開始時にブラウザを送る同意画面。 */
  URI authorizationUri();

  /**
   * 役割: 認可コードを検証済みの外部 ID に交換する。
   * 動作: 1 回だけ呼び出し、失敗は {@link IdentityExchangeException} として理由付きで返す。
   * 前提: 認可コードは使い捨てのため、実装側でリトライしない。
   */
  ExternalIdentity exchange(String authorizationCode);
}
