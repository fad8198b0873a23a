/*
 * どこで: Auth サービス層
 * 何を: 初回ログイン時のアカウント作成の契約を定義する
 * なぜ: 作成の原子性と競合時の結果を実装から切り離してテストできるようにするため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.AccountBinding;
import com.questboard.auth.model.DefaultCharacterProfile;
import com.questboard.auth.model.ExternalIdentity;

public interface AccountBootstrap {

  /**
   * 役割: ユーザー/連携情報/初期キャラクターを 1 単位で作成する。
   * 動作: 成功時は {@link AccountBinding.Created}、並行作成に負けた場合は何も残さず
   * {@link AccountBinding.Conflict} を返す。
   * 前提: それ以外の失敗は {@link AccountProvisioningException} を送出する。
   */
  AccountBinding bootstrap(ExternalIdentity identity, DefaultCharacterProfile profile);
}
