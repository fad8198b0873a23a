/*
 * どこで: Auth サービス層
 * 何を: 既存アカウント解決の契約を定義する
 * なぜ: DB 実装とテスト用のインメモリ実装を差し替えられるようにするため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.ResolvedAccount;
import java.util.Optional;

public interface AccountResolver {

  /**
   * 役割: (provider, externalId) の一意キーで既存アカウントを読み取る。
   * 前提: email では照合しない。
   */
  Optional<ResolvedAccount> resolve(String provider, String externalId);
}
