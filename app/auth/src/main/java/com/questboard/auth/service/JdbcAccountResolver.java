/*
 * どこで: Auth サービス層
 * 何を: 連携情報から既存アカウントを読み取る
 * なぜ: 解決処理を読み取り専用に保ち、作成処理と分けるため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.ResolvedAccount;
import com.questboard.auth.repository.LinkedIdentityRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JdbcAccountResolver implements AccountResolver {

  private final LinkedIdentityRepository linkedIdentityRepository;

  @Override
  public Optional<ResolvedAccount> resolve(String provider, String externalId) {
    if (isBlank(provider)) {
      throw new IllegalArgumentException("provider is required");
    }
    if (isBlank(externalId)) {
      throw new IllegalArgumentException("externalId is required");
    }
    return linkedIdentityRepository.findByProviderAndSubject(provider, externalId);
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
