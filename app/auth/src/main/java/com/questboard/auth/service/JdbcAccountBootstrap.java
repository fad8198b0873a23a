/*
 * どこで: Auth サービス層
 * 何を: ユーザー/連携/初期キャラクターを 1 トランザクションで作成する
 * なぜ: 一意制約の競合をロールバックと Conflict 結果で表し、部分的な作成を残さないため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.AccountBinding;
import com.questboard.auth.model.DefaultCharacterProfile;
import com.questboard.auth.model.ExternalIdentity;
import com.questboard.auth.model.LinkedIdentityRecord;
import com.questboard.auth.model.UserRecord;
import com.questboard.auth.repository.LinkedIdentityRepository;
import com.questboard.auth.repository.UserCharacterRepository;
import com.questboard.auth.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class JdbcAccountBootstrap implements AccountBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(JdbcAccountBootstrap.class);

  private final TransactionTemplate transactionTemplate;
  private final UserRepository userRepository;
  private final LinkedIdentityRepository linkedIdentityRepository;
  private final UserCharacterRepository userCharacterRepository;
  private final Clock clock;

  @Override
  public AccountBinding bootstrap(
      @NonNull ExternalIdentity identity, @NonNull DefaultCharacterProfile profile) {
    final AccountBinding binding;
    try {
      binding = transactionTemplate.execute(status -> insertAll(identity, profile, status));
    } catch (DataAccessException | TransactionException ex) {
      throw new AccountProvisioningException("account bootstrap failed", ex);
    }
    if (binding == null) {
      throw new AccountProvisioningException("account bootstrap returned no result");
    }
    return binding;
  }

  private AccountBinding insertAll(
      ExternalIdentity identity, DefaultCharacterProfile profile, TransactionStatus status) {
    final Instant now = Instant.now(clock);
    final UserRecord user =
        userRepository.insert(
            identity.email(), identity.displayName(), identity.avatarUrl(), now);

    // 一意制約 (provider, provider_subject_id) が競合した側はここで 0 行になる
    final Optional<LinkedIdentityRecord> link =
        linkedIdentityRepository.insertIfAbsent(
            identity.provider(), identity.externalId(), user.userId(), identity.email(), now);
    if (link.isEmpty()) {
      status.setRollbackOnly();
      logger.info(
          "bootstrap lost uniqueness race provider={} externalId={}",
          identity.provider(),
          identity.externalId());
      return new AccountBinding.Conflict();
    }

    userCharacterRepository.insertActive(user.userId(), profile, now);
    logger.info(
        "bootstrapped account userId={} provider={} character={}",
        user.userId(),
        identity.provider(),
        profile.characterCode());
    return new AccountBinding.Created(user);
  }
}
