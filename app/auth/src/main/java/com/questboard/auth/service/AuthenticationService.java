/*
 * どこで: Auth サービス層
 * 何を: OAuth コールバック 1 回分を認可コードからセッショントークン発行まで実行する
 * なぜ: 外部 ID 交換、アカウント解決/作成、トークン発行の順序と失敗時の計測を 1 か所に集約するため
 */
package com.questboard.auth.service;

import com.questboard.auth.config.BootstrapProperties;
import com.questboard.auth.model.AccountBinding;
import com.questboard.auth.model.AuthenticationResult;
import com.questboard.auth.model.DefaultCharacterProfile;
import com.questboard.auth.model.ExternalIdentity;
import com.questboard.auth.model.IssuedToken;
import com.questboard.auth.model.ResolvedAccount;
import com.questboard.auth.model.UserRecord;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class AuthenticationService {

  private static final Logger logger = LoggerFactory.getLogger(AuthenticationService.class);

  private final IdentityProviderRegistry identityProviderRegistry;
  private final AccountResolver accountResolver;
  private final AccountBootstrap accountBootstrap;
  private final TokenService tokenService;
  private final AuthMetrics authMetrics;
  private final DefaultCharacterProfile defaultCharacterProfile;

  public AuthenticationService(
      IdentityProviderRegistry identityProviderRegistry,
      AccountResolver accountResolver,
      AccountBootstrap accountBootstrap,
      TokenService tokenService,
      AuthMetrics authMetrics,
      BootstrapProperties bootstrapProperties) {
    this.identityProviderRegistry = identityProviderRegistry;
    this.accountResolver = accountResolver;
    this.accountBootstrap = accountBootstrap;
    this.tokenService = tokenService;
    this.authMetrics = authMetrics;
    this.defaultCharacterProfile = bootstrapProperties.toDefaultProfile();
  }

  public AuthenticationResult authenticate(String provider, String authorizationCode) {
    final IdentityProviderClient client = identityProviderRegistry.get(provider);

    final ExternalIdentity identity;
    try {
      identity = client.exchange(authorizationCode);
    } catch (IdentityExchangeException ex) {
      authMetrics.recordLogin(provider, AuthMetrics.RESULT_EXCHANGE_FAILED);
      throw ex;
    }

    final AccountBinding binding;
    try {
      binding = bind(identity);
    } catch (AccountProvisioningException ex) {
      authMetrics.recordLogin(provider, AuthMetrics.RESULT_PROVISIONING_FAILED);
      throw ex;
    }

    final boolean newAccount = binding instanceof AccountBinding.Created;
    final UserRecord user = userOf(binding);
    final IssuedToken token = tokenService.issue(user.userId());

    authMetrics.recordLogin(
        provider,
        newAccount ? AuthMetrics.RESULT_NEW_ACCOUNT : AuthMetrics.RESULT_EXISTING_ACCOUNT);
    logger.info(
        "login succeeded provider={} userId={} newAccount={} expiresAt={}",
        provider,
        user.userId(),
        newAccount,
        token.expiresAt());
    return new AuthenticationResult(token, newAccount, user);
  }

  /**
   * 役割: provider が code ではなく error を返したコールバックを失敗として扱う。
   * 動作: provider の存在確認後、CONSENT_DENIED の IdentityExchangeException を送出する。
   */
  public void rejectConsent(String provider, String providerError) {
    identityProviderRegistry.get(provider);
    authMetrics.recordLogin(provider, AuthMetrics.RESULT_EXCHANGE_FAILED);
    throw new IdentityExchangeException(
        IdentityExchangeException.Reason.CONSENT_DENIED,
        "provider returned error: " + providerError);
  }

  /**
   * 役割: 外部 ID を内部ユーザーへ紐付ける。
   * 動作: 既存連携を引き、無ければ作成する。作成が競合に負けた場合だけ 1 回再解決する。
   * 前提: 競合の勝者は連携をコミット済みのため、再解決で見つかる。
   */
  private AccountBinding bind(ExternalIdentity identity) {
    final Optional<ResolvedAccount> existing =
        accountResolver.resolve(identity.provider(), identity.externalId());
    if (existing.isPresent()) {
      return new AccountBinding.Linked(existing.get().user());
    }

    final AccountBinding created = accountBootstrap.bootstrap(identity, defaultCharacterProfile);
    if (!(created instanceof AccountBinding.Conflict)) {
      return created;
    }

    authMetrics.recordProvisioningRace(identity.provider());
    logger.info(
        "account creation lost a concurrent race, re-resolving provider={}", identity.provider());
    return accountResolver
        .resolve(identity.provider(), identity.externalId())
        .<AccountBinding>map(account -> new AccountBinding.Linked(account.user()))
        .orElseThrow(
            () ->
                new AccountProvisioningException(
                    "identity link vanished after provisioning conflict"));
  }

  private UserRecord userOf(AccountBinding binding) {
    if (binding instanceof AccountBinding.Linked linked) {
      return linked.user();
    }
    if (binding instanceof AccountBinding.Created created) {
      return created.user();
    }
    throw new IllegalStateException("unresolved account binding: " + binding);
  }
}
