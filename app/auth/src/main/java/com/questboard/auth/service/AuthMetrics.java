/*
 * どこで: Auth サービス層
 * 何を: ログイン結果・初回作成の競合・セッション拒否をメトリクスとして記録する
 * なぜ: ログイン成功率と 401 の内訳を Prometheus から直接観測できるようにするため
 */
package com.questboard.auth.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class AuthMetrics {

  public static final String RESULT_NEW_ACCOUNT = "new_account";
  public static final String RESULT_EXISTING_ACCOUNT = "existing_account";
  public static final String RESULT_EXCHANGE_FAILED = "exchange_failed";
  public static final String RESULT_PROVISIONING_FAILED = "provisioning_failed";

  private static final String METRIC_LOGIN_TOTAL = "auth.login.total";
  private static final String METRIC_PROVISIONING_RACE_TOTAL = "auth.provisioning.race.total";
  private static final String METRIC_SESSION_REJECTED_TOTAL = "auth.session.rejected.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> loginCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> raceCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> sessionRejectedCounters = new ConcurrentHashMap<>();

  public AuthMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordLogin(String provider, String result) {
    final String key = provider + "|" + result;
    loginCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_LOGIN_TOTAL)
                    .description("OAuth callback outcomes")
                    .tags(Tags.of("provider", provider, "result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordProvisioningRace(String provider) {
    raceCounters
        .computeIfAbsent(
            provider,
            ignored ->
                Counter.builder(METRIC_PROVISIONING_RACE_TOTAL)
                    .description("First logins that lost the account creation race")
                    .tags(Tags.of("provider", provider))
                    .register(meterRegistry))
        .increment();
  }

  public void recordSessionRejected(String reason) {
    sessionRejectedCounters
        .computeIfAbsent(
            reason,
            ignored ->
                Counter.builder(METRIC_SESSION_REJECTED_TOTAL)
                    .description("Requests rejected by the session guard")
                    .tags(Tags.of("reason", reason))
                    .register(meterRegistry))
        .increment();
  }
}
