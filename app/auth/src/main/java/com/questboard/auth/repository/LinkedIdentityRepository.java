/*
 * どこで: Auth リポジトリ層
 * 何を: linked_identities の参照と競合安全な追加を行う
 * なぜ: 一意制約 (provider, provider_subject_id) を初回作成の競合判定に使うため
 */
package com.questboard.auth.repository;

import static com.questboard.common.JdbcTimestampUtils.toInstant;
import static com.questboard.common.JdbcTimestampUtils.toTimestamp;

import com.questboard.auth.model.LinkedIdentityRecord;
import com.questboard.auth.model.ResolvedAccount;
import com.questboard.auth.model.UserRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class LinkedIdentityRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割: provider + subject の一意キーで連携情報と所有ユーザーを取得する。
   * 動作: linked_identities と users を結合し、未連携なら empty を返す。
   * 前提: email での照合は行わない。
   */
  public Optional<ResolvedAccount> findByProviderAndSubject(String provider, String subject) {
    final String sql =
        """
        SELECT li.id AS link_id, li.provider, li.provider_subject_id, li.user_id,
               li.email AS link_email, li.created_at AS link_created_at,
               u.id, u.email, u.name, u.avatar_url, u.created_at, u.updated_at
        FROM linked_identities li
        JOIN users u ON u.id = li.user_id
        WHERE li.provider = :provider AND li.provider_subject_id = :subject
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("provider", provider).addValue("subject", subject);
    return jdbcTemplate.query(sql, params, this::mapResolvedRow).stream().findFirst();
  }

  /**
   * 役割: provider + subject が未使用の場合だけ連携情報を追加する。
   * 動作: ON CONFLICT DO NOTHING で挿入し、競合時は empty を返す。
   * 前提: 並行トランザクションが同じキーを保持/コミット済みなら 0 行になる。
   */
  public Optional<LinkedIdentityRecord> insertIfAbsent(
      String provider, String subject, long userId, String email, Instant now) {
    final String sql =
        """
        INSERT INTO linked_identities (user_id, provider, provider_subject_id, email, created_at)
        VALUES (:userId, :provider, :subject, :email, :createdAt)
        ON CONFLICT (provider, provider_subject_id) DO NOTHING
        RETURNING id, provider, provider_subject_id, user_id, email, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("provider", provider)
            .addValue("subject", subject)
            .addValue("email", email)
            .addValue("createdAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private LinkedIdentityRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LinkedIdentityRecord(
        rs.getLong("id"),
        rs.getString("provider"),
        rs.getString("provider_subject_id"),
        rs.getLong("user_id"),
        rs.getString("email"),
        toInstant(rs.getTimestamp("created_at")));
  }

  private ResolvedAccount mapResolvedRow(ResultSet rs, int rowNum) throws SQLException {
    final LinkedIdentityRecord identity =
        new LinkedIdentityRecord(
            rs.getLong("link_id"),
            rs.getString("provider"),
            rs.getString("provider_subject_id"),
            rs.getLong("user_id"),
            rs.getString("link_email"),
            toInstant(rs.getTimestamp("link_created_at")));
    final UserRecord user = UserRepository.mapRow(rs, rowNum);
    return new ResolvedAccount(identity, user);
  }
}
