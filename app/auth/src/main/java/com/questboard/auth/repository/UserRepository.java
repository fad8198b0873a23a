/*
 * どこで: Auth リポジトリ層
 * 何を: users テーブルの参照と作成を行う
 * なぜ: 初回ログイン時のユーザー作成と /auth/me の参照を SQL で明示的に扱うため
 */
package com.questboard.auth.repository;

import static com.questboard.common.JdbcTimestampUtils.toInstant;
import static com.questboard.common.JdbcTimestampUtils.toTimestamp;

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
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findById(long userId) {
    final String sql =
        """
        SELECT id, email, name, avatar_url, created_at, updated_at
        FROM users
        WHERE id = :userId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, UserRepository::mapRow).stream().findFirst();
  }

  public UserRecord insert(String email, String name, String avatarUrl, Instant now) {
    final String sql =
        """
        INSERT INTO users (email, name, avatar_url, created_at, updated_at)
        VALUES (:email, :name, :avatarUrl, :createdAt, :updatedAt)
        RETURNING id, email, name, avatar_url, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", email)
            .addValue("name", name)
            .addValue("avatarUrl", avatarUrl)
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, UserRepository::mapRow);
  }

  static UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("name"),
        rs.getString("avatar_url"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
