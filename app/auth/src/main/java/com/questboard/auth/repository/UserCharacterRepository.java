/*
 * どこで: Auth リポジトリ層
 * 何を: 初回登録時の所持キャラクター行を作成する
 * なぜ: ユーザー作成と同じトランザクションで初期キャラクターを付与するため
 */
package com.questboard.auth.repository;

import static com.questboard.common.JdbcTimestampUtils.toInstant;
import static com.questboard.common.JdbcTimestampUtils.toTimestamp;

import com.questboard.auth.model.CharacterCode;
import com.questboard.auth.model.DefaultCharacterProfile;
import com.questboard.auth.model.UserCharacterRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserCharacterRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UserCharacterRecord insertActive(
      long userId, DefaultCharacterProfile profile, Instant now) {
    final String sql =
        """
        INSERT INTO user_characters
            (user_id, character_code, nick_name, level, experience, is_active,
             created_at, updated_at)
        VALUES (:userId, :characterCode, :nickName, 1, 0, TRUE, :createdAt, :updatedAt)
        RETURNING id, user_id, character_code, nick_name, level, experience, is_active,
                  created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("characterCode", profile.characterCode().name())
            .addValue("nickName", profile.nickName())
            .addValue("createdAt", toTimestamp(now))
            .addValue("updatedAt", toTimestamp(now));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private UserCharacterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserCharacterRecord(
        rs.getLong("id"),
        rs.getLong("user_id"),
        CharacterCode.valueOf(rs.getString("character_code")),
        rs.getString("nick_name"),
        rs.getInt("level"),
        rs.getInt("experience"),
        rs.getBoolean("is_active"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
