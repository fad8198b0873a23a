/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/UserCharacterRecord.java
 * 何を: user_characters テーブル相当のドメインレコード
 * なぜ: 初回登録時に作るキャラクターを他のレコードと同じ形で扱うため
 */
package com.questboard.auth.model;

import java.time.Instant;

public record UserCharacterRecord(
        long id,
        long userId,
        CharacterCode characterCode,
        String nickName,
        int level,
        int experience,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {
}
