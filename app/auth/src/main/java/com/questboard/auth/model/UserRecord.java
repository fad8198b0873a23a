/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: API/Service/Repository 間でユーザー情報の受け渡しを明確にするため
 */
package com.questboard.auth.model;

import java.time.Instant;

public record UserRecord(
        long userId,
        String email,
        String name,
        String avatarUrl,
        Instant createdAt,
        Instant updatedAt) {
}
