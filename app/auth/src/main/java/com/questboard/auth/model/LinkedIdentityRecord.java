/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/LinkedIdentityRecord.java
 * 何を: linked_identities テーブル相当のドメインレコード
 * なぜ: provider + subject による同定情報を正規化して扱うため
 */
package com.questboard.auth.model;

import java.time.Instant;

public record LinkedIdentityRecord(
        long id,
        String provider,
        String providerSubjectId,
        long userId,
        String email,
        Instant createdAt) {
}
