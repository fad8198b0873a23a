/*
 * どこで: app/auth/src/main/java/com/questboard/auth/model/ExternalIdentity.java
 * 何を: 外部 IdP が検証済みとして返した利用者情報
 * なぜ: IdP 固有のレスポンス形式と業務処理を分離するため
 */
package com.questboard.auth.model;

public record ExternalIdentity(
        String provider,
        String externalId,
        String email,
        String displayName,
        String avatarUrl) {
}
