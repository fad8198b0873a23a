/*
 * どこで: Auth サービス層 DTO
 * 何を: Google userinfo エンドポイントの応答
 * なぜ: 外部 ID へ変換する前の生の項目を型付きで受け取るため
 */
package com.questboard.auth.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleUserInfo(
    String id,
    String email,
    @JsonProperty("verified_email") Boolean verifiedEmail,
    String name,
    String picture) {}
