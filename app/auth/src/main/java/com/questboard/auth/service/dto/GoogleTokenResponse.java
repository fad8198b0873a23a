/*
 * どこで: Auth サービス層 DTO
 * 何を: Google トークンエンドポイントの応答
 * なぜ: snake_case の項目を型付きで受け取るため
 */
package com.questboard.auth.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleTokenResponse(
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("token_type") String tokenType,
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("id_token") String idToken) {

  @Override
  public String toString() {
    return "GoogleTokenResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
  }
}
