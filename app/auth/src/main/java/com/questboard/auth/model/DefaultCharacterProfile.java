package com.questboard.auth.model;

/** 新規ユーザーと同時に付与する初期キャラクター。 */
public record DefaultCharacterProfile(CharacterCode characterCode, String nickName) {

  public DefaultCharacterProfile {
    if (characterCode == null) {
      throw new IllegalArgumentException("characterCode is required");
    }
    if (nickName == null || nickName.isBlank()) {
      throw new IllegalArgumentException("nickName is required");
    }
  }
}
