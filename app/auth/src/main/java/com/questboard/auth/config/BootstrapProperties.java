/*
 * どこで: Auth アプリの設定バインド
 * 何を: 初回登録時に付与するキャラクターとニックネームを保持する
 * なぜ: 初期キャラクターをコード変更なしで切り替えるため
 */
package com.questboard.auth.config;

import com.questboard.auth.model.CharacterCode;
import com.questboard.auth.model.DefaultCharacterProfile;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.bootstrap")
public record BootstrapProperties(CharacterCode characterCode, String nickname) {

  public BootstrapProperties {
    characterCode = characterCode == null ? CharacterCode.TRAECHAN : characterCode;
    nickname = nickname == null || nickname.isBlank() ? "トレちゃん" : nickname;
  }

  public DefaultCharacterProfile toDefaultProfile() {
    return new DefaultCharacterProfile(characterCode, nickname);
  }
}
