/*
 * どこで: Auth サービス層
 * 何を: /auth/me 用のユーザー情報を取得する
 * なぜ: トークン発行後に削除されたユーザーを 404 として扱うため
 */
package com.questboard.auth.service;

import com.questboard.auth.model.UserRecord;
import com.questboard.auth.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserProfileService {

  private final UserRepository userRepository;

  public UserRecord getUser(long userId) {
    return userRepository.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
  }
}
