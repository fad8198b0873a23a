package com.questboard.auth.model;

/**
 * 外部 ID と内部ユーザーの紐付け結果。
 *
 * <p>{@link Conflict} は同じ (provider, provider_subject_id) を並行する初回ログインが先にコミットし、
 * この試行がロールバックされたことを表す。
 */
public sealed interface AccountBinding
    permits AccountBinding.Linked, AccountBinding.Created, AccountBinding.Conflict {

  /** 既に連携済みだったユーザー。 */
  record Linked(UserRecord user) implements AccountBinding {}

  /** ユーザー/連携/初期キャラクターを同時に作成した。 */
  record Created(UserRecord user) implements AccountBinding {}

  record Conflict() implements AccountBinding {}
}
