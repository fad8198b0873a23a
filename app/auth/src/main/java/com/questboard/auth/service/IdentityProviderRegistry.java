/*
 * どこで: Auth サービス層
 * 何を: /auth/{provider} のパスに対応する IdentityProviderClient を引く
 * なぜ: provider の追加を Bean 登録だけで済ませ、未対応 provider を 404 にそろえるため
 */
package com.questboard.auth.service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class IdentityProviderRegistry {

  private final Map<String, IdentityProviderClient> clients;

  public IdentityProviderRegistry(List<IdentityProviderClient> clients) {
    this.clients =
        clients.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    IdentityProviderClient::provider, Function.identity()));
  }

  public IdentityProviderClient get(String provider) {
    final IdentityProviderClient client = provider == null ? null : clients.get(provider);
    if (client == null) {
      throw new UnknownIdentityProviderException(provider);
    }
    return client;
  }
}
