/*
 * どこで: Auth サービス層
 * 何を: Google OAuth 2.0 の認可コードをトークン交換し、userinfo から外部 ID を得る
 * なぜ: HTTP 失敗を理由付きの IdentityExchangeException にそろえ、プロバイダーの詳細を外へ出さないため
 */
package com.questboard.auth.service;

import com.questboard.auth.config.GoogleProviderProperties;
import com.questboard.auth.model.ExternalIdentity;
import com.questboard.auth.service.dto.GoogleTokenResponse;
import com.questboard.auth.service.dto.GoogleUserInfo;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

@Service
public class GoogleIdentityProviderClient implements IdentityProviderClient {

  public static final String PROVIDER = "google";

  private static final Logger logger = LoggerFactory.getLogger(GoogleIdentityProviderClient.class);

  private final RestClient googleRestClient;
  private final GoogleProviderProperties properties;

  public GoogleIdentityProviderClient(
      @Qualifier("googleRestClient") RestClient googleRestClient,
      GoogleProviderProperties properties) {
    this.googleRestClient = googleRestClient;
    this.properties = properties;
  }

  @Override
  public String provider() {
    return PROVIDER;
  }

  @Override
  public URI authorizationUri() {
    return UriComponentsBuilder.fromUriString(properties.authorizationEndpoint())
        .queryParam("client_id", properties.clientId())
        .queryParam("redirect_uri", properties.callbackUrl())
        .queryParam("response_type", "code")
        .queryParam("scope", properties.scope())
        .queryParam("access_type", "offline")
        .queryParam("prompt", "consent")
        .encode()
        .build()
        .toUri();
  }

  @Override
  public ExternalIdentity exchange(String authorizationCode) {
    if (authorizationCode == null || authorizationCode.isBlank()) {
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.MISSING_CODE, "authorization code is required");
    }
    final String accessToken = requestAccessToken(authorizationCode);
    final GoogleUserInfo userInfo = requestUserInfo(accessToken);
    return toExternalIdentity(userInfo);
  }

  private String requestAccessToken(String authorizationCode) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("code", authorizationCode);
    form.add("client_id", properties.clientId());
    form.add("client_secret", properties.clientSecret());
    form.add("redirect_uri", properties.callbackUrl());
    form.add("grant_type", "authorization_code");

    final GoogleTokenResponse response =
        call(
            "token",
            () ->
                googleRestClient
                    .post()
                    .uri(properties.tokenEndpoint())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(form)
                    .retrieve()
                    .body(GoogleTokenResponse.class));
    if (response == null || isBlank(response.accessToken())) {
      logger.warn("google token response has no access_token");
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.INVALID_RESPONSE, "provider returned no access token");
    }
    return response.accessToken();
  }

  private GoogleUserInfo requestUserInfo(String accessToken) {
    final GoogleUserInfo userInfo =
        call(
            "userinfo",
            () ->
                googleRestClient
                    .get()
                    .uri(properties.userInfoEndpoint())
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .body(GoogleUserInfo.class));
    if (userInfo == null || isBlank(userInfo.id())) {
      logger.warn("google userinfo response has no subject id");
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.INVALID_RESPONSE, "provider returned no subject");
    }
    return userInfo;
  }

  private <T> T call(String step, Supplier<T> request) {
    try {
      return request.get();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "google {} call failed with http status={} statusText={}",
          step,
          ex.getStatusCode().value(),
          ex.getStatusText());
      if (ex.getStatusCode().is4xxClientError()) {
        throw new IdentityExchangeException(
            IdentityExchangeException.Reason.INVALID_CODE, "provider rejected the request", ex);
      }
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.PROVIDER_UNAVAILABLE, "provider server error", ex);
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("google {} call timed out", step);
      } else {
        logger.warn("google {} call connection failed", step, ex);
      }
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.PROVIDER_UNAVAILABLE, "provider unreachable", ex);
    } catch (RestClientException ex) {
      logger.warn("google {} response parse failed", step, ex);
      throw new IdentityExchangeException(
          IdentityExchangeException.Reason.INVALID_RESPONSE, "provider response parse failed", ex);
    }
  }

  private ExternalIdentity toExternalIdentity(GoogleUserInfo userInfo) {
    return new ExternalIdentity(
        PROVIDER, userInfo.id(), userInfo.email(), userInfo.name(), userInfo.picture());
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
