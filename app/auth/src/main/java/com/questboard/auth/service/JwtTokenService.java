/*
 * どこで: Auth サービス層
 * 何を: sub/iat/exp/iss を持つ HS256 JWT のセッショントークンを発行・検証する
 * なぜ: 期限判定を注入した Clock で猶予なしに行い、exp ちょうどで失効させるため
 */
package com.questboard.auth.service;

import com.google.common.annotations.VisibleForTesting;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.questboard.auth.config.TokenProperties;
import com.questboard.auth.model.IssuedToken;
import com.questboard.auth.model.VerifiedSession;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtIssuerValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.stereotype.Service;

@Service
public class JwtTokenService implements TokenService {

  private static final String HMAC_SHA_256 = "HmacSHA256";

  private final JwtEncoder jwtEncoder;
  private final NimbusJwtDecoder jwtDecoder;
  private final Duration ttl;
  private final String issuer;
  private final Clock clock;

  public JwtTokenService(TokenProperties properties, Clock clock) {
    final SecretKey key =
        new SecretKeySpec(
            properties.signingSecret().getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    this.jwtEncoder = new NimbusJwtEncoder(new ImmutableSecret<>(key));
    this.jwtDecoder = NimbusJwtDecoder.withSecretKey(key).macAlgorithm(MacAlgorithm.HS256).build();
    this.jwtDecoder.setJwtValidator(new JwtIssuerValidator(properties.issuer()));
    this.ttl = properties.ttl();
    this.issuer = properties.issuer();
    this.clock = clock;
  }

  @Override
  public IssuedToken issue(long userId) {
    // JWT の NumericDate は秒精度なので発行時刻も秒に揃える
    final Instant issuedAt = Instant.now(clock).truncatedTo(ChronoUnit.SECONDS);
    final Instant expiresAt = issuedAt.plus(ttl);
    final JwtClaimsSet claims =
        JwtClaimsSet.builder()
            .issuer(issuer)
            .subject(Long.toString(userId))
            .issuedAt(issuedAt)
            .expiresAt(expiresAt)
            .build();
    final JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).type("JWT").build();
    final String value =
        jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
    return new IssuedToken(value, userId, issuedAt, expiresAt);
  }

  @Override
  public VerifiedSession verify(String token) {
    if (token == null || token.isBlank()) {
      throw invalid("token is empty");
    }
    if (!hasCanonicalSignature(token)) {
      throw invalid("token signature segment is not canonical base64url");
    }

    final Jwt jwt;
    try {
      jwt = jwtDecoder.decode(token);
    } catch (JwtException ex) {
      throw new TokenVerificationException(
          TokenVerificationException.Reason.INVALID, "token rejected by decoder", ex);
    }

    final long userId = parseUserId(jwt.getSubject());
    final Instant issuedAt = jwt.getIssuedAt();
    final Instant expiresAt = jwt.getExpiresAt();
    if (issuedAt == null || expiresAt == null) {
      throw invalid("token is missing iat or exp");
    }
    if (!Instant.now(clock).isBefore(expiresAt)) {
      throw new TokenVerificationException(
          TokenVerificationException.Reason.EXPIRED, "token expired at " + expiresAt);
    }
    return new VerifiedSession(userId, issuedAt, expiresAt);
  }

  /**
   * 役割: 署名セグメントが正規の base64url 表現かを判定する。
   * 動作: デコード後に再エンコードし、元の文字列と一致するかを比べる。
   * 前提: 末尾文字の未使用ビットはデコーダーが無視するため、ここで弾かないと改ざんを見逃す。
   */
  @VisibleForTesting
  static boolean hasCanonicalSignature(String token) {
    final String[] parts = token.split("\\.", -1);
    if (parts.length != 3 || parts[2].isEmpty()) {
      return false;
    }
    try {
      final byte[] signature = Base64.getUrlDecoder().decode(parts[2]);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(signature).equals(parts[2]);
    } catch (IllegalArgumentException ex) {
      return false;
    }
  }

  private long parseUserId(String subject) {
    if (subject == null || subject.isBlank()) {
      throw invalid("token has no subject");
    }
    try {
      final long userId = Long.parseLong(subject);
      if (userId <= 0) {
        throw invalid("token subject is not a user id");
      }
      return userId;
    } catch (NumberFormatException ex) {
      throw new TokenVerificationException(
          TokenVerificationException.Reason.INVALID, "token subject is not numeric", ex);
    }
  }

  private TokenVerificationException invalid(String message) {
    return new TokenVerificationException(TokenVerificationException.Reason.INVALID, message);
  }
}
