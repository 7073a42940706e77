/*
 * どこで: Membership-Sync サービス層
 * 何を: Webhook ヘッダーの共有シークレット/署名付きトークンを検証する
 * なぜ: 認証されていない要求をペイロード解析より前に拒否するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.WebhookProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.impl.HMAC;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

  private static final Logger logger = LoggerFactory.getLogger(WebhookSignatureVerifier.class);

  private final WebhookProperties properties;
  private final Clock clock;

  public String headerName() {
    return properties.headerName();
  }

  public boolean verify(String headerValue) {
    return verify(headerValue, properties.secret());
  }

  /**
   * 役割:
   * - ヘッダー値を設定済みシークレットで検証する。
   *
   * 期待動作:
   * - ヘッダー値とシークレットがバイト一致すれば成功 (事前共有鍵方式)。
   * - 一致しなければ HMAC 署名付き JWT として検証する (署名アサーション方式)。
   * - ヘッダー値かシークレットのどちらかが空なら常に失敗。例外は投げない。
   */
  public boolean verify(String headerValue, String configuredSecret) {
    if (isBlank(headerValue) || isBlank(configuredSecret)) {
      return false;
    }
    final byte[] expected = configuredSecret.getBytes(StandardCharsets.UTF_8);
    if (MessageDigest.isEqual(headerValue.getBytes(StandardCharsets.UTF_8), expected)) {
      return true;
    }
    return verifySignedAssertion(headerValue, expected);
  }

  private boolean verifySignedAssertion(String token, byte[] secret) {
    try {
      final SignedJWT jwt = SignedJWT.parse(token);
      final JWSAlgorithm algorithm = jwt.getHeader().getAlgorithm();
      final String macAlgorithm = macAlgorithmName(algorithm);
      if (macAlgorithm == null) {
        logger.debug("webhook assertion rejected: alg={}", algorithm);
        return false;
      }
      // 鍵長の下限なしで計算する (MACVerifier は 256 bit 未満の鍵を受け付けない)
      final byte[] computed = HMAC.compute(macAlgorithm, secret, jwt.getSigningInput(), null);
      if (!MessageDigest.isEqual(computed, jwt.getSignature().decode())) {
        return false;
      }
      final Date expiresAt = jwt.getJWTClaimsSet().getExpirationTime();
      if (expiresAt != null && !expiresAt.toInstant().isAfter(Instant.now(clock))) {
        logger.debug("webhook assertion rejected: expired at {}", expiresAt.toInstant());
        return false;
      }
      return true;
    } catch (ParseException | JOSEException ex) {
      logger.debug("webhook assertion rejected: {}", ex.getClass().getSimpleName());
      return false;
    } catch (RuntimeException ex) {
      logger.warn("webhook assertion verification failed unexpectedly", ex);
      return false;
    }
  }

  private static String macAlgorithmName(JWSAlgorithm algorithm) {
    if (JWSAlgorithm.HS256.equals(algorithm)) {
      return "HmacSHA256";
    }
    if (JWSAlgorithm.HS384.equals(algorithm)) {
      return "HmacSHA384";
    }
    if (JWSAlgorithm.HS512.equals(algorithm)) {
      return "HmacSHA512";
    }
    return null;
  }

  private boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
