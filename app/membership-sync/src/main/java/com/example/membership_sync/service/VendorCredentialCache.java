/*
 * どこで: Membership-Sync サービス層
 * 何を: ベンダートークンをプロセス全体で 1 つだけ保持し、失効時に取り直す
 * なぜ: Webhook ごとに認証エンドポイントを呼ばずに済ませるため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.PlatformClientProperties;
import com.example.membership_sync.model.VendorSession;
import com.example.membership_sync.service.dto.VendorAuthResponse;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class VendorCredentialCache {

  private static final Logger logger = LoggerFactory.getLogger(VendorCredentialCache.class);

  private final AtomicReference<VendorSession> current = new AtomicReference<>();
  private final PlatformCredentialClient credentialClient;
  private final PlatformClientProperties properties;
  private final Clock clock;

  /**
   * 有効なベアラートークンを返す。
   *
   * <p>ロックは取らない。同時に失効を検知した複数リクエストがそれぞれ取り直しても、後勝ちで 1 つのセッションに置き換わるだけになる。
   */
  public String acquire() {
    final Instant now = Instant.now(clock);
    final VendorSession cached = current.get();
    if (cached != null && cached.isUsableAt(now)) {
      return cached.token();
    }
    final VendorSession refreshed = refresh(now);
    current.set(refreshed);
    return refreshed.token();
  }

  @VisibleForTesting
  public void invalidate() {
    current.set(null);
  }

  private VendorSession refresh(Instant now) {
    final VendorAuthResponse response = credentialClient.exchange();
    final Duration lifetime = resolveLifetime(response.expiresIn());
    final VendorSession session = new VendorSession(response.token(), now.plus(lifetime));
    logger.info("vendor session refreshed expiresAt={}", session.expiresAt());
    return session;
  }

  // 実際の有効期限より短い TTL を使い、処理途中での失効を避ける
  private Duration resolveLifetime(Long expiresInSeconds) {
    final Duration configured = properties.tokenTtl();
    if (expiresInSeconds == null || expiresInSeconds <= 0) {
      return configured;
    }
    final Duration reported = Duration.ofSeconds(expiresInSeconds);
    return reported.compareTo(configured) < 0 ? reported : configured;
  }
}
