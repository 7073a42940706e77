/*
 * どこで: Membership-Sync モデル
 * 何を: プラットフォーム管理 API 用のベアラートークンと失効時刻
 * なぜ: トークンと期限を 1 つの値として差し替え、部分更新を観測させないため
 */
package com.example.membership_sync.model;

import java.time.Instant;
import java.util.Objects;

public record VendorSession(String token, Instant expiresAt) {

  public VendorSession {
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public boolean isUsableAt(Instant now) {
    return now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "VendorSession[token=***, expiresAt=" + expiresAt + "]";
  }
}
