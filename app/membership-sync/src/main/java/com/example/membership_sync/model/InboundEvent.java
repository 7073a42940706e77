/*
 * どこで: Membership-Sync モデル
 * 何を: Webhook ペイロードから抽出した正規化済みイベント
 * なぜ: 送信元のペイロード形状の差異をパイプライン後段へ持ち込まないため
 */
package com.example.membership_sync.model;

public record InboundEvent(
    String kind,
    String userId,
    String email,
    String displayName,
    String declaredTenantName,
    String sourceTenantId) {

  public InboundEvent {
    kind = normalize(kind);
    userId = normalize(userId);
    email = normalize(email);
    displayName = normalize(displayName);
    declaredTenantName = normalize(declaredTenantName);
    sourceTenantId = normalize(sourceTenantId);
  }

  public static InboundEvent unrecognized() {
    return new InboundEvent("", "", "", "", "", "");
  }

  public boolean hasUserId() {
    return !userId.isEmpty();
  }

  public boolean hasDeclaredTenantName() {
    return !declaredTenantName.isEmpty();
  }

  public boolean hasSourceTenantId() {
    return !sourceTenantId.isEmpty();
  }

  private static String normalize(String value) {
    return value == null ? "" : value.trim();
  }
}
