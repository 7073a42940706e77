/*
 * どこで: Membership-Sync モデル
 * 何を: Webhook 1 件の処理結果 (成功側のみ)
 * なぜ: HTTP ステータスの決定をパイプラインから切り離すため
 */
package com.example.membership_sync.model;

public record ReconciliationOutcome(Status status, String message) {

  public enum Status {
    IGNORED,
    ACKNOWLEDGED_NO_ACTION,
    APPLIED
  }

  public ReconciliationOutcome {
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
    message = message == null ? "" : message;
  }

  public static ReconciliationOutcome ignored(String message) {
    return new ReconciliationOutcome(Status.IGNORED, message);
  }

  public static ReconciliationOutcome acknowledged(String message) {
    return new ReconciliationOutcome(Status.ACKNOWLEDGED_NO_ACTION, message);
  }

  public static ReconciliationOutcome applied(String message) {
    return new ReconciliationOutcome(Status.APPLIED, message);
  }
}
