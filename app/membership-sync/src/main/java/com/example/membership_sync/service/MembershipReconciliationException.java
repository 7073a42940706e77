/*
 * どこで: Membership-Sync サービス層
 * 何を: 所属調停のどの段階で外部呼び出しが失敗したかを保持する例外
 * なぜ: 追加成功後の削除失敗のような部分適用を、ログと応答で判別できるようにするため
 */
package com.example.membership_sync.service;

import java.util.Locale;

public class MembershipReconciliationException extends RuntimeException {

  private final ReconciliationStep step;
  private final boolean targetMembershipApplied;

  public MembershipReconciliationException(
      ReconciliationStep step, boolean targetMembershipApplied, PlatformIntegrationException cause) {
    super(step.name().toLowerCase(Locale.ROOT) + " failed: " + cause.getMessage(), cause);
    this.step = step;
    this.targetMembershipApplied = targetMembershipApplied;
  }

  public ReconciliationStep step() {
    return step;
  }

  public boolean targetMembershipApplied() {
    return targetMembershipApplied;
  }

  public PlatformIntegrationException platformCause() {
    return (PlatformIntegrationException) getCause();
  }
}
