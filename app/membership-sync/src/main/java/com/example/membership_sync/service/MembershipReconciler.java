/*
 * どこで: Membership-Sync サービス層
 * 何を: 所属先テナントへの追加 → 既定テナントからの削除 → 条件付き無効化、を順に実行する
 * なぜ: 削除が失敗してもユーザーがどのテナントにも属さない状態を作らないため、追加を必ず先に行う
 */
package com.example.membership_sync.service;

import com.example.membership_sync.model.InboundEvent;
import com.example.membership_sync.model.ReconciliationOutcome;
import com.example.membership_sync.model.Tenant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MembershipReconciler {

  private static final Logger logger = LoggerFactory.getLogger(MembershipReconciler.class);

  private final PlatformMembershipClient membershipClient;
  private final TenantPopulationOracle populationOracle;

  /**
   * 役割:
   * - 解決済みの所属先テナントに対してユーザーの所属を調停する。
   *
   * 期待動作:
   * - 追加が失敗したら削除/無効化は実行しない。
   * - 追加成功後に削除が失敗した場合も失敗として扱い、送信元の再配信に任せる。
   * - 各段階は 409/404 を成功扱いにするため、再配信で同じ結果に収束する。
   *
   * @param sourceTenantId 既定 (保留用) テナント ID。未設定なら空文字
   */
  public ReconciliationOutcome reconcile(InboundEvent event, Tenant target, String sourceTenantId) {
    addToTarget(event, target);
    final boolean removed = removeFromSource(event, target, sourceTenantId);
    final boolean disabled = disableIfNotFirstMember(event, target);
    return ReconciliationOutcome.applied(
        "user reconciled into tenant "
            + target.name()
            + (removed ? ", removed from source tenant" : "")
            + (disabled ? ", disabled pending approval" : ""));
  }

  private void addToTarget(InboundEvent event, Tenant target) {
    try {
      if (event.hasUserId()) {
        final PlatformCallExecutor.MutationResult result =
            membershipClient.addUserToTenant(event.userId(), target.id());
        logger.info(
            "user attached to tenant userId={} tenantId={} result={}",
            event.userId(),
            target.id(),
            result);
        return;
      }
      // ID が無い場合のみメール招待で追加する (未登録ならプラットフォーム側で作成される)
      membershipClient.inviteByEmail(target.id(), event.email(), event.displayName());
      logger.info("user invited to tenant by email tenantId={}", target.id());
    } catch (PlatformIntegrationException ex) {
      throw failure(ReconciliationStep.ADD_TO_TARGET_TENANT, false, ex);
    }
  }

  private boolean removeFromSource(InboundEvent event, Tenant target, String sourceTenantId) {
    if (!event.hasUserId()) {
      logger.info("source tenant removal skipped: user id unknown tenantId={}", target.id());
      return false;
    }
    if (sourceTenantId == null || sourceTenantId.isBlank()) {
      logger.info("source tenant removal skipped: default source tenant not configured");
      return false;
    }
    if (sourceTenantId.equals(target.id())) {
      logger.info("source tenant removal skipped: target is the source tenant {}", target.id());
      return false;
    }
    try {
      final PlatformCallExecutor.MutationResult result =
          membershipClient.removeUserFromTenant(event.userId(), sourceTenantId);
      logger.info(
          "user removed from source tenant userId={} sourceTenantId={} result={}",
          event.userId(),
          sourceTenantId,
          result);
      return true;
    } catch (PlatformIntegrationException ex) {
      throw failure(ReconciliationStep.REMOVE_FROM_SOURCE_TENANT, true, ex);
    }
  }

  private boolean disableIfNotFirstMember(InboundEvent event, Tenant target) {
    if (!event.hasUserId()) {
      return false;
    }
    try {
      if (!populationOracle.hasAtLeastTwoMembers(target.id())) {
        logger.info("user kept enabled as first tenant member tenantId={}", target.id());
        return false;
      }
      membershipClient.disableUserInTenant(event.userId(), target.id());
      logger.info("user disabled in tenant userId={} tenantId={}", event.userId(), target.id());
      return true;
    } catch (PlatformIntegrationException ex) {
      throw failure(ReconciliationStep.DISABLE_IN_TARGET_TENANT, true, ex);
    }
  }

  private MembershipReconciliationException failure(
      ReconciliationStep step, boolean targetMembershipApplied, PlatformIntegrationException ex) {
    logger.warn(
        "membership reconciliation aborted step={} targetMembershipApplied={} operation={} reason={}",
        step,
        targetMembershipApplied,
        ex.operation(),
        ex.reason());
    return new MembershipReconciliationException(step, targetMembershipApplied, ex);
  }
}
