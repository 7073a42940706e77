/*
 * どこで: Membership-Sync サービス層
 * 何を: 認証済み Webhook ボディを正規化 → 対象判定 → テナント解決 → 所属調停まで順に処理する
 * なぜ: 各段階が前段の結果に依存するため、1 リクエスト内で直列に実行し最初の失敗で打ち切るため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.MembershipSyncProperties;
import com.example.membership_sync.model.ActionableEventKind;
import com.example.membership_sync.model.InboundEvent;
import com.example.membership_sync.model.ReconciliationOutcome;
import com.example.membership_sync.model.Tenant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class WebhookProcessingService {

  private static final Logger logger = LoggerFactory.getLogger(WebhookProcessingService.class);

  private final InboundEventNormalizer normalizer;
  private final TenantNamePolicy tenantNamePolicy;
  private final TenantResolver tenantResolver;
  private final MembershipReconciler reconciler;
  private final MembershipSyncProperties properties;

  public ReconciliationOutcome process(String rawBody) {
    final InboundEvent event = normalizer.normalize(rawBody);
    final Optional<ActionableEventKind> kind = actionableKind(event.kind());
    if (kind.isEmpty()) {
      logger.debug("webhook ignored: event kind not actionable kind={}", event.kind());
      return ReconciliationOutcome.ignored("event kind is not actionable");
    }
    MDC.put("event_kind", event.kind());
    if (event.hasUserId()) {
      MDC.put("user_id", event.userId());
    }
    try {
      return processActionable(kind.get(), event);
    } finally {
      MDC.remove("event_kind");
      MDC.remove("user_id");
    }
  }

  private ReconciliationOutcome processActionable(ActionableEventKind kind, InboundEvent event) {
    if (kind == ActionableEventKind.INVITED_TO_TENANT) {
      if (!properties.hasDefaultSourceTenant()) {
        throw new SyncConfigurationException("default source tenant is not configured");
      }
      if (!properties.defaultSourceTenantId().equals(event.sourceTenantId())) {
        logger.info(
            "webhook ignored: invitation from non-default tenant sourceTenantId={}",
            event.sourceTenantId());
        return ReconciliationOutcome.ignored("invitation is not from the default source tenant");
      }
    }
    if (!TenantNamePolicy.isUsableEmail(event.email())) {
      logger.error("actionable webhook has no usable email kind={}", event.kind());
      return ReconciliationOutcome.acknowledged("event has no usable email");
    }
    final String targetName = tenantNamePolicy.targetNameFor(event);
    if (properties.dryRun()) {
      logger.info(
          "dry run: would reconcile user into tenant name={} userIdKnown={} sourceTenantId={}",
          targetName,
          event.hasUserId(),
          properties.defaultSourceTenantId());
      return ReconciliationOutcome.acknowledged("dry run: target tenant " + targetName);
    }
    final Tenant target = tenantResolver.resolve(targetName);
    return reconciler.reconcile(event, target, properties.defaultSourceTenantId());
  }

  private Optional<ActionableEventKind> actionableKind(String kind) {
    if (properties.signedUpEventKey().equals(kind)) {
      return Optional.of(ActionableEventKind.SIGNED_UP);
    }
    if (properties.invitedEventKey().equals(kind)) {
      return Optional.of(ActionableEventKind.INVITED_TO_TENANT);
    }
    return Optional.empty();
  }
}
