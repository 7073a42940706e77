/*
 * どこで: app/membership-sync/src/main/java/com/example/membership_sync/api/WebhookController.java
 * 何を: アイデンティティ基盤からのライフサイクル Webhook を受け付ける
 * なぜ: 署名検証を解析より前に行い、処理結果を送信元の再配信判断に合うステータスへ変換するため
 */
package com.example.membership_sync.api;

import com.example.membership_sync.api.response.WebhookResponse;
import com.example.membership_sync.model.ReconciliationOutcome;
import com.example.membership_sync.service.SyncMetrics;
import com.example.membership_sync.service.WebhookAuthenticationException;
import com.example.membership_sync.service.WebhookProcessingService;
import com.example.membership_sync.service.WebhookSignatureVerifier;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class WebhookController {

  private final WebhookSignatureVerifier signatureVerifier;
  private final WebhookProcessingService processingService;
  private final SyncMetrics syncMetrics;

  /**
   * 役割:
   * - Webhook を 1 件処理する。
   *
   * 期待動作:
   * - ボディは文字列として 1 回だけ読み、署名検証が通るまで解析しない。
   * - 対象外イベントは 204、調停完了/対応不要の受理は 200 を返す。
   * - 署名不正は 401、JSON 不正は 400、設定不足/上流失敗は 500 (例外ハンドラ側で変換)。
   */
  @PostMapping("${sync.webhook.path:/webhooks/identity}")
  public ResponseEntity<WebhookResponse> receive(
      HttpServletRequest request, @RequestBody(required = false) String rawBody) {
    if (!signatureVerifier.verify(request.getHeader(signatureVerifier.headerName()))) {
      throw new WebhookAuthenticationException("Invalid signature");
    }
    final ReconciliationOutcome outcome = processingService.process(rawBody);
    syncMetrics.recordWebhookOutcome(outcome.status().name());
    return switch (outcome.status()) {
      case IGNORED -> ResponseEntity.noContent().build();
      case ACKNOWLEDGED_NO_ACTION, APPLIED ->
          ResponseEntity.ok(new WebhookResponse(outcome.status().name(), outcome.message()));
    };
  }
}
