/*
 * どこで: Membership-Sync サービス層
 * 何を: Webhook 処理結果とプラットフォーム呼び出しのメトリクスを記録する
 * なぜ: 送信元の再配信が増えた原因 (署名不正/上流障害) を Prometheus から直接観測するため
 */
package com.example.membership_sync.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class SyncMetrics {

  /** 例外ハンドラが記録する失敗の outcome ラベル。 */
  public static final String OUTCOME_FAILED = "FAILED";

  private static final String METRIC_WEBHOOK_TOTAL = "membership.sync.webhook.total";
  private static final String METRIC_WEBHOOK_ERROR_TOTAL = "membership.sync.webhook.error.total";
  private static final String METRIC_PLATFORM_ERROR_TOTAL = "membership.sync.platform.error.total";
  private static final String METRIC_PLATFORM_DURATION = "membership.sync.platform.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> webhookCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> webhookErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> platformErrorCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> platformTimers = new ConcurrentHashMap<>();

  public SyncMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordWebhookOutcome(String outcome) {
    webhookCounters
        .computeIfAbsent(
            outcome,
            ignored ->
                Counter.builder(METRIC_WEBHOOK_TOTAL)
                    .description("Membership sync webhook outcomes")
                    .tags(Tags.of("outcome", outcome))
                    .register(meterRegistry))
        .increment();
  }

  public void recordWebhookError(String code) {
    webhookErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_WEBHOOK_ERROR_TOTAL)
                    .description("Membership sync webhook errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPlatformError(PlatformOperation operation, String reason) {
    final String key = operation.metricName() + "|" + reason;
    platformErrorCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_PLATFORM_ERROR_TOTAL)
                    .description("Identity platform call errors")
                    .tags(Tags.of("operation", operation.metricName(), "reason", reason))
                    .register(meterRegistry))
        .increment();
  }

  public void recordPlatformDuration(
      PlatformOperation operation, String result, Duration duration) {
    final String key = operation.metricName() + "|" + result;
    platformTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_PLATFORM_DURATION)
                    .description("Identity platform call duration")
                    .tags(Tags.of("operation", operation.metricName(), "result", result))
                    .register(meterRegistry))
        .record(duration);
  }
}
