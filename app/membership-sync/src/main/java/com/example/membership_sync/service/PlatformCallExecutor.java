/*
 * どこで: Membership-Sync サービス層
 * 何を: プラットフォーム呼び出しの計測・エラー分類・冪等成功ステータスの判定を一箇所で行う
 * なぜ: 各クライアントが同じ失敗分類を持ち、最初の想定外ステータスで必ず例外にするため
 */
package com.example.membership_sync.service;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

@Component
@RequiredArgsConstructor
public class PlatformCallExecutor {

  private static final Logger logger = LoggerFactory.getLogger(PlatformCallExecutor.class);

  private final SyncMetrics syncMetrics;

  public enum MutationResult {
    APPLIED,
    ALREADY_SATISFIED
  }

  public <T> T query(PlatformOperation operation, Supplier<T> call) {
    final long startedAt = System.nanoTime();
    try {
      final T result = call.get();
      recordDuration(operation, "success", startedAt);
      return result;
    } catch (RestClientResponseException ex) {
      recordDuration(operation, "error", startedAt);
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      recordDuration(operation, "error", startedAt);
      throw mapResourceException(operation, ex);
    } catch (PlatformIntegrationException ex) {
      recordDuration(operation, "error", startedAt);
      syncMetrics.recordPlatformError(operation, ex.reason().name());
      throw ex;
    } catch (RuntimeException ex) {
      recordDuration(operation, "error", startedAt);
      logger.warn("platform {} response parse failed", operation.metricName(), ex);
      syncMetrics.recordPlatformError(
          operation, PlatformIntegrationException.Reason.INVALID_RESPONSE.name());
      throw new PlatformIntegrationException(
          operation,
          PlatformIntegrationException.Reason.INVALID_RESPONSE,
          operation.metricName() + " response parse failed",
          ex);
    }
  }

  public MutationResult mutate(PlatformOperation operation, Runnable call) {
    final long startedAt = System.nanoTime();
    try {
      call.run();
      recordDuration(operation, "success", startedAt);
      return MutationResult.APPLIED;
    } catch (RestClientResponseException ex) {
      final int status = ex.getStatusCode().value();
      if (operation.isIdempotentSuccess(status)) {
        recordDuration(operation, "already_satisfied", startedAt);
        logger.info(
            "platform {} returned status={} treated as already satisfied",
            operation.metricName(),
            status);
        return MutationResult.ALREADY_SATISFIED;
      }
      recordDuration(operation, "error", startedAt);
      throw mapResponseException(operation, ex);
    } catch (ResourceAccessException ex) {
      recordDuration(operation, "error", startedAt);
      throw mapResourceException(operation, ex);
    }
  }

  private PlatformIntegrationException mapResponseException(
      PlatformOperation operation, RestClientResponseException ex) {
    final int status = ex.getStatusCode().value();
    logger.warn(
        "platform {} failed with http status={} statusText={}",
        operation.metricName(),
        status,
        ex.getStatusText());
    final PlatformIntegrationException.Reason reason =
        switch (status) {
          case 401 -> PlatformIntegrationException.Reason.UNAUTHORIZED;
          case 403 -> PlatformIntegrationException.Reason.FORBIDDEN;
          case 404 -> PlatformIntegrationException.Reason.NOT_FOUND;
          case 409 -> PlatformIntegrationException.Reason.CONFLICT;
          default -> PlatformIntegrationException.Reason.BAD_GATEWAY;
        };
    syncMetrics.recordPlatformError(operation, reason.name());
    return new PlatformIntegrationException(
        operation, reason, operation.metricName() + " failed with status " + status, ex);
  }

  private PlatformIntegrationException mapResourceException(
      PlatformOperation operation, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("platform {} timed out", operation.metricName());
      syncMetrics.recordPlatformError(
          operation, PlatformIntegrationException.Reason.TIMEOUT.name());
      return new PlatformIntegrationException(
          operation,
          PlatformIntegrationException.Reason.TIMEOUT,
          operation.metricName() + " request timeout",
          ex);
    }
    logger.warn("platform {} connection failed", operation.metricName(), ex);
    syncMetrics.recordPlatformError(
        operation, PlatformIntegrationException.Reason.BAD_GATEWAY.name());
    return new PlatformIntegrationException(
        operation,
        PlatformIntegrationException.Reason.BAD_GATEWAY,
        operation.metricName() + " connection failed",
        ex);
  }

  private void recordDuration(PlatformOperation operation, String result, long startedAt) {
    syncMetrics.recordPlatformDuration(
        operation, result, Duration.ofNanos(System.nanoTime() - startedAt));
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
