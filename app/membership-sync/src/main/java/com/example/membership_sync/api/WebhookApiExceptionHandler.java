package com.example.membership_sync.api;

import com.example.membership_sync.service.MembershipReconciliationException;
import com.example.membership_sync.service.PlatformIntegrationException;
import com.example.membership_sync.service.SyncConfigurationException;
import com.example.membership_sync.service.SyncMetrics;
import com.example.membership_sync.service.WebhookAuthenticationException;
import com.example.membership_sync.service.WebhookPayloadException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class WebhookApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(WebhookApiExceptionHandler.class);

  private final SyncMetrics syncMetrics;

  @ExceptionHandler(WebhookAuthenticationException.class)
  public ResponseEntity<ApiErrorResponse> handleAuthentication(WebhookAuthenticationException ex) {
    logger.warn("webhook rejected: invalid signature");
    return respond(HttpStatus.UNAUTHORIZED, "INVALID_SIGNATURE", ex.getMessage());
  }

  @ExceptionHandler(WebhookPayloadException.class)
  public ResponseEntity<ApiErrorResponse> handlePayload(WebhookPayloadException ex) {
    logger.warn("webhook rejected: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", ex.getMessage());
  }

  @ExceptionHandler(SyncConfigurationException.class)
  public ResponseEntity<ApiErrorResponse> handleConfiguration(SyncConfigurationException ex) {
    logger.error("webhook failed: configuration error: {}", ex.getMessage());
    return failed("CONFIGURATION_MISSING", ex.getMessage());
  }

  @ExceptionHandler(MembershipReconciliationException.class)
  public ResponseEntity<ApiErrorResponse> handleReconciliation(
      MembershipReconciliationException ex) {
    logger.error(
        "webhook failed: reconciliation step={} targetMembershipApplied={}: {}",
        ex.step(),
        ex.targetMembershipApplied(),
        ex.getMessage());
    return failed(platformCode(ex.platformCause()), ex.getMessage());
  }

  @ExceptionHandler(PlatformIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handlePlatform(PlatformIntegrationException ex) {
    logger.error(
        "webhook failed: platform operation={} reason={}: {}",
        ex.operation(),
        ex.reason(),
        ex.getMessage());
    return failed(platformCode(ex), ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleUnexpected(RuntimeException ex) {
    logger.error("webhook failed unexpectedly", ex);
    return failed("INTERNAL_ERROR", "Internal error");
  }

  private String platformCode(PlatformIntegrationException ex) {
    return switch (ex.reason()) {
      case UNAUTHORIZED -> "PLATFORM_UNAUTHORIZED";
      case FORBIDDEN -> "PLATFORM_FORBIDDEN";
      case NOT_FOUND -> "PLATFORM_NOT_FOUND";
      case CONFLICT -> "PLATFORM_CONFLICT";
      case TIMEOUT -> "PLATFORM_TIMEOUT";
      case INVALID_RESPONSE -> "PLATFORM_INVALID_RESPONSE";
      case BAD_GATEWAY -> "PLATFORM_BAD_GATEWAY";
    };
  }

  private ResponseEntity<ApiErrorResponse> failed(String code, String message) {
    syncMetrics.recordWebhookOutcome(SyncMetrics.OUTCOME_FAILED);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, code, message);
  }

  private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message) {
    syncMetrics.recordWebhookError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }
}
