package com.example.membership_sync.service;

public class PlatformIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    BAD_GATEWAY,
    TIMEOUT,
    INVALID_RESPONSE
  }

  private final PlatformOperation operation;
  private final Reason reason;

  public PlatformIntegrationException(PlatformOperation operation, Reason reason, String message) {
    super(message);
    this.operation = operation;
    this.reason = reason;
  }

  public PlatformIntegrationException(
      PlatformOperation operation, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.operation = operation;
    this.reason = reason;
  }

  public PlatformOperation operation() {
    return operation;
  }

  public Reason reason() {
    return reason;
  }
}
