/*
 * どこで: Membership-Sync 設定
 * 何を: アイデンティティ/テナント基盤の管理 API 呼び出し設定を保持する
 * なぜ: 接続先・認証情報・エンドポイントパスを環境変数から差し替えるため
 */
package com.example.membership_sync.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "platform")
public record PlatformClientProperties(
    String baseUrl,
    String clientId,
    String secret,
    Duration tokenTtl,
    String tenantHeaderName,
    String vendorAuthPath,
    String tenantsSearchPath,
    String tenantCreatePath,
    String applicationAssignmentPath,
    String userTenantPath,
    String bulkInvitePath,
    String userDeletePath,
    String tenantUsersPath,
    String userDisablePath) {

  public PlatformClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://api.frontegg.com" : baseUrl;
    clientId = clientId == null ? "" : clientId;
    secret = secret == null ? "" : secret;
    tokenTtl =
        tokenTtl == null || tokenTtl.isZero() || tokenTtl.isNegative()
            ? Duration.ofHours(6)
            : tokenTtl;
    tenantHeaderName =
        tenantHeaderName == null || tenantHeaderName.isBlank()
            ? "frontegg-tenant-id"
            : tenantHeaderName;
    vendorAuthPath = orDefault(vendorAuthPath, "/auth/vendor");
    tenantsSearchPath = orDefault(tenantsSearchPath, "/tenants/resources/tenants/v2");
    tenantCreatePath = orDefault(tenantCreatePath, "/tenants/resources/tenants/v1");
    applicationAssignmentPath =
        orDefault(
            applicationAssignmentPath,
            "/applications/resources/applications/tenant-assignments/v1/{applicationId}");
    userTenantPath = orDefault(userTenantPath, "/identity/resources/users/v1/{userId}/tenant");
    bulkInvitePath =
        orDefault(bulkInvitePath, "/identity/resources/tenants/invites/v1/bulk/{tenantId}");
    userDeletePath = orDefault(userDeletePath, "/identity/resources/users/v1/{userId}");
    tenantUsersPath = orDefault(tenantUsersPath, "/identity/resources/users/v3");
    userDisablePath =
        orDefault(userDisablePath, "/identity/resources/tenants/users/v1/{userId}/disable");
  }

  public boolean hasCredentials() {
    return !clientId.isBlank() && !secret.isBlank();
  }

  @Override
  public String toString() {
    return "PlatformClientProperties[baseUrl=" + baseUrl + ", clientId=" + clientId + "]";
  }

  private static String orDefault(String value, String defaultValue) {
    return value == null || value.isBlank() ? defaultValue : value;
  }
}
