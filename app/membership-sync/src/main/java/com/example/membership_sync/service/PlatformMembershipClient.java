/*
 * どこで: Membership-Sync サービス層
 * 何を: ユーザーのテナント所属 (追加/招待/削除/無効化/一覧) を操作するクライアント
 * なぜ: プラットフォームにテナント間移動の API が無く、個別操作の組み合わせで移動を表現するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.PlatformClientProperties;
import com.example.membership_sync.service.dto.BulkInviteRequest;
import com.example.membership_sync.service.dto.UserTenantAssignRequest;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class PlatformMembershipClient {

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final VendorCredentialCache credentialCache;
  private final PlatformCallExecutor callExecutor;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformMembershipClient(
      RestClient platformRestClient,
      PlatformClientProperties properties,
      VendorCredentialCache credentialCache,
      PlatformCallExecutor callExecutor) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.credentialCache = credentialCache;
    this.callExecutor = callExecutor;
  }

  public PlatformCallExecutor.MutationResult addUserToTenant(String userId, String tenantId) {
    requireText(userId, "userId is required");
    requireText(tenantId, "tenantId is required");
    final String token = credentialCache.acquire();
    return callExecutor.mutate(
        PlatformOperation.ADD_USER_TO_TENANT,
        () ->
            platformRestClient
                .post()
                .uri(properties.userTenantPath(), userId)
                .headers(headers -> headers.setBearerAuth(token))
                .body(new UserTenantAssignRequest(tenantId, true))
                .retrieve()
                .toBodilessEntity());
  }

  public PlatformCallExecutor.MutationResult inviteByEmail(
      String tenantId, String email, String displayName) {
    requireText(tenantId, "tenantId is required");
    requireText(email, "email is required");
    final String token = credentialCache.acquire();
    return callExecutor.mutate(
        PlatformOperation.BULK_INVITE_USER,
        () ->
            platformRestClient
                .post()
                .uri(properties.bulkInvitePath(), tenantId)
                .headers(headers -> headers.setBearerAuth(token))
                .body(BulkInviteRequest.silent(email, displayName))
                .retrieve()
                .toBodilessEntity());
  }

  public PlatformCallExecutor.MutationResult removeUserFromTenant(String userId, String tenantId) {
    requireText(userId, "userId is required");
    requireText(tenantId, "tenantId is required");
    final String token = credentialCache.acquire();
    return callExecutor.mutate(
        PlatformOperation.REMOVE_USER_FROM_TENANT,
        () ->
            platformRestClient
                .delete()
                .uri(properties.userDeletePath(), userId)
                .headers(
                    headers -> {
                      headers.setBearerAuth(token);
                      headers.set(properties.tenantHeaderName(), tenantId);
                    })
                .retrieve()
                .toBodilessEntity());
  }

  public JsonNode listTenantUsers(String tenantId, int limit) {
    requireText(tenantId, "tenantId is required");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive");
    }
    final String token = credentialCache.acquire();
    return callExecutor.query(
        PlatformOperation.LIST_TENANT_USERS,
        () ->
            platformRestClient
                .get()
                .uri(
                    uriBuilder ->
                        uriBuilder
                            .path(properties.tenantUsersPath())
                            .queryParam("_limit", limit)
                            .queryParam("_offset", 0)
                            .build())
                .headers(
                    headers -> {
                      headers.setBearerAuth(token);
                      headers.set(properties.tenantHeaderName(), tenantId);
                    })
                .retrieve()
                .body(JsonNode.class));
  }

  public PlatformCallExecutor.MutationResult disableUserInTenant(String userId, String tenantId) {
    requireText(userId, "userId is required");
    requireText(tenantId, "tenantId is required");
    final String token = credentialCache.acquire();
    return callExecutor.mutate(
        PlatformOperation.DISABLE_USER_IN_TENANT,
        () ->
            platformRestClient
                .post()
                .uri(properties.userDisablePath(), userId)
                .headers(
                    headers -> {
                      headers.setBearerAuth(token);
                      headers.set(properties.tenantHeaderName(), tenantId);
                    })
                .retrieve()
                .toBodilessEntity());
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
