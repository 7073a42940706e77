/*
 * どこで: Membership-Sync サービス層
 * 何を: テナントの検索・作成・既定アプリ割り当てを行うクライアント
 * なぜ: テナント解決に必要なプラットフォーム呼び出しを 1 箇所に集約するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.PlatformClientProperties;
import com.example.membership_sync.model.Tenant;
import com.example.membership_sync.service.dto.ApplicationAssignmentRequest;
import com.example.membership_sync.service.dto.TenantCreateRequest;
import com.example.membership_sync.service.dto.TenantResponse;
import com.fasterxml.jackson.databind.JsonNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

@Service
public class PlatformTenantClient {

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final VendorCredentialCache credentialCache;
  private final PlatformCallExecutor callExecutor;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformTenantClient(
      RestClient platformRestClient,
      PlatformClientProperties properties,
      VendorCredentialCache credentialCache,
      PlatformCallExecutor callExecutor) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.credentialCache = credentialCache;
    this.callExecutor = callExecutor;
  }

  /** 自由文字列フィルタで 1 件だけ検索する。応答は配列と items ラップの両方を受け付ける。 */
  public Optional<Tenant> findFirstByName(String name) {
    requireText(name, "name is required");
    final String token = credentialCache.acquire();
    return callExecutor.query(
        PlatformOperation.SEARCH_TENANTS,
        () ->
            toTenant(
                platformRestClient
                    .get()
                    .uri(
                        uriBuilder ->
                            uriBuilder
                                .path(properties.tenantsSearchPath())
                                .queryParam("_filter", name)
                                .queryParam("_limit", 1)
                                .build())
                    .headers(headers -> headers.setBearerAuth(token))
                    .retrieve()
                    .body(JsonNode.class),
                name));
  }

  public Tenant create(String name) {
    requireText(name, "name is required");
    final String token = credentialCache.acquire();
    return callExecutor.query(
        PlatformOperation.CREATE_TENANT,
        () ->
            toCreatedTenant(
                platformRestClient
                    .post()
                    .uri(properties.tenantCreatePath())
                    .headers(headers -> headers.setBearerAuth(token))
                    .body(new TenantCreateRequest(name))
                    .retrieve()
                    .body(TenantResponse.class),
                name));
  }

  public PlatformCallExecutor.MutationResult assignApplication(
      String applicationId, String tenantId) {
    requireText(applicationId, "applicationId is required");
    requireText(tenantId, "tenantId is required");
    final String token = credentialCache.acquire();
    return callExecutor.mutate(
        PlatformOperation.ASSIGN_APPLICATION,
        () ->
            platformRestClient
                .post()
                .uri(properties.applicationAssignmentPath(), applicationId)
                .headers(headers -> headers.setBearerAuth(token))
                .body(new ApplicationAssignmentRequest(tenantId))
                .retrieve()
                .toBodilessEntity());
  }

  // 実行器の内側で呼ぶ。INVALID_RESPONSE もエラーメトリクスに載る。
  private Optional<Tenant> toTenant(JsonNode body, String requestedName) {
    final JsonNode first = firstItem(body);
    if (first == null) {
      return Optional.empty();
    }
    final String tenantId = text(first, "tenantId").orElseGet(() -> text(first, "id").orElse(""));
    if (tenantId.isBlank()) {
      throw new PlatformIntegrationException(
          PlatformOperation.SEARCH_TENANTS,
          PlatformIntegrationException.Reason.INVALID_RESPONSE,
          "search_tenants returned an item without tenantId");
    }
    return Optional.of(new Tenant(tenantId, text(first, "name").orElse(requestedName)));
  }

  private Tenant toCreatedTenant(TenantResponse response, String requestedName) {
    if (response == null || response.tenantId() == null || response.tenantId().isBlank()) {
      throw new PlatformIntegrationException(
          PlatformOperation.CREATE_TENANT,
          PlatformIntegrationException.Reason.INVALID_RESPONSE,
          "create_tenant response has no tenantId");
    }
    return new Tenant(
        response.tenantId(), response.name() == null ? requestedName : response.name());
  }

  private JsonNode firstItem(JsonNode body) {
    if (body == null) {
      return null;
    }
    final JsonNode items = body.isArray() ? body : body.path("items");
    if (!items.isArray() || items.isEmpty()) {
      return null;
    }
    return items.get(0);
  }

  private Optional<String> text(JsonNode node, String field) {
    final JsonNode value = node.path(field);
    if (!value.isValueNode() || value.isNull()) {
      return Optional.empty();
    }
    final String text = value.asText().trim();
    return text.isEmpty() ? Optional.empty() : Optional.of(text);
  }

  private void requireText(String value, String message) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(message);
    }
  }
}
