/*
 * どこで: Membership-Sync サービス層
 * 何を: テナントのメンバーが 2 人以上いるかを、全件取得せずに判定する
 * なぜ: 最初の参加者 (オーナー) 以外を無効化する判定をテナント規模によらず 1 回の呼び出しで行うため
 */
package com.example.membership_sync.service;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TenantPopulationOracle {

  private static final Logger logger = LoggerFactory.getLogger(TenantPopulationOracle.class);
  private static final int THRESHOLD = 2;
  private static final List<JsonPointer> TOTAL_SOURCES =
      List.of(
          JsonPointer.compile("/_metadata/totalItems"),
          JsonPointer.compile("/_metadata/total"),
          JsonPointer.compile("/totalItems"),
          JsonPointer.compile("/total"),
          JsonPointer.compile("/count"));

  private final PlatformMembershipClient membershipClient;

  public boolean hasAtLeastTwoMembers(String tenantId) {
    final JsonNode page = membershipClient.listTenantUsers(tenantId, THRESHOLD);
    final OptionalLong total = explicitTotal(page);
    if (total.isPresent()) {
      logger.debug("tenant population tenantId={} total={}", tenantId, total.getAsLong());
      return total.getAsLong() >= THRESHOLD;
    }
    final int returned = items(page).size();
    logger.debug("tenant population tenantId={} returnedItems={}", tenantId, returned);
    return returned >= THRESHOLD;
  }

  private OptionalLong explicitTotal(JsonNode page) {
    if (page == null) {
      return OptionalLong.empty();
    }
    for (JsonPointer pointer : TOTAL_SOURCES) {
      final JsonNode value = page.at(pointer);
      if (value.isIntegralNumber()) {
        return OptionalLong.of(value.asLong());
      }
      if (value.isTextual() && value.asText().matches("\\d+")) {
        return OptionalLong.of(Long.parseLong(value.asText()));
      }
    }
    return OptionalLong.empty();
  }

  private JsonNode items(JsonNode page) {
    final JsonNode items = page == null ? null : page.isArray() ? page : page.path("items");
    if (items == null || !items.isArray()) {
      throw new PlatformIntegrationException(
          PlatformOperation.LIST_TENANT_USERS,
          PlatformIntegrationException.Reason.INVALID_RESPONSE,
          "list_tenant_users response has neither a total nor an items array");
    }
    return items;
  }
}
