/*
 * どこで: Membership-Sync サービス層
 * 何を: テナント名から所属先テナントを検索し、無ければ作成する
 * なぜ: Webhook 1 件ごとに所属先テナントの存在と既定アプリの割り当てを保証するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.MembershipSyncProperties;
import com.example.membership_sync.model.Tenant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TenantResolver {

  private static final Logger logger = LoggerFactory.getLogger(TenantResolver.class);

  private final PlatformTenantClient tenantClient;
  private final MembershipSyncProperties properties;

  public Tenant resolve(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("tenant name is required");
    }
    final Tenant tenant = findOrCreate(name);
    assignDefaultApplication(tenant);
    return tenant;
  }

  private Tenant findOrCreate(String name) {
    final Optional<Tenant> existing = tenantClient.findFirstByName(name);
    if (existing.isPresent()) {
      final Tenant found = existing.get();
      // 検索は自由文字列フィルタのため、名前が完全一致しない候補が返ることがある
      if (!found.name().equalsIgnoreCase(name)) {
        logger.warn(
            "tenant filter matched a differently named tenant requested={} matched={} tenantId={}",
            name,
            found.name(),
            found.id());
      } else {
        logger.info("tenant found name={} tenantId={}", found.name(), found.id());
      }
      return found;
    }
    // TODO: 同名テナントの同時作成を防ぐには、プラットフォーム側に作成時の一意制約が必要
    final Tenant created = tenantClient.create(name);
    logger.info("tenant created name={} tenantId={}", created.name(), created.id());
    return created;
  }

  private void assignDefaultApplication(Tenant tenant) {
    if (!properties.hasDefaultApplication()) {
      return;
    }
    final PlatformCallExecutor.MutationResult result =
        tenantClient.assignApplication(properties.defaultApplicationId(), tenant.id());
    logger.debug(
        "default application assignment tenantId={} result={}", tenant.id(), result);
  }
}
