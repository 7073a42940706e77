/*
 * どこで: Membership-Sync 設定
 * 何を: テナント所属の調停ルールに関わる設定を保持する
 * なぜ: 既定テナント/既定アプリ/ドライランを運用側で切り替えるため
 */
package com.example.membership_sync.config;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sync")
public record MembershipSyncProperties(
    String defaultApplicationId,
    String defaultSourceTenantId,
    boolean dryRun,
    Map<String, String> domainOverrides,
    String signedUpEventKey,
    String invitedEventKey) {

  public MembershipSyncProperties {
    defaultApplicationId = defaultApplicationId == null ? "" : defaultApplicationId.trim();
    defaultSourceTenantId = defaultSourceTenantId == null ? "" : defaultSourceTenantId.trim();
    // ドメインの比較は小文字で行う
    domainOverrides =
        domainOverrides == null
            ? Map.of()
            : domainOverrides.entrySet().stream()
                .filter(entry -> entry.getValue() != null && !entry.getValue().isBlank())
                .collect(
                    Collectors.toUnmodifiableMap(
                        entry -> entry.getKey().trim().toLowerCase(Locale.ROOT),
                        entry -> entry.getValue().trim(),
                        (first, second) -> first));
    signedUpEventKey =
        signedUpEventKey == null || signedUpEventKey.isBlank()
            ? "frontegg.user.signedUp"
            : signedUpEventKey;
    invitedEventKey =
        invitedEventKey == null || invitedEventKey.isBlank()
            ? "frontegg.user.invitedToTenant"
            : invitedEventKey;
  }

  public boolean hasDefaultApplication() {
    return !defaultApplicationId.isEmpty();
  }

  public boolean hasDefaultSourceTenant() {
    return !defaultSourceTenantId.isEmpty();
  }

  public Optional<String> overrideFor(String domain) {
    if (domain == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(domainOverrides.get(domain.toLowerCase(Locale.ROOT)));
  }
}
