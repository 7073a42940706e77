/*
 * どこで: Membership-Sync サービス層
 * 何を: イベントから所属先テナント名を決める
 * なぜ: 宣言名 > ドメイン上書き > メールドメインからの導出、の優先順位を 1 箇所で保証するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.MembershipSyncProperties;
import com.example.membership_sync.model.InboundEvent;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class TenantNamePolicy {

  private final MembershipSyncProperties properties;

  public String targetNameFor(InboundEvent event) {
    if (event.hasDeclaredTenantName()) {
      return event.declaredTenantName();
    }
    if (!isUsableEmail(event.email())) {
      throw new IllegalArgumentException("a usable email is required to derive a tenant name");
    }
    return properties
        .overrideFor(domainOf(event.email()))
        .orElseGet(() -> deriveFromEmail(event.email()));
  }

  /** {@code alice@Acme.io} → {@code Acme}. */
  public static String deriveFromEmail(String email) {
    final String label = firstLabel(domainOf(email));
    if (label.isEmpty()) {
      throw new IllegalArgumentException("email has no domain label");
    }
    return label.substring(0, 1).toUpperCase(Locale.ROOT) + label.substring(1);
  }

  public static boolean isUsableEmail(String email) {
    return !firstLabel(domainOf(email)).isEmpty();
  }

  private static String domainOf(String email) {
    if (email == null) {
      return "";
    }
    final int at = email.indexOf('@');
    if (at < 0) {
      return "";
    }
    return email.substring(at + 1).trim().toLowerCase(Locale.ROOT);
  }

  private static String firstLabel(String domain) {
    final int dot = domain.indexOf('.');
    return dot < 0 ? domain : domain.substring(0, dot);
  }
}
