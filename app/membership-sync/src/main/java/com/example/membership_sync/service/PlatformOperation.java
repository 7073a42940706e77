/*
 * どこで: Membership-Sync サービス層
 * 何を: プラットフォームへの外部呼び出し種別と、その呼び出しで成功扱いにするステータスを定義する
 * なぜ: 冪等な再実行で返る 409/404 を「エラー無視」ではなく操作ごとに明示して許容するため
 */
package com.example.membership_sync.service;

import java.util.Set;

public enum PlatformOperation {
  VENDOR_AUTHENTICATE("vendor_authenticate", Set.of()),
  SEARCH_TENANTS("search_tenants", Set.of()),
  CREATE_TENANT("create_tenant", Set.of()),
  // 既に割り当て済み
  ASSIGN_APPLICATION("assign_application", Set.of(409)),
  // 既にメンバー
  ADD_USER_TO_TENANT("add_user_to_tenant", Set.of(409)),
  BULK_INVITE_USER("bulk_invite_user", Set.of()),
  // 既にメンバーではない
  REMOVE_USER_FROM_TENANT("remove_user_from_tenant", Set.of(404)),
  LIST_TENANT_USERS("list_tenant_users", Set.of()),
  DISABLE_USER_IN_TENANT("disable_user_in_tenant", Set.of());

  private final String metricName;
  private final Set<Integer> idempotentSuccessStatuses;

  PlatformOperation(String metricName, Set<Integer> idempotentSuccessStatuses) {
    this.metricName = metricName;
    this.idempotentSuccessStatuses = idempotentSuccessStatuses;
  }

  public String metricName() {
    return metricName;
  }

  public boolean isIdempotentSuccess(int statusCode) {
    return idempotentSuccessStatuses.contains(statusCode);
  }
}
