/*
 * どこで: Membership-Sync プラットフォーム連携 DTO
 * 何を: メールアドレス指定でテナントへユーザーを一括招待する要求
 * なぜ: ユーザー ID が無いイベントでも、未登録なら作成しつつ所属させるため
 */
package com.example.membership_sync.service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record BulkInviteRequest(List<InvitedUser> users) {

  public BulkInviteRequest {
    users = users == null ? List.of() : List.copyOf(users);
  }

  public static BulkInviteRequest silent(String email, String name) {
    return new BulkInviteRequest(
        List.of(
            new InvitedUser(
                email, name == null || name.isBlank() ? null : name, "local", true, true)));
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record InvitedUser(
      String email, String name, String provider, boolean skipInviteEmail, boolean verified) {}
}
