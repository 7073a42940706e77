/*
 * どこで: 共通ユーティリティ
 * 何を: リクエスト ID を生成/正規化する
 * なぜ: Webhook 送信元が X-Request-Id を付けない場合でもログを相関できるようにするため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {

  private static final int MAX_INBOUND_LENGTH = 128;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  // 受信ヘッダーの値はログにそのまま載るため、空/過長/制御文字入りは採用しない
  public static String fromInboundOrNew(String inbound) {
    if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
      return newTraceId();
    }
    for (int i = 0; i < inbound.length(); i++) {
      if (Character.isISOControl(inbound.charAt(i))) {
        return newTraceId();
      }
    }
    return inbound.trim();
  }
}
