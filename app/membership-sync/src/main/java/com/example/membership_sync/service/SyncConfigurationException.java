/*
 * どこで: Membership-Sync サービス層
 * 何を: 必須設定の欠落や認証情報の不備を示す例外
 * なぜ: 再配信では回復せず運用者の対応が必要な失敗を上流エラーと区別するため
 */
package com.example.membership_sync.service;

public class SyncConfigurationException extends RuntimeException {

  public SyncConfigurationException(String message) {
    super(message);
  }

  public SyncConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
