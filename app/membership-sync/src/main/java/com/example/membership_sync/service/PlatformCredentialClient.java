/*
 * どこで: Membership-Sync サービス層
 * 何を: クライアント ID/シークレットをプラットフォームのベンダートークンへ交換する
 * なぜ: 管理 API 呼び出しに必要なサービス間認証情報を取得するため
 */
package com.example.membership_sync.service;

import com.example.membership_sync.config.PlatformClientProperties;
import com.example.membership_sync.service.dto.VendorAuthRequest;
import com.example.membership_sync.service.dto.VendorAuthResponse;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class PlatformCredentialClient {

  private static final Logger logger = LoggerFactory.getLogger(PlatformCredentialClient.class);

  private final RestClient platformRestClient;
  private final PlatformClientProperties properties;
  private final PlatformCallExecutor callExecutor;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public PlatformCredentialClient(
      RestClient platformRestClient,
      PlatformClientProperties properties,
      PlatformCallExecutor callExecutor) {
    this.platformRestClient = platformRestClient;
    this.properties = properties;
    this.callExecutor = callExecutor;
  }

  public VendorAuthResponse exchange() {
    if (!properties.hasCredentials()) {
      throw new SyncConfigurationException("platform client credentials are not configured");
    }
    final VendorAuthResponse response;
    try {
      response =
          callExecutor.query(
              PlatformOperation.VENDOR_AUTHENTICATE,
              () ->
                  platformRestClient
                      .post()
                      .uri(properties.vendorAuthPath())
                      .body(new VendorAuthRequest(properties.clientId(), properties.secret()))
                      .retrieve()
                      .body(VendorAuthResponse.class));
    } catch (PlatformIntegrationException ex) {
      if (ex.getCause() instanceof RestClientResponseException responseException) {
        // 資格情報の拒否は再試行しても回復しないため設定エラーとして扱う
        throw new SyncConfigurationException(
            "vendor credential exchange rejected with status "
                + responseException.getStatusCode().value(),
            ex);
      }
      throw ex;
    }
    if (response == null || response.token() == null || response.token().isBlank()) {
      logger.error("vendor credential exchange returned no token");
      throw new SyncConfigurationException("vendor credential exchange returned no token");
    }
    return response;
  }
}
