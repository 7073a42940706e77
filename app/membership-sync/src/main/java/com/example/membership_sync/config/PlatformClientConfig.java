/*
 * どこで: Membership-Sync 設定
 * 何を: プラットフォーム管理 API 呼び出し専用 RestClient を提供する
 * なぜ: baseUrl と JSON ヘッダーの設定責務を呼び出し側から分離するため
 */
package com.example.membership_sync.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(PlatformClientProperties.class)
public class PlatformClientConfig {

  @Bean
  RestClient platformRestClient(RestClient.Builder builder, PlatformClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
        .build();
  }
}
