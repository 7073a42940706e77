package com.example.membership_sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "sync.webhook")
public record WebhookProperties(String path, String headerName, String secret) {

  public WebhookProperties {
    path = path == null || path.isBlank() ? "/webhooks/identity" : path;
    headerName = headerName == null || headerName.isBlank() ? "x-webhook-secret" : headerName;
    secret = secret == null ? "" : secret;
  }

  @Override
  public String toString() {
    return "WebhookProperties[path=" + path + ", headerName=" + headerName + "]";
  }
}
