package com.example.membership_sync.service.dto;

public record VendorAuthRequest(String clientId, String secret) {

  @Override
  public String toString() {
    return "VendorAuthRequest[clientId=" + clientId + ", secret=***]";
  }
}
