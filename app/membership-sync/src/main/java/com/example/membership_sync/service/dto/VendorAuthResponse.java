package com.example.membership_sync.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VendorAuthResponse(String token, Long expiresIn) {

  @Override
  public String toString() {
    return "VendorAuthResponse[token=***, expiresIn=" + expiresIn + "]";
  }
}
