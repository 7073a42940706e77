package com.example.membership_sync.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TenantResponse(String tenantId, String name) {}
