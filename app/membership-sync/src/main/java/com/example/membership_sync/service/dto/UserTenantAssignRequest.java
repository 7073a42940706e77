package com.example.membership_sync.service.dto;

public record UserTenantAssignRequest(String tenantId, boolean skipInviteEmail) {}
