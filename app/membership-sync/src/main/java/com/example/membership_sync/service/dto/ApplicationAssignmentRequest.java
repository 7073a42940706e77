package com.example.membership_sync.service.dto;

public record ApplicationAssignmentRequest(String tenantId) {}
