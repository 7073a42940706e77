package com.example.membership_sync.service.dto;

public record TenantCreateRequest(String name) {}
