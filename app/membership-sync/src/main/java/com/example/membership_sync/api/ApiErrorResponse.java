package com.example.membership_sync.api;

public record ApiErrorResponse(String code, String message) {}
