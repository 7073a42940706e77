package com.example.membership_sync.api.response;

public record WebhookResponse(String outcome, String message) {}
