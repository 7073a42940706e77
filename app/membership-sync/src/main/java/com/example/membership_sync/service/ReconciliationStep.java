package com.example.membership_sync.service;

public enum ReconciliationStep {
  ADD_TO_TARGET_TENANT,
  REMOVE_FROM_SOURCE_TENANT,
  DISABLE_IN_TARGET_TENANT
}
