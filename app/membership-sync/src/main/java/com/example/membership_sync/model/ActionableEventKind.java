package com.example.membership_sync.model;

public enum ActionableEventKind {
  SIGNED_UP,
  INVITED_TO_TENANT
}
