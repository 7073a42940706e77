package com.example.membership_sync.model;

public record Tenant(String id, String name) {

  public Tenant {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("tenant id is required");
    }
    name = name == null ? "" : name;
  }
}
