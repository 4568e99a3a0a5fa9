package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MergeConflictType {
  DUPLICATE_CONTENT("duplicate-content"),
  DUPLICATE_HEADER("duplicate-header");

  private final String value;

  MergeConflictType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
