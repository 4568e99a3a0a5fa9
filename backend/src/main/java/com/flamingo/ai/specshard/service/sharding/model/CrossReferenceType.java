package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Relationship kind of a {@link CrossReference}; only {@link #DEPENDS_ON} constrains ordering. */
public enum CrossReferenceType {
  REFERENCES("references"),
  DEPENDS_ON("depends-on");

  private final String value;

  CrossReferenceType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
