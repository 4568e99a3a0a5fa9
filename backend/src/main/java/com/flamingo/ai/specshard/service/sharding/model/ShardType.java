package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Kind of content held by a {@link Shard}. */
public enum ShardType {
  METADATA("metadata"),
  SECTION("section"),
  REQUIREMENT("requirement"),
  SCENARIO("scenario"),
  CHUNK("chunk");

  private final String value;

  ShardType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ShardType fromValue(String value) {
    return Arrays.stream(values())
        .filter(t -> t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown shard type: " + value));
  }
}
