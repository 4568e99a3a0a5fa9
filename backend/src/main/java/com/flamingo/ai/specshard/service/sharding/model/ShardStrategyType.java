package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Decomposition algorithm requested by the caller or recommended by the analyzer. */
public enum ShardStrategyType {
  BY_SECTION("by-section"),
  BY_REQUIREMENT("by-requirement"),
  BY_SCENARIO("by-scenario"),
  AUTO("auto");

  private final String value;

  ShardStrategyType(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Parses the wire name ({@code by-section}) or the constant name ({@code BY_SECTION}).
   *
   * @throws IllegalArgumentException for anything else
   */
  @JsonCreator
  public static ShardStrategyType fromValue(String value) {
    return Arrays.stream(values())
        .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Invalid strategy \""
                        + value
                        + "\". Expected one of: by-section, by-requirement, by-scenario, auto"));
  }

  @Override
  public String toString() {
    return value;
  }
}
