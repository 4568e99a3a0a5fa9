package com.flamingo.ai.specshard.service.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.time.Instant;
import java.util.List;

/** JSON document written next to the exported shard files. Shard contents are left out. */
public record PlanSummary(String specName, Instant generatedAt, Plan plan) {

  public record Plan(
      List<ShardSummary> shards,
      int estimatedTokens,
      List<String> recommendedOrder,
      List<CrossReference> crossReferences,
      ShardAnalysis analysis) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record ShardSummary(
      String id, ShardType type, Integer tokenCount, int priority, String sectionName) {}
}
