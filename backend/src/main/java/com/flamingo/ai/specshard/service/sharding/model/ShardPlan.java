package com.flamingo.ai.specshard.service.sharding.model;

import java.util.List;

/**
 * Output of one sharding run.
 *
 * @param shards shards in document order, each with a token count
 * @param estimatedTokens sum of all shard token counts
 * @param recommendedOrder permutation of all shard ids respecting dependencies
 * @param crossReferences detected relationships between shards
 * @param analysis structural profile of the source document
 */
public record ShardPlan(
    List<Shard> shards,
    int estimatedTokens,
    List<String> recommendedOrder,
    List<CrossReference> crossReferences,
    ShardAnalysis analysis) {

  public ShardPlan {
    shards = List.copyOf(shards);
    recommendedOrder = List.copyOf(recommendedOrder);
    crossReferences = List.copyOf(crossReferences);
  }

  public static ShardPlan empty(ShardAnalysis analysis) {
    return new ShardPlan(List.of(), 0, List.of(), List.of(), analysis);
  }
}
