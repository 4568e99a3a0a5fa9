package com.flamingo.ai.specshard.service.sharding.model;

/**
 * Caller-supplied options for one sharding run.
 *
 * @param strategy decomposition algorithm; {@link ShardStrategyType#AUTO} picks one by profile
 * @param maxTokensPerShard cost budget per shard, must be positive
 * @param preserveContext link shards to the preamble and keep surrounding notes
 * @param includeMetadata prefix exported shard files with a metadata header
 */
public record ShardOptions(
    ShardStrategyType strategy,
    int maxTokensPerShard,
    boolean preserveContext,
    boolean includeMetadata) {

  public ShardOptions withStrategy(ShardStrategyType newStrategy) {
    return new ShardOptions(newStrategy, maxTokensPerShard, preserveContext, includeMetadata);
  }
}
