package com.flamingo.ai.specshard.service.sharding;

import com.flamingo.ai.specshard.service.sharding.model.MergeResult;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardResult;
import java.util.List;

/**
 * Entry point of the sharding engine.
 *
 * <p>Splits large specification documents into budget-sized shards, works out how they relate and
 * in which order to process them, and reassembles them afterwards.
 */
public interface ShardingService {

  /**
   * Profiles a specification without sharding it.
   *
   * @param spec raw document text, may be blank
   * @return structural profile; never {@code null}
   */
  ShardAnalysis analyze(String spec);

  /**
   * Builds a shard plan.
   *
   * <p>Failures are reported in the result rather than thrown: {@code success} is {@code false},
   * {@code error} carries the message and the plan holds only the analysis.
   *
   * @param spec raw document text
   * @param options caller options; {@code null} means the configured defaults
   * @return result wrapping the plan
   */
  ShardResult shard(String spec, ShardOptions options);

  /**
   * Reassembles shards into a single document.
   *
   * @param shards shards of one plan, in any order
   * @return merged content with missing references and conflicts
   */
  MergeResult merge(List<Shard> shards);

  /** Estimated token cost of the given text. */
  int estimateTokens(String text);
}
