package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import java.util.List;

/**
 * One decomposition algorithm turning a specification into {@link Shard}s.
 *
 * <p>Implementations are stateless and safe for concurrent use. They never set token counts; the
 * caller estimates costs once the final shard list is known. {@link
 * com.flamingo.ai.specshard.service.sharding.ShardingServiceImpl} reaches implementations only
 * through {@link ShardingStrategyRouter}.
 */
public interface ShardingStrategy {

  /**
   * Splits the specification.
   *
   * @param spec non-blank document text
   * @param options caller options
   * @return non-empty list of shards in document order
   */
  List<Shard> shard(String spec, ShardOptions options);

  /**
   * Splits the specification reusing an analysis computed by the caller. Strategies that do not
   * need the profile ignore it.
   */
  default List<Shard> shard(String spec, ShardOptions options, ShardAnalysis analysis) {
    return shard(spec, options);
  }

  /** Strategy this implementation handles. */
  ShardStrategyType type();
}
