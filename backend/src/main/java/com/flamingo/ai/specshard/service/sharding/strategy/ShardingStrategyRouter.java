package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/** Routes a {@link ShardStrategyType} to the {@link ShardingStrategy} bean that handles it. */
@Service
@RequiredArgsConstructor
public class ShardingStrategyRouter {

  private final List<ShardingStrategy> strategies;

  /**
   * Returns the strategy for the given type.
   *
   * @throws IllegalStateException if no strategy is registered for the type
   */
  public ShardingStrategy route(ShardStrategyType type) {
    return strategies.stream()
        .filter(s -> s.type() == type)
        .findFirst()
        .orElseThrow(
            () -> new IllegalStateException("No ShardingStrategy found for strategy: " + type));
  }
}
