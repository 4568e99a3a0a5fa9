package com.flamingo.ai.specshard.service.sharding;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.exception.ShardingException;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecAnalyzer;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecPatterns;
import com.flamingo.ai.specshard.service.sharding.analysis.TokenEstimator;
import com.flamingo.ai.specshard.service.sharding.graph.CrossReferenceDetector;
import com.flamingo.ai.specshard.service.sharding.graph.ProcessingOrderScheduler;
import com.flamingo.ai.specshard.service.sharding.merge.ShardMerger;
import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.MergeResult;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardPlan;
import com.flamingo.ai.specshard.service.sharding.model.ShardResult;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.strategy.ShardingStrategyRouter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Default {@link ShardingService} wiring the analyzer, strategies, graph and merger together.
 * Incoming documents have their line endings normalised to {@code \n} before any processing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShardingServiceImpl implements ShardingService {

  private final SpecAnalyzer specAnalyzer;
  private final TokenEstimator tokenEstimator;
  private final ShardingStrategyRouter strategyRouter;
  private final CrossReferenceDetector crossReferenceDetector;
  private final ProcessingOrderScheduler processingOrderScheduler;
  private final ShardMerger shardMerger;
  private final ShardingConfig shardingConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public ShardAnalysis analyze(String spec) {
    return specAnalyzer.analyze(SpecPatterns.normalizeLineEndings(spec));
  }

  @Override
  @Timed(value = "sharding.plan", description = "Time to build a shard plan")
  public ShardResult shard(String rawSpec, ShardOptions options) {
    String spec = SpecPatterns.normalizeLineEndings(rawSpec);
    long start = System.currentTimeMillis();
    ShardOptions effective = options != null ? options : shardingConfig.getDefaults().toOptions();
    ShardStrategyType strategy =
        effective.strategy() != null
            ? effective.strategy()
            : shardingConfig.getDefaults().getStrategy();
    ShardAnalysis analysis = specAnalyzer.analyze(spec);

    try {
      if (spec == null || spec.isBlank()) {
        throw new ShardingException("Spec content is empty");
      }
      if (effective.maxTokensPerShard() <= 0) {
        throw new ShardingException(
            "maxTokensPerShard must be positive, got " + effective.maxTokensPerShard());
      }

      List<Shard> raw =
          strategyRouter.route(strategy).shard(spec, effective.withStrategy(strategy), analysis);
      if (raw.isEmpty()) {
        throw new ShardingException("Strategy " + strategy + " produced no shards");
      }

      List<Shard> shards = new ArrayList<>(raw.size());
      int estimatedTokens = 0;
      for (Shard shard : raw) {
        int tokens = tokenEstimator.estimate(shard.getContent());
        shards.add(shard.withTokenCount(tokens));
        estimatedTokens += tokens;
      }

      List<CrossReference> references = crossReferenceDetector.detect(shards);
      List<String> order = processingOrderScheduler.order(shards, references);
      ShardPlan plan = new ShardPlan(shards, estimatedTokens, order, references, analysis);

      long duration = System.currentTimeMillis() - start;
      meterRegistry
          .counter("sharding_plans_total", "strategy", strategy.getValue(), "outcome", "success")
          .increment();
      meterRegistry
          .counter("sharding_shards_total", "strategy", strategy.getValue())
          .increment(shards.size());
      log.info(
          "Sharded spec with {} strategy: {} shards, {} tokens, {} cross-references in {}ms",
          strategy,
          shards.size(),
          estimatedTokens,
          references.size(),
          duration);
      return new ShardResult(plan, true, null, duration);
    } catch (RuntimeException e) {
      long duration = System.currentTimeMillis() - start;
      meterRegistry
          .counter("sharding_plans_total", "strategy", strategy.getValue(), "outcome", "failure")
          .increment();
      log.warn("Sharding with {} strategy failed: {}", strategy, e.getMessage());
      return new ShardResult(ShardPlan.empty(analysis), false, e.getMessage(), duration);
    }
  }

  @Override
  @Timed(value = "sharding.merge", description = "Time to merge shards")
  public MergeResult merge(List<Shard> shards) {
    if (shards != null) {
      crossReferenceDetector.validateIds(shards);
    }
    MergeResult result = shardMerger.merge(shards);
    meterRegistry
        .counter("sharding_merges_total", "outcome", result.success() ? "success" : "incomplete")
        .increment();
    log.debug(
        "Merged {} shards: success={}, {} missing, {} conflicts",
        shards == null ? 0 : shards.size(),
        result.success(),
        result.missingShards().size(),
        result.conflicts().size());
    return result;
  }

  @Override
  public int estimateTokens(String text) {
    return tokenEstimator.estimate(text);
  }
}
