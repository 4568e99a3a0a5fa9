package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecAnalyzer;
import com.flamingo.ai.specshard.service.sharding.analysis.TokenEstimator;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ShardingStrategy} that picks a decomposition from the document profile and guarantees
 * that no shard exceeds the budget.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>documents that fit the budget become a single {@code auto-00-full} shard
 *   <li>otherwise a concrete strategy is chosen (analyzer recommendation first, then the
 *       {@code sharding.auto.*} thresholds, then plain paragraph chunking)
 *   <li>oversized shards are split by {@link ShardSplitter}
 *   <li>runs of tiny shards are coalesced while they still fit together
 *   <li>ids get the {@code auto-} prefix and priorities are renumbered
 * </ol>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoShardingStrategy implements ShardingStrategy {

  static final String ID_PREFIX = "auto-";
  static final String FULL_ID = "auto-00-full";

  private final SpecAnalyzer specAnalyzer;
  private final TokenEstimator tokenEstimator;
  private final ShardSplitter shardSplitter;
  private final ShardingConfig shardingConfig;
  private final SectionShardingStrategy sectionStrategy;
  private final RequirementShardingStrategy requirementStrategy;
  private final ScenarioShardingStrategy scenarioStrategy;

  @Override
  public List<Shard> shard(String spec, ShardOptions options) {
    return shard(spec, options, specAnalyzer.analyze(spec));
  }

  @Override
  public List<Shard> shard(String spec, ShardOptions options, ShardAnalysis analysis) {
    int budget = options.maxTokensPerShard();
    int totalTokens = analysis != null ? analysis.totalTokens() : tokenEstimator.estimate(spec);

    if (totalTokens <= budget) {
      log.debug("Spec fits in one shard ({} <= {} tokens)", totalTokens, budget);
      return List.of(
          Shard.builder().id(FULL_ID).type(ShardType.SECTION).content(spec).priority(0).build());
    }

    ShardingStrategy delegate = chooseDelegate(analysis);
    List<Shard> shards;
    if (delegate != null) {
      log.debug("Auto strategy delegating to {}", delegate.type());
      shards = delegate.shard(spec, options);
    } else {
      log.debug("Auto strategy falling back to paragraph chunking");
      shards = chunkByParagraphs(spec, budget);
    }

    shards = shardSplitter.enforceBudget(shards, budget);
    if (shardingConfig.getAuto().isMergeTinyShards()) {
      shards = coalesceTinyShards(shards, budget);
    }
    shards = ShardSplitter.renumber(prefixIds(shards));

    for (Shard shard : shards) {
      int cost = tokenEstimator.estimate(shard.getContent());
      if (cost > budget) {
        throw new IllegalStateException(
            "Shard " + shard.getId() + " exceeds budget: " + cost + " > " + budget);
      }
    }
    return shards;
  }

  @Override
  public ShardStrategyType type() {
    return ShardStrategyType.AUTO;
  }

  private ShardingStrategy chooseDelegate(ShardAnalysis analysis) {
    if (analysis == null) {
      return null;
    }
    ShardingStrategy recommended =
        switch (analysis.recommendedStrategy()) {
          case BY_SECTION -> sectionStrategy;
          case BY_REQUIREMENT -> requirementStrategy;
          case BY_SCENARIO -> scenarioStrategy;
          case AUTO -> null;
        };
    if (recommended != null) {
      return recommended;
    }

    ShardingConfig.Auto thresholds = shardingConfig.getAuto();
    if (analysis.scenarioCount() > analysis.requirementCount()
        && analysis.scenarioCount() > thresholds.getScenarioThreshold()) {
      return scenarioStrategy;
    }
    if (analysis.requirementCount() > thresholds.getRequirementThreshold()) {
      return requirementStrategy;
    }
    if (analysis.sectionCount() >= thresholds.getSectionThreshold()) {
      return sectionStrategy;
    }
    return null;
  }

  private List<Shard> chunkByParagraphs(String spec, int budget) {
    List<String> pieces = shardSplitter.pieces(spec, budget);
    List<Shard> shards = new ArrayList<>(pieces.size());
    for (int i = 0; i < pieces.size(); i++) {
      shards.add(
          Shard.builder()
              .id("chunk-" + ShardIds.index(i))
              .type(ShardType.CHUNK)
              .content(pieces.get(i))
              .priority(i)
              .build());
    }
    return shards;
  }

  /**
   * Joins consecutive non-metadata shards below the tiny threshold into one shard, as long as the
   * joined content still fits the budget. References to absorbed shards move to the merged one.
   */
  List<Shard> coalesceTinyShards(List<Shard> shards, int budget) {
    double tinyLimit = budget * shardingConfig.getAuto().getTinyShardRatio();
    List<Shard> result = new ArrayList<>();
    Map<String, String> renames = new HashMap<>();
    List<Shard> group = new ArrayList<>();

    for (Shard shard : shards) {
      boolean tiny =
          shard.getType() != ShardType.METADATA
              && tokenEstimator.estimate(shard.getContent()) < tinyLimit;
      if (!tiny) {
        flushGroup(group, result, renames);
        result.add(shard);
        continue;
      }
      if (!group.isEmpty()
          && tokenEstimator.estimate(joined(group) + "\n\n" + shard.getContent()) > budget) {
        flushGroup(group, result, renames);
      }
      group.add(shard);
    }
    flushGroup(group, result, renames);

    if (!renames.isEmpty()) {
      log.debug("Coalesced {} tiny shards", renames.size());
    }
    return ShardSplitter.remap(result, renames);
  }

  private static void flushGroup(
      List<Shard> group, List<Shard> result, Map<String, String> renames) {
    if (group.isEmpty()) {
      return;
    }
    if (group.size() == 1) {
      result.add(group.get(0));
      group.clear();
      return;
    }

    Shard first = group.get(0);
    String mergedId = first.getId() + "-merged";
    Set<String> members = new HashSet<>();
    for (Shard member : group) {
      members.add(member.getId());
      renames.put(member.getId(), mergedId);
    }
    Set<String> dependencies = new LinkedHashSet<>();
    for (Shard member : group) {
      for (String dependency : member.getDependencies()) {
        if (!members.contains(dependency)) {
          dependencies.add(dependency);
        }
      }
    }

    result.add(
        first.toBuilder()
            .id(mergedId)
            .content(joined(group))
            .parentId(members.contains(first.getParentId()) ? null : first.getParentId())
            .dependencies(List.copyOf(dependencies))
            .build());
    group.clear();
  }

  private static String joined(List<Shard> group) {
    List<String> contents = new ArrayList<>(group.size());
    for (Shard shard : group) {
      contents.add(shard.getContent());
    }
    return String.join("\n\n", contents);
  }

  private static List<Shard> prefixIds(List<Shard> shards) {
    Map<String, String> renames = new HashMap<>();
    for (Shard shard : shards) {
      if (!shard.getId().startsWith(ID_PREFIX)) {
        renames.put(shard.getId(), ID_PREFIX + shard.getId());
      }
    }
    return ShardSplitter.remap(shards, renames);
  }
}
