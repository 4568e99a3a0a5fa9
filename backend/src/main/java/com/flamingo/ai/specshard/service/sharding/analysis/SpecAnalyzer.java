package com.flamingo.ai.specshard.service.sharding.analysis;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Profiles a specification and recommends a sharding strategy.
 *
 * <p>Counts are purely structural: second-level headings, requirement bullets and scenario
 * introducers. Lines inside fenced code blocks are not counted. The complexity score is a
 * weighted, capped sum of those counts plus document length. Analysis never fails; blank input
 * yields {@link ShardAnalysis#empty()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SpecAnalyzer {

  private final TokenEstimator tokenEstimator;
  private final ShardingConfig shardingConfig;

  /**
   * Analyzes the given specification.
   *
   * @param spec raw document text, may be {@code null}
   * @return immutable structural profile
   */
  public ShardAnalysis analyze(String spec) {
    if (spec == null || spec.isBlank()) {
      return ShardAnalysis.empty();
    }

    MarkdownOutline outline = MarkdownOutline.parse(spec);
    List<String> lines = outline.lines();
    int sectionCount = 0;
    int requirementCount = 0;
    int scenarioCount = 0;

    for (int i = 0; i < lines.size(); i++) {
      if (outline.isCode(i)) {
        continue;
      }
      String line = lines.get(i);
      if (outline.headingLevel(i) == 2) {
        sectionCount++;
      }
      if (SpecPatterns.isRequirementLine(line)) {
        requirementCount++;
      }
      // Only the introducer line is counted, not the steps below it.
      if (SpecPatterns.isScenarioStart(line)) {
        scenarioCount++;
      }
    }

    int totalLines = lines.size();
    int totalTokens = tokenEstimator.estimate(spec);
    int complexity = complexity(sectionCount, requirementCount, scenarioCount, totalLines);

    ShardingConfig.Analysis thresholds = shardingConfig.getAnalysis();
    ShardStrategyType recommended;
    String reason;

    if (scenarioCount > thresholds.getScenarioThreshold() && requirementCount < scenarioCount) {
      recommended = ShardStrategyType.BY_SCENARIO;
      reason =
          "High scenario count (" + scenarioCount + ") suggests scenario-based sharding";
    } else if (requirementCount > thresholds.getRequirementThreshold()) {
      recommended = ShardStrategyType.BY_REQUIREMENT;
      reason =
          "High requirement count ("
              + requirementCount
              + ") suggests requirement-based sharding";
    } else if (sectionCount >= thresholds.getSectionThreshold()) {
      recommended = ShardStrategyType.BY_SECTION;
      reason =
          "Clear section structure (" + sectionCount + " sections) suggests section-based sharding";
    } else {
      recommended = ShardStrategyType.AUTO;
      reason = "Mixed content structure suggests automatic sharding";
    }

    if (complexity > thresholds.getAutoComplexityThreshold()
        && totalTokens > thresholds.getAutoTokenThreshold()) {
      recommended = ShardStrategyType.AUTO;
      reason =
          "High complexity ("
              + complexity
              + ") and token count ("
              + totalTokens
              + ") suggest auto sharding";
    }

    log.debug(
        "Analyzed spec: {} lines, {} sections, {} requirements, {} scenarios, complexity={}, "
            + "recommended={}",
        totalLines,
        sectionCount,
        requirementCount,
        scenarioCount,
        complexity,
        recommended);

    return new ShardAnalysis(
        recommended,
        complexity,
        sectionCount,
        requirementCount,
        scenarioCount,
        totalLines,
        totalTokens,
        reason);
  }

  private int complexity(int sections, int requirements, int scenarios, int totalLines) {
    ShardingConfig.Analysis weights = shardingConfig.getAnalysis();
    double score = 0;
    score += Math.min(sections * weights.getSectionWeight(), weights.getSectionCap());
    score += Math.min(requirements * weights.getRequirementWeight(), weights.getRequirementCap());
    score += Math.min(scenarios * weights.getScenarioWeight(), weights.getScenarioCap());
    score += Math.min((double) totalLines / weights.getLinesPerPoint(), weights.getLengthCap());
    return (int) Math.max(0, Math.min(Math.round(score), 100));
  }
}
