package com.flamingo.ai.specshard.service.export;

import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardPlan;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Plain-text report of a plan's analysis, shards, processing order and cross-references. */
@Component
public class ShardPlanSummaryRenderer {

  static final int MAX_LISTED_REFERENCES = 10;

  public String render(ShardPlan plan) {
    StringBuilder sb = new StringBuilder();
    renderAnalysis(plan.analysis(), sb);
    sb.append('\n');
    renderPlan(plan, sb);
    return sb.toString();
  }

  private static void renderAnalysis(ShardAnalysis analysis, StringBuilder sb) {
    sb.append("Spec Analysis\n\n");
    if (analysis == null) {
      sb.append("(not available)\n");
      return;
    }
    sb.append("Complexity: ").append(analysis.complexity()).append("/100\n");
    sb.append("Total Tokens: ").append(number(analysis.totalTokens())).append('\n');
    sb.append("Sections: ").append(analysis.sectionCount()).append('\n');
    sb.append("Requirements: ").append(analysis.requirementCount()).append('\n');
    sb.append("Scenarios: ").append(analysis.scenarioCount()).append('\n');
    sb.append("\nRecommended Strategy: ").append(analysis.recommendedStrategy()).append('\n');
    sb.append(analysis.recommendationReason()).append('\n');
  }

  private static void renderPlan(ShardPlan plan, StringBuilder sb) {
    sb.append("Shard Plan\n\n");
    sb.append("Total Shards: ").append(plan.shards().size()).append('\n');
    sb.append("Estimated Tokens: ").append(number(plan.estimatedTokens())).append('\n');
    if (!plan.crossReferences().isEmpty()) {
      sb.append("Cross-References: ").append(plan.crossReferences().size()).append('\n');
    }

    sb.append("\nShards:\n");
    for (Shard shard : plan.shards()) {
      int tokens = shard.getTokenCount() == null ? 0 : shard.getTokenCount();
      String type = shard.getType() == null ? "" : shard.getType().getValue();
      sb.append(
          String.format(Locale.ROOT, "  %-20s %-12s %6d tokens", shard.getId(), type, tokens));
      if (shard.getSectionName() != null) {
        sb.append(" - ").append(shard.getSectionName());
      }
      sb.append('\n');
      if (!shard.getDependencies().isEmpty()) {
        sb.append("    Dependencies: ")
            .append(String.join(", ", shard.getDependencies()))
            .append('\n');
      }
    }

    if (!plan.recommendedOrder().isEmpty()) {
      sb.append("\nRecommended Processing Order:\n  ")
          .append(String.join(" -> ", plan.recommendedOrder()))
          .append('\n');
    }

    if (!plan.crossReferences().isEmpty()) {
      sb.append("\nCross-References:\n");
      int listed = Math.min(MAX_LISTED_REFERENCES, plan.crossReferences().size());
      for (CrossReference reference : plan.crossReferences().subList(0, listed)) {
        sb.append("  ")
            .append(reference.from())
            .append(" -> ")
            .append(reference.to())
            .append(" (")
            .append(reference.type().getValue())
            .append(")\n");
      }
      int hidden = plan.crossReferences().size() - listed;
      if (hidden > 0) {
        sb.append("  ... and ").append(hidden).append(" more\n");
      }
    }
  }

  private static String number(int value) {
    return String.format(Locale.ROOT, "%,d", value);
  }
}
