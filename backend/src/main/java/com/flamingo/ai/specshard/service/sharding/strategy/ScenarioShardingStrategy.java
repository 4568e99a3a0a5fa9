package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.service.sharding.analysis.MarkdownOutline;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecPatterns;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ShardingStrategy} producing one {@link ShardType#SCENARIO} shard per scenario block.
 *
 * <p>A block runs from a {@code Scenario:} or {@code Example:} introducer up to the next one, so
 * the whole body (steps, tables, trailing notes) stays together. The requirement a scenario
 * relates to is taken from the first {@code REQ-n} inside the block, or else the last one seen
 * before it, and is only noted in the rendered content. Introducers inside fenced code blocks are
 * treated as body text.
 */
@Service
@Slf4j
public class ScenarioShardingStrategy implements ShardingStrategy {

  static final String CONTEXT_ID = "scenario-00-context";
  static final String FULL_ID = "scenario-00-full";

  @Override
  public List<Shard> shard(String spec, ShardOptions options) {
    List<String> preamble = new ArrayList<>();
    List<ScenarioBlock> scenarios = new ArrayList<>();
    ScenarioBlock current = null;
    String lastRequirement = null;

    MarkdownOutline outline = MarkdownOutline.parse(spec);
    List<String> lines = outline.lines();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      Matcher start = SpecPatterns.SCENARIO_START.matcher(line);
      if (!outline.isCode(i) && start.matches()) {
        current = new ScenarioBlock(start.group(1).trim(), lastRequirement);
        scenarios.add(current);
      }

      Matcher requirement = SpecPatterns.REQUIREMENT_ID.matcher(line);
      if (requirement.find()) {
        lastRequirement = requirement.group().toUpperCase(Locale.ROOT);
        if (current != null && current.ownRequirement == null) {
          current.ownRequirement = lastRequirement;
        }
      }

      if (current != null) {
        current.lines.add(line);
      } else {
        preamble.add(line);
      }
    }

    if (scenarios.isEmpty()) {
      return List.of(
          Shard.builder().id(FULL_ID).type(ShardType.SECTION).content(spec).priority(0).build());
    }

    List<Shard> shards = new ArrayList<>();
    String preambleText = String.join("\n", preamble).strip();
    String contextId = null;
    if (!preambleText.isEmpty()) {
      contextId = CONTEXT_ID;
      shards.add(
          Shard.builder()
              .id(CONTEXT_ID)
              .type(ShardType.METADATA)
              .content(preambleText)
              .priority(0)
              .sectionName("Context")
              .build());
    }

    for (int i = 0; i < scenarios.size(); i++) {
      ScenarioBlock scenario = scenarios.get(i);
      shards.add(
          Shard.builder()
              .id("SCN-" + ShardIds.sequence(i + 1))
              .type(ShardType.SCENARIO)
              .content(render(scenario))
              .priority(i + 1)
              .sectionName(scenario.name)
              .parentId(contextId)
              .dependencies(
                  options.preserveContext() && contextId != null ? List.of(contextId) : List.of())
              .build());
    }

    log.debug("Scenario strategy extracted {} scenarios", scenarios.size());
    return shards;
  }

  @Override
  public ShardStrategyType type() {
    return ShardStrategyType.BY_SCENARIO;
  }

  private static String render(ScenarioBlock scenario) {
    StringBuilder sb = new StringBuilder();
    String related = scenario.relatedRequirement();
    if (related != null) {
      sb.append("**Related Requirement:** ").append(related).append("\n\n");
    }
    sb.append("## Scenario: ").append(scenario.name).append("\n\n");
    sb.append(String.join("\n", scenario.lines).stripTrailing());
    return sb.toString();
  }

  private static final class ScenarioBlock {
    private final String name;
    private final String precedingRequirement;
    private final List<String> lines = new ArrayList<>();
    private String ownRequirement;

    private ScenarioBlock(String name, String precedingRequirement) {
      this.name = name;
      this.precedingRequirement = precedingRequirement;
    }

    private String relatedRequirement() {
      return ownRequirement != null ? ownRequirement : precedingRequirement;
    }
  }
}
