package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.service.sharding.analysis.MarkdownOutline;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecPatterns;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ShardingStrategy} producing one {@link ShardType#REQUIREMENT} shard per requirement line.
 *
 * <p>A requirement line is a bullet carrying an explicit {@code REQ-n} id, a {@code [P0]}–{@code
 * [P2]} tag, or an obligation keyword (MUST, SHOULD, MAY, REQUIRED, SHALL). Gherkin lines that
 * follow a requirement are nested into its shard as a scenario block; any other following lines
 * are kept as notes when context preservation is on. Lines inside fenced code blocks never start a
 * requirement or a scenario block.
 *
 * <p>Explicit ids longer than {@code sharding.ids.max-explicit-id-length} are replaced by a
 * generated {@code REQ-NNN} id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequirementShardingStrategy implements ShardingStrategy {

  static final String CONTEXT_ID = "req-00-context";
  static final String FULL_ID = "req-00-full";

  private static final String DEFAULT_PRIORITY = "P1";

  private final ShardingConfig shardingConfig;

  @Override
  public List<Shard> shard(String spec, ShardOptions options) {
    List<String> preamble = new ArrayList<>();
    List<RequirementBlock> requirements = new ArrayList<>();
    Set<String> usedIds = new HashSet<>();
    usedIds.add(CONTEXT_ID);
    RequirementBlock current = null;
    boolean inScenarios = false;
    int generated = 1;
    int maxExplicitLength = shardingConfig.getIds().getMaxExplicitIdLength();

    MarkdownOutline outline = MarkdownOutline.parse(spec);
    List<String> lines = outline.lines();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      boolean code = outline.isCode(i);
      Matcher explicit = SpecPatterns.EXPLICIT_REQUIREMENT.matcher(line);
      Matcher tagged = SpecPatterns.PRIORITY_REQUIREMENT.matcher(line);
      Matcher keyword = SpecPatterns.KEYWORD_REQUIREMENT.matcher(line);

      if (!code && explicit.matches()) {
        String token = explicit.group(1).toUpperCase(Locale.ROOT);
        String id =
            token.length() <= maxExplicitLength
                ? ShardIds.unique(token, usedIds)
                : ShardIds.unique("REQ-" + ShardIds.sequence(generated++), usedIds);
        String tag = SpecPatterns.priorityTag(explicit.group(2), DEFAULT_PRIORITY);
        current = new RequirementBlock(id, line, tag);
      } else if (!code && tagged.matches()) {
        String id = ShardIds.unique("REQ-" + ShardIds.sequence(generated++), usedIds);
        current = new RequirementBlock(id, line, tagged.group(1).toUpperCase(Locale.ROOT));
      } else if (!code && keyword.matches()) {
        String id = ShardIds.unique("REQ-" + ShardIds.sequence(generated++), usedIds);
        String tag = SpecPatterns.priorityTag(keyword.group(1), DEFAULT_PRIORITY);
        current = new RequirementBlock(id, line, tag);
      } else {
        if (current == null) {
          preamble.add(line);
        } else if ((!code && SpecPatterns.SCENARIO_STEP.matcher(line).find())
            || (inScenarios && !line.isBlank())) {
          current.scenarios.add(line);
          inScenarios = true;
        } else {
          current.notes.add(line);
          inScenarios = false;
        }
        continue;
      }
      requirements.add(current);
      inScenarios = false;
    }

    if (requirements.isEmpty()) {
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

    for (int i = 0; i < requirements.size(); i++) {
      RequirementBlock requirement = requirements.get(i);
      Set<String> dependencies = new LinkedHashSet<>();
      if (options.preserveContext() && contextId != null) {
        dependencies.add(contextId);
      }
      dependencies.addAll(earlierMentions(requirement, requirements.subList(0, i)));

      shards.add(
          Shard.builder()
              .id(requirement.id)
              .type(ShardType.REQUIREMENT)
              .content(render(requirement, options))
              .priority(i + 1)
              .sectionName(requirement.id)
              .parentId(contextId)
              .dependencies(List.copyOf(dependencies))
              .build());
    }

    log.debug("Requirement strategy extracted {} requirements", requirements.size());
    return shards;
  }

  @Override
  public ShardStrategyType type() {
    return ShardStrategyType.BY_REQUIREMENT;
  }

  private static List<String> earlierMentions(
      RequirementBlock requirement, List<RequirementBlock> earlier) {
    List<String> mentioned = new ArrayList<>();
    Matcher matcher = SpecPatterns.REQUIREMENT_ID.matcher(requirement.line);
    while (matcher.find()) {
      String token = matcher.group().toUpperCase(Locale.ROOT);
      for (RequirementBlock candidate : earlier) {
        if (candidate.id.equals(token)) {
          mentioned.add(candidate.id);
        }
      }
    }
    return mentioned;
  }

  private static String render(RequirementBlock requirement, ShardOptions options) {
    StringBuilder sb = new StringBuilder();
    sb.append("## Requirement: ").append(requirement.id).append('\n');
    sb.append("**Priority:** ").append(requirement.priorityTag).append("\n\n");
    sb.append(requirement.line.strip()).append('\n');

    if (!requirement.scenarios.isEmpty()) {
      sb.append("\n### Scenarios\n\n");
      sb.append(String.join("\n", requirement.scenarios).stripTrailing()).append('\n');
    }

    String notes = String.join("\n", requirement.notes).strip();
    if (options.preserveContext() && !notes.isEmpty()) {
      sb.append("\n### Notes\n\n").append(notes).append('\n');
    }
    return sb.toString().stripTrailing();
  }

  private static final class RequirementBlock {
    private final String id;
    private final String line;
    private final String priorityTag;
    private final List<String> scenarios = new ArrayList<>();
    private final List<String> notes = new ArrayList<>();

    private RequirementBlock(String id, String line, String priorityTag) {
      this.id = id;
      this.line = line;
      this.priorityTag = priorityTag;
    }
  }
}
