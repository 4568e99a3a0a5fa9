package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.service.sharding.analysis.MarkdownOutline;
import com.flamingo.ai.specshard.service.sharding.analysis.TokenEstimator;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits oversized shards into budget-sized {@link ShardType#CHUNK} shards.
 *
 * <p>Text is cut before level 1 to 3 headings first (never inside a fenced code block), then at
 * paragraph boundaries ({@code \n\n}), then at line breaks, and finally by character count.
 * Adjacent pieces are packed together while the estimated cost stays within the budget, so every
 * piece returned by {@link #pieces(String, int)} fits the budget.
 *
 * <p>All methods return new lists; input shards are never modified.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ShardSplitter {

  /** How far back from a hard cut to look for a newline or space. */
  private static final int BREAK_SEARCH_WINDOW = 100;

  private final TokenEstimator tokenEstimator;

  /**
   * Replaces every shard whose content exceeds {@code budget} with numbered chunk shards.
   *
   * <p>The first chunk inherits the original parent and dependencies, each later chunk depends on
   * its predecessor. References to a replaced shard are redirected to its first chunk, and
   * priorities are renumbered in document order.
   *
   * @param shards shards in document order
   * @param budget positive cost budget
   * @return shards that all fit the budget
   */
  public List<Shard> enforceBudget(List<Shard> shards, int budget) {
    List<Shard> result = new ArrayList<>();
    Map<String, String> replaced = new HashMap<>();

    for (Shard shard : shards) {
      if (tokenEstimator.estimate(shard.getContent()) <= budget) {
        result.add(shard);
        continue;
      }

      List<String> pieces = pieces(shard.getContent(), budget);
      log.debug("Splitting shard {} into {} chunks", shard.getId(), pieces.size());

      String previousId = null;
      for (int i = 0; i < pieces.size(); i++) {
        String chunkId = shard.getId() + "-chunk-" + ShardIds.index(i);
        result.add(
            Shard.builder()
                .id(chunkId)
                .type(ShardType.CHUNK)
                .content(pieces.get(i))
                .priority(shard.getPriority())
                .sectionName(shard.getSectionName())
                .parentId(shard.getParentId())
                .dependencies(previousId == null ? shard.getDependencies() : List.of(previousId))
                .build());
        previousId = chunkId;
      }
      replaced.put(shard.getId(), shard.getId() + "-chunk-" + ShardIds.index(0));
    }

    return renumber(remap(result, replaced));
  }

  /**
   * Cuts text into pieces that each fit the budget, preferring structural boundaries.
   *
   * @param text text to cut
   * @param budget positive cost budget
   * @return non-blank pieces in order, trailing whitespace removed
   */
  public List<String> pieces(String text, int budget) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    if (tokenEstimator.estimate(text) <= budget) {
      return List.of(text.stripTrailing());
    }

    List<String> units = splitBeforeHeadings(text);
    if (units.size() <= 1) {
      units = splitAfter(text, "(?<=\\n\\n)");
    }
    if (units.size() <= 1) {
      units = splitAfter(text, "(?<=\\n)");
    }
    if (units.size() <= 1) {
      return splitByChars(text, budget);
    }

    List<String> result = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String unit : units) {
      if (tokenEstimator.estimate(unit) > budget) {
        flush(current, result);
        result.addAll(pieces(unit, budget));
        continue;
      }
      if (current.length() > 0 && tokenEstimator.estimate(current + unit) > budget) {
        flush(current, result);
      }
      current.append(unit);
    }
    flush(current, result);
    return result;
  }

  private List<String> splitByChars(String text, int budget) {
    List<String> result = new ArrayList<>();
    int window = Math.max(1, budget * 3);
    int start = 0;

    while (start < text.length()) {
      int end = Math.min(text.length(), start + window);
      if (end < text.length()) {
        end = preferredBreak(text, start, end);
      }
      while (end - start > 1 && tokenEstimator.estimate(text.substring(start, end)) > budget) {
        int length = end - start;
        end = start + length - Math.max(1, length / 10);
      }
      String piece = text.substring(start, end);
      if (!piece.isBlank()) {
        result.add(piece.stripTrailing());
      }
      start = end;
    }
    return result;
  }

  private int preferredBreak(String text, int start, int end) {
    int searchStart = Math.max(start + 1, end - BREAK_SEARCH_WINDOW);
    int newline = text.lastIndexOf('\n', end - 1);
    if (newline >= searchStart) {
      return newline + 1;
    }
    int space = text.lastIndexOf(' ', end - 1);
    if (space >= searchStart) {
      return space + 1;
    }
    return end;
  }

  private static void flush(StringBuilder current, List<String> result) {
    if (current.length() > 0 && !current.toString().isBlank()) {
      result.add(current.toString().stripTrailing());
    }
    current.setLength(0);
  }

  /** Starts a new unit at every heading line; the units concatenate back to the text. */
  private static List<String> splitBeforeHeadings(String text) {
    MarkdownOutline outline = MarkdownOutline.parse(text);
    List<String> lines = outline.lines();
    List<String> units = new ArrayList<>();
    StringBuilder unit = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      int level = outline.headingLevel(i);
      if (level >= 1 && level <= 3 && unit.length() > 0) {
        units.add(unit.toString());
        unit.setLength(0);
      }
      unit.append(lines.get(i));
      if (i < lines.size() - 1) {
        unit.append('\n');
      }
    }
    if (unit.length() > 0) {
      units.add(unit.toString());
    }
    return units;
  }

  private static List<String> splitAfter(String text, String lookbehind) {
    return nonEmpty(text.split(lookbehind));
  }

  private static List<String> nonEmpty(String[] parts) {
    List<String> units = new ArrayList<>();
    for (String part : parts) {
      if (!part.isEmpty()) {
        units.add(part);
      }
    }
    return units;
  }

  /**
   * Rewrites ids, parent ids and dependencies through {@code renames}. Self references created by
   * the rewrite are dropped and dependencies are deduplicated.
   */
  public static List<Shard> remap(List<Shard> shards, Map<String, String> renames) {
    if (renames.isEmpty()) {
      return shards;
    }
    List<Shard> result = new ArrayList<>(shards.size());
    for (Shard shard : shards) {
      String id = renames.getOrDefault(shard.getId(), shard.getId());
      String parentId =
          shard.getParentId() == null
              ? null
              : renames.getOrDefault(shard.getParentId(), shard.getParentId());
      if (id.equals(parentId)) {
        parentId = null;
      }
      Set<String> dependencies = new LinkedHashSet<>();
      for (String dependency : shard.getDependencies()) {
        String target = renames.getOrDefault(dependency, dependency);
        if (!target.equals(id)) {
          dependencies.add(target);
        }
      }
      result.add(
          shard.toBuilder()
              .id(id)
              .parentId(parentId)
              .dependencies(List.copyOf(dependencies))
              .build());
    }
    return result;
  }

  /** Assigns priorities 0..n-1 in list order so that priority order equals document order. */
  public static List<Shard> renumber(List<Shard> shards) {
    List<Shard> result = new ArrayList<>(shards.size());
    for (int i = 0; i < shards.size(); i++) {
      Shard shard = shards.get(i);
      result.add(shard.getPriority() == i ? shard : shard.toBuilder().priority(i).build());
    }
    return result;
  }
}
