package com.flamingo.ai.specshard.service.sharding.merge;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.service.sharding.analysis.MarkdownOutline;
import com.flamingo.ai.specshard.service.sharding.model.MergeConflict;
import com.flamingo.ai.specshard.service.sharding.model.MergeConflictType;
import com.flamingo.ai.specshard.service.sharding.model.MergeResult;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reassembles shards into a single document.
 *
 * <p>Shards are concatenated in ascending priority with the configured delimiter. Missing parents
 * or dependencies make the result unsuccessful but the content is still produced. Duplicate
 * content and duplicate headings (levels 1 to 3, outside code blocks) are reported as conflicts
 * and never block the merge.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShardMerger {

  private static final int HEADER_PREVIEW_LENGTH = 50;

  private final ShardingConfig shardingConfig;

  public MergeResult merge(List<Shard> shards) {
    if (shards == null || shards.isEmpty()) {
      return new MergeResult("", true, List.of(), List.of());
    }

    List<Shard> sorted = new ArrayList<>(shards);
    sorted.sort(Comparator.comparingInt(Shard::getPriority));

    Set<String> present = new HashSet<>();
    for (Shard shard : sorted) {
      present.add(shard.getId());
    }

    Set<String> missing = new LinkedHashSet<>();
    for (Shard shard : sorted) {
      if (shard.getParentId() != null && !present.contains(shard.getParentId())) {
        missing.add(shard.getParentId());
      }
      if (shard.getDependencies() != null) {
        for (String dependency : shard.getDependencies()) {
          if (!present.contains(dependency)) {
            missing.add(dependency);
          }
        }
      }
    }

    List<String> contents = new ArrayList<>(sorted.size());
    for (Shard shard : sorted) {
      contents.add(shard.getContent() == null ? "" : shard.getContent());
    }
    String content = String.join(shardingConfig.getMerge().getDelimiter(), contents);

    List<MergeConflict> conflicts = new ArrayList<>();
    conflicts.addAll(duplicateContent(sorted));
    conflicts.addAll(duplicateHeaders(sorted));

    if (!missing.isEmpty()) {
      log.debug("Merge of {} shards is missing {}", sorted.size(), missing);
    }
    return new MergeResult(content, missing.isEmpty(), List.copyOf(missing), conflicts);
  }

  private List<MergeConflict> duplicateContent(List<Shard> shards) {
    Map<String, List<String>> idsByContent = new LinkedHashMap<>();
    for (Shard shard : shards) {
      String normalized =
          shard.getContent() == null ? "" : shard.getContent().strip().toLowerCase(Locale.ROOT);
      idsByContent.computeIfAbsent(normalized, k -> new ArrayList<>()).add(shard.getId());
    }

    int minLength = shardingConfig.getMerge().getMinDuplicateContentLength();
    List<MergeConflict> conflicts = new ArrayList<>();
    idsByContent.forEach(
        (normalized, ids) -> {
          if (ids.size() > 1 && normalized.length() > minLength) {
            conflicts.add(
                new MergeConflict(
                    MergeConflictType.DUPLICATE_CONTENT,
                    List.copyOf(ids),
                    "Duplicate content detected",
                    "Keep one copy and remove the others before merging"));
          }
        });
    return conflicts;
  }

  private static List<MergeConflict> duplicateHeaders(List<Shard> shards) {
    Map<String, Set<String>> idsByHeader = new LinkedHashMap<>();
    for (Shard shard : shards) {
      if (shard.getContent() == null) {
        continue;
      }
      MarkdownOutline outline = MarkdownOutline.parse(shard.getContent());
      for (MarkdownOutline.HeadingLine heading : outline.headings()) {
        if (heading.level() > 3) {
          continue;
        }
        String normalized =
            outline.lines().get(heading.line()).strip().toLowerCase(Locale.ROOT);
        idsByHeader.computeIfAbsent(normalized, k -> new LinkedHashSet<>()).add(shard.getId());
      }
    }

    List<MergeConflict> conflicts = new ArrayList<>();
    idsByHeader.forEach(
        (header, ids) -> {
          if (ids.size() > 1) {
            String preview =
                header.length() > HEADER_PREVIEW_LENGTH
                    ? header.substring(0, HEADER_PREVIEW_LENGTH)
                    : header;
            conflicts.add(
                new MergeConflict(
                    MergeConflictType.DUPLICATE_HEADER,
                    List.copyOf(ids),
                    "Duplicate header: \"" + preview + "...\"",
                    "Rename or combine the sections sharing this heading"));
          }
        });
    return conflicts;
  }
}
