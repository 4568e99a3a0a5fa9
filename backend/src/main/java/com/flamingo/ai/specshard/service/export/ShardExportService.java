package com.flamingo.ai.specshard.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.specshard.exception.ShardingException;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardPlan;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Renders a shard plan as a set of markdown files plus a JSON plan summary.
 *
 * <p>Files are named {@code <base>-<shard id>.md} and {@code <base>-plan.json}. Nothing is written
 * to disk; callers decide where the files go.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShardExportService {

  static final String DEFAULT_BASE_NAME = "spec";

  private static final Pattern UNSAFE_FILE_CHARS = Pattern.compile("[^a-zA-Z0-9._-]+");
  private static final Pattern SPEC_EXTENSION =
      Pattern.compile("\\.(md|txt|spec)$", Pattern.CASE_INSENSITIVE);

  private final ObjectMapper objectMapper;

  /**
   * Exports the plan.
   *
   * @param plan plan to export
   * @param baseName file name prefix, usually the spec file name; blank means {@code spec}
   * @param includeMetadata prefix non-metadata shard files with an HTML comment header
   * @return files and summary
   * @throws ShardingException if the summary cannot be serialized
   */
  public ShardExport export(ShardPlan plan, String baseName, boolean includeMetadata) {
    String base = baseName(baseName);

    List<ShardFile> files = new ArrayList<>(plan.shards().size());
    for (Shard shard : plan.shards()) {
      String fileName = base + "-" + sanitize(shard.getId()) + ".md";
      String content = shard.getContent();
      if (includeMetadata
          && shard.getTokenCount() != null
          && shard.getType() != ShardType.METADATA) {
        content = metadataHeader(shard) + content;
      }
      files.add(new ShardFile(fileName, content));
    }

    String summaryFileName = base + "-plan.json";
    String summaryJson = toJson(summary(plan, base));
    log.debug("Exported {} shard files with base name '{}'", files.size(), base);
    return new ShardExport(files, summaryFileName, summaryJson);
  }

  static String baseName(String baseName) {
    if (baseName == null || baseName.isBlank()) {
      return DEFAULT_BASE_NAME;
    }
    String stripped = SPEC_EXTENSION.matcher(baseName.strip()).replaceFirst("");
    String sanitized = sanitize(stripped);
    return sanitized.isEmpty() ? DEFAULT_BASE_NAME : sanitized;
  }

  static String sanitize(String value) {
    return UNSAFE_FILE_CHARS.matcher(value).replaceAll("-");
  }

  private static String metadataHeader(Shard shard) {
    StringBuilder sb = new StringBuilder("<!--\n");
    sb.append("Shard: ").append(shard.getId()).append('\n');
    sb.append("Type: ").append(shard.getType().getValue()).append('\n');
    sb.append("Tokens: ").append(shard.getTokenCount()).append('\n');
    sb.append("Priority: ").append(shard.getPriority()).append('\n');
    if (shard.getSectionName() != null) {
      sb.append("Section: ").append(shard.getSectionName()).append('\n');
    }
    if (!shard.getDependencies().isEmpty()) {
      sb.append("Dependencies: ").append(String.join(", ", shard.getDependencies())).append('\n');
    }
    sb.append("-->\n\n");
    return sb.toString();
  }

  private static PlanSummary summary(ShardPlan plan, String base) {
    List<PlanSummary.ShardSummary> shards = new ArrayList<>(plan.shards().size());
    for (Shard shard : plan.shards()) {
      shards.add(
          new PlanSummary.ShardSummary(
              shard.getId(),
              shard.getType(),
              shard.getTokenCount(),
              shard.getPriority(),
              shard.getSectionName()));
    }
    return new PlanSummary(
        base,
        Instant.now(),
        new PlanSummary.Plan(
            shards,
            plan.estimatedTokens(),
            plan.recommendedOrder(),
            plan.crossReferences(),
            plan.analysis()));
  }

  private String toJson(PlanSummary summary) {
    try {
      return objectMapper
          .writer()
          .with(SerializationFeature.INDENT_OUTPUT)
          .without(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .writeValueAsString(summary);
    } catch (JsonProcessingException e) {
      throw new ShardingException("Failed to serialize plan summary", e);
    }
  }
}
