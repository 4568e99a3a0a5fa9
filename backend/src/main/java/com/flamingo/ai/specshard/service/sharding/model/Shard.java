package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * A self-contained fragment of a specification document.
 *
 * <p>Shards are immutable. Strategies produce them without a token count; the sharding service
 * attaches one with {@link #withTokenCount(Integer)} before a plan is returned.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Shard {

  /** Plan-local identifier, safe for file names and pattern scans. */
  String id;

  ShardType type;

  String content;

  /** Estimated cost; {@code null} until estimation runs. */
  @With Integer tokenCount;

  /** Lower values are processed and merged first. */
  int priority;

  String sectionName;

  /** Owning shard; the parent always precedes the child in the processing order. */
  String parentId;

  @Builder.Default List<String> dependencies = List.of();
}
