package com.flamingo.ai.specshard.service.sharding.strategy;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.service.sharding.analysis.MarkdownOutline;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ShardingStrategy} that cuts the document at second-level ({@code ##}) headings. Heading
 * lines inside fenced code blocks stay part of their section.
 *
 * <p>Text before the first heading becomes a {@link ShardType#METADATA} shard that every section
 * points to as its parent. Sections larger than the budget are handed to {@link ShardSplitter}.
 * A document without headings yields a single whole-document shard.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SectionShardingStrategy implements ShardingStrategy {

  static final String HEADER_ID = "section-00-header";
  static final String FULL_ID = "section-00-full";

  private final ShardSplitter shardSplitter;
  private final ShardingConfig shardingConfig;

  @Override
  public List<Shard> shard(String spec, ShardOptions options) {
    List<String> preamble = new ArrayList<>();
    List<SectionBlock> sections = new ArrayList<>();
    SectionBlock current = null;

    MarkdownOutline outline = MarkdownOutline.parse(spec);
    List<String> lines = outline.lines();
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      MarkdownOutline.HeadingLine heading = outline.headingAt(i);
      if (heading != null && heading.level() == 2) {
        current = new SectionBlock(heading.title());
        sections.add(current);
      }
      if (current != null) {
        current.lines.add(line);
      } else {
        preamble.add(line);
      }
    }

    if (sections.isEmpty()) {
      Shard whole =
          Shard.builder().id(FULL_ID).type(ShardType.SECTION).content(spec).priority(0).build();
      return shardSplitter.enforceBudget(List.of(whole), options.maxTokensPerShard());
    }

    List<Shard> shards = new ArrayList<>();
    String preambleText = String.join("\n", preamble).strip();
    String headerId = null;
    if (!preambleText.isEmpty()) {
      headerId = HEADER_ID;
      shards.add(
          Shard.builder()
              .id(HEADER_ID)
              .type(ShardType.METADATA)
              .content(preambleText)
              .priority(0)
              .sectionName("Header")
              .build());
    }

    Set<String> usedIds = new HashSet<>();
    usedIds.add(HEADER_ID);
    int slugLength = shardingConfig.getIds().getMaxSlugLength();
    for (int i = 0; i < sections.size(); i++) {
      SectionBlock section = sections.get(i);
      String id =
          ShardIds.unique(
              "section-" + ShardIds.index(i + 1) + "-" + ShardIds.slug(section.name, slugLength),
              usedIds);
      shards.add(
          Shard.builder()
              .id(id)
              .type(ShardType.SECTION)
              .content(String.join("\n", section.lines).stripTrailing())
              .priority(i + 1)
              .sectionName(section.name)
              .parentId(headerId)
              .dependencies(
                  options.preserveContext() && headerId != null ? List.of(headerId) : List.of())
              .build());
    }

    log.debug("Section strategy found {} sections (preamble: {})", sections.size(), headerId);
    return shardSplitter.enforceBudget(shards, options.maxTokensPerShard());
  }

  @Override
  public ShardStrategyType type() {
    return ShardStrategyType.BY_SECTION;
  }

  private static final class SectionBlock {
    private final String name;
    private final List<String> lines = new ArrayList<>();

    private SectionBlock(String name) {
      this.name = name;
    }
  }
}
