package com.flamingo.ai.specshard.service.export;

import java.util.List;

/**
 * Files produced from a shard plan.
 *
 * @param files one markdown file per shard, in plan order
 * @param planSummaryFileName name of the JSON summary file
 * @param planSummaryJson pretty-printed JSON summary of the plan
 */
public record ShardExport(
    List<ShardFile> files, String planSummaryFileName, String planSummaryJson) {

  public ShardExport {
    files = List.copyOf(files);
  }
}
