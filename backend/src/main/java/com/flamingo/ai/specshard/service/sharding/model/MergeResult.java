package com.flamingo.ai.specshard.service.sharding.model;

import java.util.List;

/**
 * Reconstructed document.
 *
 * @param content shard contents joined in priority order
 * @param success {@code false} when a parent or dependency was not part of the input
 * @param missingShards ids referenced but absent, deduplicated
 * @param conflicts duplicate content and heading warnings; never affect {@code success}
 */
public record MergeResult(
    String content, boolean success, List<String> missingShards, List<MergeConflict> conflicts) {

  public MergeResult {
    missingShards = List.copyOf(missingShards);
    conflicts = List.copyOf(conflicts);
  }
}
