package com.flamingo.ai.specshard.service.sharding.model;

import java.util.List;

/** Informational warning raised while merging shards. */
public record MergeConflict(
    MergeConflictType type, List<String> shardIds, String description, String suggestion) {}
