package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Directed edge between two shards. For {@link CrossReferenceType#DEPENDS_ON}, {@code from}
 * depends on {@code to}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CrossReference(String from, String to, CrossReferenceType type, String description) {}
