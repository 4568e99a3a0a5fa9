package com.flamingo.ai.specshard.service.sharding.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a sharding call. On failure the plan is empty apart from its analysis.
 *
 * @param plan generated plan
 * @param success whether sharding completed
 * @param error failure message, {@code null} on success
 * @param durationMs wall-clock time spent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShardResult(ShardPlan plan, boolean success, String error, long durationMs) {}
