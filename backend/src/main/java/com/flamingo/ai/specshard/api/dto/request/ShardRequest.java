package com.flamingo.ai.specshard.api.dto.request;

import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for building, exporting or summarizing a shard plan.
 *
 * <p>Option fields left {@code null} fall back to {@code sharding.defaults.*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShardRequest {

  @NotBlank(message = "Spec is required")
  private String spec;

  private ShardStrategyType strategy;

  @Positive(message = "maxTokensPerShard must be positive")
  private Integer maxTokensPerShard;

  private Boolean preserveContext;

  private Boolean includeMetadata;

  /** File name prefix for exports, typically the spec file name. */
  private String baseName;
}
