package com.flamingo.ai.specshard.api.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for profiling a specification. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  /** Document text; blank text yields an empty profile. */
  @NotNull(message = "Spec is required")
  private String spec;
}
