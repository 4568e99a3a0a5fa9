package com.flamingo.ai.specshard.api.dto.request;

import com.flamingo.ai.specshard.service.sharding.model.Shard;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for reassembling shards. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeRequest {

  @NotNull(message = "Shards are required")
  private List<Shard> shards;
}
