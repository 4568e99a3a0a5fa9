package com.flamingo.ai.specshard.api.rest;

import com.flamingo.ai.specshard.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.specshard.api.dto.request.MergeRequest;
import com.flamingo.ai.specshard.api.dto.request.ShardRequest;
import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.exception.ShardingException;
import com.flamingo.ai.specshard.service.export.ShardExport;
import com.flamingo.ai.specshard.service.export.ShardExportService;
import com.flamingo.ai.specshard.service.export.ShardPlanSummaryRenderer;
import com.flamingo.ai.specshard.service.sharding.ShardingService;
import com.flamingo.ai.specshard.service.sharding.model.MergeResult;
import com.flamingo.ai.specshard.service.sharding.model.ShardAnalysis;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for analyzing, sharding and merging specifications. */
@RestController
@RequestMapping("/api/shards")
@RequiredArgsConstructor
@Slf4j
public class ShardController {

  private final ShardingService shardingService;
  private final ShardExportService shardExportService;
  private final ShardPlanSummaryRenderer summaryRenderer;
  private final ShardingConfig shardingConfig;

  /**
   * Profiles a specification and recommends a strategy.
   *
   * @param request the spec text
   * @return the structural analysis
   */
  @PostMapping("/analyze")
  public ResponseEntity<ShardAnalysis> analyze(@Valid @RequestBody AnalyzeRequest request) {
    return ResponseEntity.ok(shardingService.analyze(request.getSpec()));
  }

  /**
   * Builds a shard plan.
   *
   * @param request spec text and options
   * @return 200 with the result, or 422 with the failed result
   */
  @PostMapping("/plan")
  public ResponseEntity<ShardResult> plan(@Valid @RequestBody ShardRequest request) {
    ShardResult result = shardingService.shard(request.getSpec(), toOptions(request));
    if (!result.success()) {
      return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(result);
    }
    return ResponseEntity.ok(result);
  }

  /**
   * Reassembles shards into one document. Missing parents or dependencies are reported in the
   * result rather than rejected.
   *
   * @param request shards to merge, in any order
   * @return merged content with missing ids and conflicts
   */
  @PostMapping("/merge")
  public ResponseEntity<MergeResult> merge(@Valid @RequestBody MergeRequest request) {
    return ResponseEntity.ok(shardingService.merge(request.getShards()));
  }

  /**
   * Builds a plan and renders it as shard files plus a JSON plan summary.
   *
   * @param request spec text, options and optional base name
   * @return the exported files
   */
  @PostMapping("/export")
  public ResponseEntity<ShardExport> export(@Valid @RequestBody ShardRequest request) {
    ShardOptions options = toOptions(request);
    ShardResult result = requireSuccess(shardingService.shard(request.getSpec(), options));
    log.info("Exporting {} shards for '{}'", result.plan().shards().size(), request.getBaseName());
    return ResponseEntity.ok(
        shardExportService.export(result.plan(), request.getBaseName(), options.includeMetadata()));
  }

  /**
   * Builds a plan and returns its human-readable summary.
   *
   * @param request spec text and options
   * @return plain-text summary
   */
  @PostMapping(value = "/summary", produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> summary(@Valid @RequestBody ShardRequest request) {
    ShardResult result =
        requireSuccess(shardingService.shard(request.getSpec(), toOptions(request)));
    return ResponseEntity.ok(summaryRenderer.render(result.plan()));
  }

  private ShardOptions toOptions(ShardRequest request) {
    ShardingConfig.Defaults defaults = shardingConfig.getDefaults();
    return new ShardOptions(
        request.getStrategy() != null ? request.getStrategy() : defaults.getStrategy(),
        request.getMaxTokensPerShard() != null
            ? request.getMaxTokensPerShard()
            : defaults.getMaxTokensPerShard(),
        request.getPreserveContext() != null
            ? request.getPreserveContext()
            : defaults.isPreserveContext(),
        request.getIncludeMetadata() != null
            ? request.getIncludeMetadata()
            : defaults.isIncludeMetadata());
  }

  private static ShardResult requireSuccess(ShardResult result) {
    if (!result.success()) {
      throw new ShardingException("Sharding failed: " + result.error(), result.error());
    }
    return result;
  }
}
