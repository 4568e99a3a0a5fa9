package com.flamingo.ai.specshard.config;

import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the sharding engine. */
@Configuration
@ConfigurationProperties(prefix = "sharding")
@Getter
@Setter
public class ShardingConfig {

  private Defaults defaults = new Defaults();
  private Estimation estimation = new Estimation();
  private Analysis analysis = new Analysis();
  private Auto auto = new Auto();
  private Ids ids = new Ids();
  private Merge merge = new Merge();

  /** Options applied when a request leaves a field unset. */
  @Getter
  @Setter
  public static class Defaults {
    private ShardStrategyType strategy = ShardStrategyType.AUTO;
    private int maxTokensPerShard = 2000;
    private boolean preserveContext = true;
    private boolean includeMetadata = true;

    public ShardOptions toOptions() {
      return new ShardOptions(strategy, maxTokensPerShard, preserveContext, includeMetadata);
    }
  }

  @Getter
  @Setter
  public static class Estimation {
    private double proseCharsPerToken = 4.0;

    /** Fenced code is denser than prose. */
    private double codeCharsPerToken = 3.5;
  }

  /**
   * Thresholds and weights used by the structural analyzer.
   *
   * <p>The defaults are hand-tuned; they are exposed here so deployments can adjust them without
   * touching the recommendation logic.
   */
  @Getter
  @Setter
  public static class Analysis {
    private int scenarioThreshold = 10;
    private int requirementThreshold = 15;
    private int sectionThreshold = 3;

    /** Above both of these the recommendation is forced to {@code auto}. */
    private int autoComplexityThreshold = 70;

    private int autoTokenThreshold = 4000;

    private int sectionWeight = 5;
    private int sectionCap = 30;
    private int requirementWeight = 3;
    private int requirementCap = 30;
    private int scenarioWeight = 2;
    private int scenarioCap = 20;
    private int linesPerPoint = 10;
    private int lengthCap = 20;
  }

  /** Delegation rules for the automatic strategy when the analyzer has no firm opinion. */
  @Getter
  @Setter
  public static class Auto {
    private int scenarioThreshold = 5;
    private int requirementThreshold = 10;
    private int sectionThreshold = 1;

    /** Shards below this fraction of the budget are coalesced with their neighbours. */
    private double tinyShardRatio = 0.1;

    private boolean mergeTinyShards = true;
  }

  @Getter
  @Setter
  public static class Ids {
    private int maxLength = 200;
    private int maxSlugLength = 30;

    /** Explicit requirement ids longer than this are replaced by a generated sequence id. */
    private int maxExplicitIdLength = 40;
  }

  @Getter
  @Setter
  public static class Merge {
    private String delimiter = "\n\n---\n\n";

    /** Normalized content must be longer than this to be reported as duplicate content. */
    private int minDuplicateContentLength = 100;
  }
}
