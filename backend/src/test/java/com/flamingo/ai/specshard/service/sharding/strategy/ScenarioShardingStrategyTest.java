package com.flamingo.ai.specshard.service.sharding.strategy;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardOptions;
import com.flamingo.ai.specshard.service.sharding.model.ShardStrategyType;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScenarioShardingStrategy Tests")
class ScenarioShardingStrategyTest {

  private static final String SPEC =
      String.join(
          "\n",
          "# Checkout",
          "",
          "REQ-7 covers payments.",
          "",
          "Scenario: Pay by card",
          "Given a cart",
          "Then payment succeeds",
          "",
          "Scenario: Refund for REQ-9",
          "Given an order",
          "Then a refund is issued");

  private final ScenarioShardingStrategy strategy = new ScenarioShardingStrategy();

  @Test
  @DisplayName("should emit one shard per scenario block with its full body")
  void shouldEmitScenarioShards_whenIntroducersPresent() {
    List<Shard> shards = strategy.shard(SPEC, options(true));

    assertThat(shards)
        .extracting(Shard::getId)
        .containsExactly("scenario-00-context", "SCN-001", "SCN-002");
    assertThat(shards.get(0).getType()).isEqualTo(ShardType.METADATA);
    assertThat(shards.get(1).getType()).isEqualTo(ShardType.SCENARIO);
    assertThat(shards.get(1).getSectionName()).isEqualTo("Pay by card");
    assertThat(shards.get(1).getContent()).contains("Given a cart", "Then payment succeeds");
    assertThat(shards.get(1).getDependencies()).containsExactly("scenario-00-context");
  }

  @Test
  @DisplayName("should note the preceding or contained requirement")
  void shouldNoteRelatedRequirement_whenRequirementNearby() {
    List<Shard> shards = strategy.shard(SPEC, options(true));

    assertThat(shards.get(1).getContent())
        .startsWith("**Related Requirement:** REQ-7\n\n## Scenario: Pay by card");
    assertThat(shards.get(2).getContent()).startsWith("**Related Requirement:** REQ-9");
  }

  @Test
  @DisplayName("should accept numbered example introducers")
  void shouldAcceptExampleIntroducer_whenNumbered() {
    List<Shard> shards =
        strategy.shard("Example 2: Guest checkout\nGiven no account", options(true));

    assertThat(shards).hasSize(1);
    assertThat(shards.get(0).getSectionName()).isEqualTo("Guest checkout");
    assertThat(shards.get(0).getContent()).doesNotContain("Related Requirement");
  }

  @Test
  @DisplayName("should not depend on the context shard without context preservation")
  void shouldNotDependOnContext_whenPreserveContextOff() {
    Shard scenario = strategy.shard(SPEC, options(false)).get(1);

    assertThat(scenario.getParentId()).isEqualTo("scenario-00-context");
    assertThat(scenario.getDependencies()).isEmpty();
  }

  @Test
  @DisplayName("should fall back to the whole document when no scenario is found")
  void shouldFallBack_whenNoScenarios() {
    List<Shard> shards = strategy.shard("No scenarios here.", options(true));

    assertThat(shards).extracting(Shard::getId).containsExactly("scenario-00-full");
  }

  @Test
  @DisplayName("should keep an introducer inside fenced code in the current block")
  void shouldNotStartBlock_whenIntroducerIsInsideCodeFence() {
    String spec =
        String.join(
            "\n",
            "Scenario: Import a feature file",
            "Given this file:",
            "```gherkin",
            "Scenario: nested example",
            "```",
            "Then it is stored");

    List<Shard> shards = strategy.shard(spec, options(true));

    assertThat(shards).extracting(Shard::getId).containsExactly("SCN-001");
    assertThat(shards.get(0).getContent())
        .contains("Scenario: nested example", "Then it is stored");
  }

  private static ShardOptions options(boolean preserveContext) {
    return new ShardOptions(ShardStrategyType.BY_SCENARIO, 2000, preserveContext, true);
  }
}
