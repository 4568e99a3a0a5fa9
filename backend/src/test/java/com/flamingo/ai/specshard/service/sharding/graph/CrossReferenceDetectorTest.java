package com.flamingo.ai.specshard.service.sharding.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.exception.InvalidShardIdException;
import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.CrossReferenceType;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import com.flamingo.ai.specshard.service.sharding.model.ShardType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CrossReferenceDetector Tests")
class CrossReferenceDetectorTest {

  private CrossReferenceDetector detector;

  @BeforeEach
  void setUp() {
    detector = new CrossReferenceDetector(new ShardingConfig());
  }

  @Test
  @DisplayName("should detect a whole-word mention of another shard id")
  void shouldDetectIdMention_whenContentNamesAnotherShard() {
    Shard a =
        shard("section-01-intro", "Details live in SECTION-02-API, twice: section-02-api.", null);
    Shard b = shard("section-02-api", "API text", null);

    List<CrossReference> references = detector.detect(List.of(a, b));

    assertThat(references)
        .containsExactly(
            new CrossReference(
                "section-01-intro", "section-02-api", CrossReferenceType.REFERENCES, null));
  }

  @Test
  @DisplayName("should match ids literally rather than as patterns")
  void shouldNotMatch_whenIdContainsRegexCharacters() {
    Shard a = shard("intro", "Calls apixv1 internally.", null);
    Shard b = shard("api.v1", "Versioned API", null);

    assertThat(detector.detect(List.of(a, b))).isEmpty();
  }

  @Test
  @DisplayName("should resolve see phrases to the longest matching section name")
  void shouldReferenceSection_whenSeePhraseNamesIt() {
    Shard a =
        shard("section-01-usage", "For quotas, see the \"Rate Limits Policy\" section.", "Usage");
    Shard b = shard("section-02-rate", "Limits.", "Rate Limits");
    Shard c = shard("section-03-policy", "Policy.", "Rate Limits Policy");

    List<CrossReference> references = detector.detect(List.of(a, b, c));

    assertThat(references)
        .containsExactly(
            new CrossReference(
                "section-01-usage",
                "section-03-policy",
                CrossReferenceType.REFERENCES,
                "References section \"rate limits policy\""));
  }

  @Test
  @DisplayName("should add depends-on edges for shared requirement ids")
  void shouldAddDependsOn_whenRequirementIdShared() {
    Shard a = shard("checkout", "Builds on req-12 for payment.", null);
    Shard b = shard("payments", "- REQ-12: Cards MUST be validated", null);

    List<CrossReference> references = detector.detect(List.of(a, b));

    assertThat(references)
        .contains(
            new CrossReference(
                "checkout", "payments", CrossReferenceType.DEPENDS_ON, "References REQ-12"));
  }

  @Test
  @DisplayName("should not report a shard referencing itself")
  void shouldIgnoreSelf_whenContentNamesOwnId() {
    Shard a = shard("alpha", "This is alpha. See Alpha.", "Alpha");

    assertThat(detector.detect(List.of(a))).isEmpty();
  }

  @Test
  @DisplayName("should reject null, empty and over-long ids before scanning")
  void shouldThrow_whenIdIsInvalid() {
    Shard valid = shard("ok", "text", null);

    assertThatThrownBy(() -> detector.detect(List.of(valid, shard(null, "x", null))))
        .isInstanceOf(InvalidShardIdException.class)
        .hasMessageStartingWith("Invalid shard ID");
    assertThatThrownBy(() -> detector.detect(List.of(shard("", "x", null))))
        .isInstanceOf(InvalidShardIdException.class);
    assertThatThrownBy(() -> detector.detect(List.of(shard("a".repeat(201), "x", null))))
        .isInstanceOf(InvalidShardIdException.class)
        .hasMessageContaining("200");
  }

  private static Shard shard(String id, String content, String sectionName) {
    return Shard.builder()
        .id(id)
        .type(ShardType.SECTION)
        .content(content)
        .sectionName(sectionName)
        .build();
  }
}
