package com.flamingo.ai.specshard.service.sharding.analysis;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.specshard.config.ShardingConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenEstimator Tests")
class TokenEstimatorTest {

  private ShardingConfig shardingConfig;
  private TokenEstimator tokenEstimator;

  @BeforeEach
  void setUp() {
    shardingConfig = new ShardingConfig();
    tokenEstimator = new TokenEstimator(shardingConfig);
  }

  @Test
  @DisplayName("should return zero for null and empty text")
  void shouldReturnZero_whenTextIsNullOrEmpty() {
    assertThat(tokenEstimator.estimate(null)).isZero();
    assertThat(tokenEstimator.estimate("")).isZero();
  }

  @Test
  @DisplayName("should round prose estimate up")
  void shouldRoundUp_whenProseIsNotMultipleOfRate() {
    assertThat(tokenEstimator.estimate("abcd")).isEqualTo(1);
    assertThat(tokenEstimator.estimate("abcde")).isEqualTo(2);
    assertThat(tokenEstimator.estimate("a".repeat(40_000))).isEqualTo(10_000);
  }

  @Test
  @DisplayName("should price fenced code separately from prose")
  void shouldPriceCodeSeparately_whenTextContainsCodeFence() {
    // prose "hello\n" = 6 chars -> 2, code "```\nab\n```" = 10 chars at 3.5 -> 3
    assertThat(tokenEstimator.estimate("hello\n```\nab\n```")).isEqualTo(5);
  }

  @Test
  @DisplayName("should price an unterminated fence as code up to the end of the text")
  void shouldTreatAsCode_whenFenceIsUnterminated() {
    // "```abcde" = 8 chars at 3.5 -> 3
    assertThat(tokenEstimator.estimate("```abcde")).isEqualTo(3);
  }

  @Test
  @DisplayName("should price inline backtick runs as prose")
  void shouldTreatAsProse_whenBackticksAreInline() {
    assertThat(tokenEstimator.estimate("run ```ab``` now")).isEqualTo(4);
  }

  @Test
  @DisplayName("should use configured characters per token")
  void shouldUseConfiguredRate_whenEstimationIsOverridden() {
    shardingConfig.getEstimation().setProseCharsPerToken(2.0);

    assertThat(tokenEstimator.estimate("abcd")).isEqualTo(2);
  }
}
