package com.flamingo.ai.specshard.service.sharding.analysis;

import com.flamingo.ai.specshard.config.ShardingConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Approximates the processing cost of a piece of text in abstract token units.
 *
 * <p>Prose and fenced code blocks are measured separately, each rounded up, and summed. Code
 * blocks are located with {@link MarkdownOutline}; an unclosed fence runs to the end of the text.
 * This is a rough character-ratio estimate; it does not reproduce any particular tokenizer.
 */
@Component
@RequiredArgsConstructor
public class TokenEstimator {

  private final ShardingConfig shardingConfig;

  /**
   * Estimates the token cost of the given text.
   *
   * @param text text to measure; {@code null} counts as empty
   * @return non-negative estimate
   */
  public int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    int codeChars = hasFence(text) ? MarkdownOutline.parse(text).codeLength() : 0;
    int proseChars = text.length() - codeChars;

    ShardingConfig.Estimation estimation = shardingConfig.getEstimation();
    return (int) Math.ceil(proseChars / estimation.getProseCharsPerToken())
        + (int) Math.ceil(codeChars / estimation.getCodeCharsPerToken());
  }

  private static boolean hasFence(String text) {
    return text.contains("```") || text.contains("~~~");
  }
}
