package com.flamingo.ai.specshard.service.sharding.model;

/**
 * Structural profile of a specification, computed once per run.
 *
 * @param recommendedStrategy strategy the analyzer would pick for this document
 * @param complexity score in {@code [0, 100]}
 * @param sectionCount number of second-level headings
 * @param requirementCount number of requirement lines
 * @param scenarioCount number of scenario/example introducers
 * @param totalLines number of lines in the document
 * @param totalTokens estimated cost of the whole document
 * @param recommendationReason human-readable justification
 */
public record ShardAnalysis(
    ShardStrategyType recommendedStrategy,
    int complexity,
    int sectionCount,
    int requirementCount,
    int scenarioCount,
    int totalLines,
    int totalTokens,
    String recommendationReason) {

  public static ShardAnalysis empty() {
    return new ShardAnalysis(ShardStrategyType.AUTO, 0, 0, 0, 0, 0, 0, "Empty document");
  }
}
