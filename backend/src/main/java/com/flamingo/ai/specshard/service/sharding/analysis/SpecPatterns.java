package com.flamingo.ai.specshard.service.sharding.analysis;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line patterns recognised in specification documents. Headings and code blocks are located by
 * {@link MarkdownOutline}.
 */
public final class SpecPatterns {

  /** Bullet carrying an explicit id; group 1 is the id, group 2 the rest of the line. */
  public static final Pattern EXPLICIT_REQUIREMENT =
      Pattern.compile("^\\s*[-*]\\s*(REQ-\\d+)[:\\s]+(.*)$", Pattern.CASE_INSENSITIVE);

  /** Bullet with a priority tag; group 1 is the tag, group 2 the text. */
  public static final Pattern PRIORITY_REQUIREMENT =
      Pattern.compile("^\\s*[-*]\\s*\\[(P[0-2])\\][:\\s]*(.+)$", Pattern.CASE_INSENSITIVE);

  /** Bullet opening with an obligation keyword; group 1 is the keyword and text. */
  public static final Pattern KEYWORD_REQUIREMENT =
      Pattern.compile(
          "^\\s*[-*]\\s*((?:MUST|SHOULD|MAY|REQUIRED|SHALL)\\s.*)$", Pattern.CASE_INSENSITIVE);

  /** Scenario or example introducer; group 1 is the scenario name. */
  public static final Pattern SCENARIO_START =
      Pattern.compile(
          "^\\s*(?:[-*]\\s*)?(?:Scenario|Example)(?:\\s+\\d+)?\\s*:\\s*(.+)$",
          Pattern.CASE_INSENSITIVE);

  /** Gherkin step or scenario line that belongs to the preceding requirement. */
  public static final Pattern SCENARIO_STEP =
      Pattern.compile("^\\s*(?:Scenario|Given|When|Then|And|But):?\\s+", Pattern.CASE_INSENSITIVE);

  /** Requirement identifier token anywhere in text. */
  public static final Pattern REQUIREMENT_ID =
      Pattern.compile("\\bREQ-\\d+\\b", Pattern.CASE_INSENSITIVE);

  private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

  private static final Pattern OBLIGATION_KEYWORD =
      Pattern.compile("\\b(MUST|REQUIRED|SHALL|SHOULD|MAY)\\b", Pattern.CASE_INSENSITIVE);

  private SpecPatterns() {}

  public static boolean isRequirementLine(String line) {
    return EXPLICIT_REQUIREMENT.matcher(line).matches()
        || PRIORITY_REQUIREMENT.matcher(line).matches()
        || KEYWORD_REQUIREMENT.matcher(line).matches();
  }

  public static boolean isScenarioStart(String line) {
    return SCENARIO_START.matcher(line).matches();
  }

  /**
   * Maps the first obligation keyword in the text to a priority tag: MUST, REQUIRED and SHALL
   * give {@code P0}, SHOULD gives {@code P1}, MAY gives {@code P2}.
   *
   * @return the tag, or {@code defaultTag} when the text has no keyword
   */
  public static String priorityTag(String text, String defaultTag) {
    Matcher matcher = OBLIGATION_KEYWORD.matcher(text);
    if (!matcher.find()) {
      return defaultTag;
    }
    return switch (matcher.group(1).toUpperCase()) {
      case "SHOULD" -> "P1";
      case "MAY" -> "P2";
      default -> "P0";
    };
  }

  /** Splits on {@code \n}, {@code \r\n} or {@code \r}, keeping trailing empty lines. */
  public static String[] lines(String text) {
    return LINE_BREAK.split(text, -1);
  }

  /** Rewrites {@code \r\n} and lone {@code \r} as {@code \n}; {@code null} stays {@code null}. */
  public static String normalizeLineEndings(String text) {
    if (text == null || text.indexOf('\r') < 0) {
      return text;
    }
    return LINE_BREAK.matcher(text).replaceAll("\n");
  }
}
