package com.flamingo.ai.specshard.service.sharding.strategy;

import java.util.Locale;
import java.util.Set;

/** Helpers for building plan-local shard ids. */
public final class ShardIds {

  private ShardIds() {}

  /** Two-digit, zero-padded position used in ids such as {@code section-03-security}. */
  public static String index(int position) {
    return String.format(Locale.ROOT, "%02d", position);
  }

  /** Three-digit, zero-padded sequence used in ids such as {@code REQ-007}. */
  public static String sequence(int position) {
    return String.format(Locale.ROOT, "%03d", position);
  }

  /**
   * Lower-cases a heading and collapses everything but ASCII letters and digits into single
   * dashes, truncated to {@code maxLength}.
   *
   * @return the slug, or {@code "section"} if nothing usable remains
   */
  public static String slug(String name, int maxLength) {
    String slug =
        name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("^-+|-+$", "");
    if (slug.length() > maxLength) {
      slug = slug.substring(0, maxLength).replaceAll("-+$", "");
    }
    return slug.isEmpty() ? "section" : slug;
  }

  /**
   * Returns {@code candidate}, or the first {@code candidate-N} (N from 2) not yet in {@code
   * used}, and records the result in {@code used}.
   */
  public static String unique(String candidate, Set<String> used) {
    String id = candidate;
    int suffix = 2;
    while (!used.add(id)) {
      id = candidate + "-" + suffix++;
    }
    return id;
  }
}
