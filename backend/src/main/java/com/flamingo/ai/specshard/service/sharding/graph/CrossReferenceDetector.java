package com.flamingo.ai.specshard.service.sharding.graph;

import com.flamingo.ai.specshard.config.ShardingConfig;
import com.flamingo.ai.specshard.exception.InvalidShardIdException;
import com.flamingo.ai.specshard.service.sharding.analysis.SpecPatterns;
import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.CrossReferenceType;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Finds textual relationships between shards.
 *
 * <p>Three signals are recognised:
 *
 * <ul>
 *   <li>another shard's id appearing as a whole word ({@code references})
 *   <li>a "see &lt;section name&gt;" phrase naming another shard's section ({@code references})
 *   <li>a {@code REQ-n} token also present in another shard ({@code depends-on})
 * </ul>
 *
 * <p>Ids are validated before any pattern is compiled; they are always matched literally.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossReferenceDetector {

  private static final Pattern SEE_PHRASE =
      Pattern.compile("\\bsee\\s+(?:the\\s+)?[\"']?", Pattern.CASE_INSENSITIVE);

  private final ShardingConfig shardingConfig;

  /**
   * Detects cross-references between the given shards.
   *
   * @param shards shards of one plan
   * @return edges deduplicated by (from, to, type), in first-seen order
   * @throws InvalidShardIdException if any shard id is null, empty or too long
   */
  public List<CrossReference> detect(List<Shard> shards) {
    validateIds(shards);

    List<Pattern> idPatterns = new ArrayList<>(shards.size());
    for (Shard shard : shards) {
      idPatterns.add(
          Pattern.compile("\\b" + Pattern.quote(shard.getId()) + "\\b", Pattern.CASE_INSENSITIVE));
    }

    Map<String, String> sectionIds = new LinkedHashMap<>();
    for (Shard shard : shards) {
      if (shard.getSectionName() != null && !shard.getSectionName().isBlank()) {
        String name = shard.getSectionName().strip().toLowerCase(Locale.ROOT);
        sectionIds.putIfAbsent(name, shard.getId());
      }
    }
    List<String> sectionNames = new ArrayList<>(sectionIds.keySet());
    sectionNames.sort(Comparator.comparingInt(String::length).reversed());

    Map<String, CrossReference> edges = new LinkedHashMap<>();
    for (int i = 0; i < shards.size(); i++) {
      Shard shard = shards.get(i);
      String content = shard.getContent() == null ? "" : shard.getContent();

      for (int j = 0; j < shards.size(); j++) {
        Shard other = shards.get(j);
        if (i != j && idPatterns.get(j).matcher(content).find()) {
          add(
              edges,
              new CrossReference(
                  shard.getId(), other.getId(), CrossReferenceType.REFERENCES, null));
        }
      }

      Matcher see = SEE_PHRASE.matcher(content);
      while (see.find()) {
        String name = sectionAt(content, see.end(), sectionNames);
        if (name == null) {
          continue;
        }
        String targetId = sectionIds.get(name);
        if (!targetId.equals(shard.getId())) {
          add(
              edges,
              new CrossReference(
                  shard.getId(),
                  targetId,
                  CrossReferenceType.REFERENCES,
                  "References section \"" + name + "\""));
        }
      }

      Matcher requirement = SpecPatterns.REQUIREMENT_ID.matcher(content);
      while (requirement.find()) {
        String token = requirement.group().toUpperCase(Locale.ROOT);
        for (Shard other : shards) {
          if (other != shard
              && other.getContent() != null
              && other.getContent().toUpperCase(Locale.ROOT).contains(token)) {
            add(
                edges,
                new CrossReference(
                    shard.getId(),
                    other.getId(),
                    CrossReferenceType.DEPENDS_ON,
                    "References " + token));
            break;
          }
        }
      }
    }

    log.debug("Detected {} cross-references across {} shards", edges.size(), shards.size());
    return new ArrayList<>(edges.values());
  }

  /**
   * Checks that every id is usable in literal scans and file names.
   *
   * @throws InvalidShardIdException for the first null, empty or over-long id
   */
  public void validateIds(List<Shard> shards) {
    int maxLength = shardingConfig.getIds().getMaxLength();
    for (Shard shard : shards) {
      validateId(shard.getId(), maxLength);
    }
  }

  private static void validateId(String id, int maxLength) {
    if (id == null) {
      throw new InvalidShardIdException(null, "must be a non-empty string");
    }
    if (id.isEmpty()) {
      throw new InvalidShardIdException(id, "must be a non-empty string");
    }
    if (id.length() > maxLength) {
      throw new InvalidShardIdException(
          id, "exceeds maximum length of " + maxLength + " characters");
    }
  }

  /** Returns the longest known section name starting at {@code offset}, or {@code null}. */
  private static String sectionAt(String content, int offset, List<String> sectionNames) {
    String rest = content.substring(offset).toLowerCase(Locale.ROOT);
    for (String name : sectionNames) {
      if (rest.startsWith(name)
          && (rest.length() == name.length()
              || !Character.isLetterOrDigit(rest.charAt(name.length())))) {
        return name;
      }
    }
    return null;
  }

  private static void add(Map<String, CrossReference> edges, CrossReference edge) {
    edges.putIfAbsent(edge.from() + ":" + edge.to() + ":" + edge.type(), edge);
  }
}
