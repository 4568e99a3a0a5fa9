package com.flamingo.ai.specshard.service.sharding.graph;

import com.flamingo.ai.specshard.service.sharding.model.CrossReference;
import com.flamingo.ai.specshard.service.sharding.model.CrossReferenceType;
import com.flamingo.ai.specshard.service.sharding.model.Shard;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes the order in which shards should be processed.
 *
 * <p>A shard comes after its parent and after every shard it {@code depends-on}. Among shards that
 * are ready at the same time, the lowest priority wins, ties broken by the order they became
 * ready. Shards caught in a cycle are appended at the end by priority, so the result is always a
 * permutation of the input ids.
 */
@Service
@Slf4j
public class ProcessingOrderScheduler {

  /**
   * Orders the given shards.
   *
   * @param shards shards of one plan, ids unique
   * @param references detected cross-references; only {@code depends-on} edges are used
   * @return every shard id exactly once
   */
  public List<String> order(List<Shard> shards, List<CrossReference> references) {
    int n = shards.size();
    Map<String, Integer> indexById = new HashMap<>();
    for (int i = 0; i < n; i++) {
      indexById.putIfAbsent(shards.get(i).getId(), i);
    }

    List<List<Integer>> successors = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      successors.add(new ArrayList<>());
    }
    int[] inDegree = new int[n];

    for (CrossReference reference : references) {
      if (reference.type() != CrossReferenceType.DEPENDS_ON) {
        continue;
      }
      addEdge(indexById.get(reference.to()), indexById.get(reference.from()), successors, inDegree);
    }
    for (int i = 0; i < n; i++) {
      String parentId = shards.get(i).getParentId();
      if (parentId != null) {
        addEdge(indexById.get(parentId), i, successors, inDegree);
      }
    }

    // Entries are {node index, enqueue sequence}.
    PriorityQueue<int[]> ready =
        new PriorityQueue<>(
            Comparator.<int[]>comparingInt(entry -> shards.get(entry[0]).getPriority())
                .thenComparingInt(entry -> entry[1]));
    int sequence = 0;
    for (int i = 0; i < n; i++) {
      if (inDegree[i] == 0) {
        ready.add(new int[] {i, sequence++});
      }
    }

    List<String> order = new ArrayList<>(n);
    boolean[] emitted = new boolean[n];
    while (!ready.isEmpty()) {
      int current = ready.poll()[0];
      order.add(shards.get(current).getId());
      emitted[current] = true;
      for (int successor : successors.get(current)) {
        if (--inDegree[successor] == 0) {
          ready.add(new int[] {successor, sequence++});
        }
      }
    }

    if (order.size() < n) {
      List<Shard> remaining = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        if (!emitted[i]) {
          remaining.add(shards.get(i));
        }
      }
      remaining.sort(Comparator.comparingInt(Shard::getPriority));
      log.warn(
          "Dependency cycle among {} shards, appending them in priority order", remaining.size());
      for (Shard shard : remaining) {
        order.add(shard.getId());
      }
    }
    return order;
  }

  private static void addEdge(
      Integer before, Integer after, List<List<Integer>> successors, int[] inDegree) {
    if (before == null || after == null || before.equals(after)) {
      return;
    }
    successors.get(before).add(after);
    inDegree[after]++;
  }
}
