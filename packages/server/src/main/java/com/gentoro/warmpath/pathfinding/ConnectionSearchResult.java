package com.gentoro.warmpath.pathfinding;

import java.util.List;

/**
 * Ranked paths between a source and one or more targets. Finding nothing is a regular outcome
 * reported with {@code found == false} and an explanatory message.
 *
 * @param maxHops the hop bound that was applied
 * @param truncated whether the expansion budget ran out before the search space was exhausted
 * @param expansions partial paths that were extended
 */
public record ConnectionSearchResult(
    boolean found,
    String sourceId,
    List<String> targetIds,
    int maxHops,
    List<IntroductionPath> paths,
    double topScore,
    String message,
    boolean truncated,
    int expansions) {

  static ConnectionSearchResult empty(
      String sourceId, List<String> targetIds, int maxHops, String message) {
    return new ConnectionSearchResult(
        false, sourceId, targetIds, maxHops, List.of(), 0, message, false, 0);
  }
}
