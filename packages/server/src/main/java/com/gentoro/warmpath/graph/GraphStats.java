package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.ingestion.IngestionResult;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of the last completed rebuild.
 *
 * @param nodes persons in the graph
 * @param edges directed relationships; every relationship is counted in both directions
 * @param ghostNodes persons that are still ghosts
 * @param relationshipBreakdown directed relationships per type
 * @param companyBreakdown persons per current company, ten largest companies
 * @param lastRebuild commit time of the rebuild, null if the graph was never rebuilt
 * @param durationMillis wall time of the rebuild
 */
public record GraphStats(
    int nodes,
    int edges,
    int ghostNodes,
    Map<String, Integer> relationshipBreakdown,
    Map<String, Integer> companyBreakdown,
    Instant lastRebuild,
    long durationMillis,
    Map<String, Integer> pairsBySource,
    List<IngestionResult.SkippedSource> skippedSources,
    IntegrityReport integrity) {

  public static GraphStats empty() {
    return new GraphStats(
        0, 0, 0, Map.of(), Map.of(), null, 0, Map.of(), List.of(), IntegrityReport.empty());
  }
}
