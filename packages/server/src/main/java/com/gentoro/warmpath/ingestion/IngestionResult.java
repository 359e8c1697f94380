package com.gentoro.warmpath.ingestion;

import com.gentoro.warmpath.model.Relationship;
import java.util.List;
import java.util.Map;

/**
 * Output of one ingestion pass.
 *
 * @param edges the complete relationship set in {@link Relationship#ORDER}
 * @param pairsBySource pairs each source reported before de-duplication
 * @param skippedSources sources that did not run, with the reason
 */
public record IngestionResult(
    List<Relationship> edges,
    Map<String, Integer> pairsBySource,
    List<SkippedSource> skippedSources) {

  public record SkippedSource(String id, String reason) {}
}
