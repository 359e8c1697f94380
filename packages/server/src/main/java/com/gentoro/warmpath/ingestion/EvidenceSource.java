package com.gentoro.warmpath.ingestion;

import java.util.List;

/**
 * One dimension of relationship evidence (shared employer, school, hometown...). A source groups
 * persons by a key and reports every pair inside a group to the {@link EdgeCollector}.
 *
 * <p>Sources are configured under {@code ingestion.sources.<id>}; {@code enabled} toggles a
 * source, and a source listing {@link #requiredSettings()} is skipped when any of them is missing.
 */
public interface EvidenceSource {

  /** Stable identifier, also the configuration key of this source. */
  String id();

  /** Keys that must be present under {@code ingestion.sources.<id>} for the source to run. */
  default List<String> requiredSettings() {
    return List.of();
  }

  default boolean enabledByDefault() {
    return true;
  }

  void collect(IngestionContext context, EdgeCollector collector);
}
