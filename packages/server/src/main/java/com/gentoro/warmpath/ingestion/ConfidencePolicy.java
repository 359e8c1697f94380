package com.gentoro.warmpath.ingestion;

import com.gentoro.warmpath.model.Relationship;
import java.util.function.Predicate;

/** Edge confidence rules shared by ingestion and profile activation. */
public final class ConfidencePolicy {
  public static final int FULL_CONFIDENCE = 100;
  public static final int GHOST_PENALTY = 40;

  private ConfidencePolicy() {}

  public static int confidence(boolean fromGhost, boolean toGhost) {
    int c = FULL_CONFIDENCE;
    if (fromGhost) c -= GHOST_PENALTY;
    if (toGhost) c -= GHOST_PENALTY;
    return Relationship.clamp(c);
  }

  /**
   * Raise the confidence of an edge touching a freshly activated person by {@code boost}, capped at
   * 100, and recompute its ghost flag from the current state of both endpoints.
   */
  public static Relationship boost(Relationship edge, int boost, Predicate<String> isGhost) {
    boolean ghost = isGhost.test(edge.fromPersonId()) || isGhost.test(edge.toPersonId());
    return edge.withConfidence(Math.min(FULL_CONFIDENCE, edge.confidence() + boost), ghost)
        .withMetadata("activated", true);
  }
}
