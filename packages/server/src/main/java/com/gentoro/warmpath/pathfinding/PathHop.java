package com.gentoro.warmpath.pathfinding;

import com.gentoro.warmpath.model.RelationshipType;
import java.util.Map;

/** One step of an introduction path, carrying the strongest relationship between the pair. */
public record PathHop(
    String fromPersonId,
    String fromName,
    String toPersonId,
    String toName,
    RelationshipType type,
    int strength,
    int confidence,
    boolean ghost,
    Map<String, Object> evidence) {}
