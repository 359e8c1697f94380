package com.gentoro.warmpath.model;

import com.gentoro.warmpath.exception.ValidationException;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed and weighted edge between two persons. Relationships are derived from evidence
 * and identified only by {@code (fromPersonId, toPersonId, type)}; every relationship has a mirror
 * edge in the opposite direction with the same strength.
 *
 * @param strength intensity of the relationship, 0-100
 * @param confidence how trustworthy the derivation is, 0-100; discounted for ghost endpoints
 * @param ghost whether at least one endpoint is a ghost person
 * @param metadata evidence that justified the edge (company, school, shared years)
 */
public record Relationship(
    String fromPersonId,
    String toPersonId,
    RelationshipType type,
    int strength,
    int confidence,
    boolean ghost,
    Map<String, Object> metadata) {

  /** Canonical ordering used for persisted and indexed edge lists. */
  public static final Comparator<Relationship> ORDER =
      Comparator.comparing(Relationship::fromPersonId)
          .thenComparing(Relationship::toPersonId)
          .thenComparing(Relationship::type);

  public Relationship {
    Objects.requireNonNull(fromPersonId, "fromPersonId");
    Objects.requireNonNull(toPersonId, "toPersonId");
    Objects.requireNonNull(type, "type");
    if (fromPersonId.equals(toPersonId)) {
      throw new ValidationException(
          "A relationship cannot connect a person to themself",
          Map.of("personId", fromPersonId, "type", type));
    }
    strength = clamp(strength);
    confidence = clamp(confidence);
    metadata =
        metadata == null || metadata.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static int clamp(int value) {
    return Math.max(0, Math.min(100, value));
  }

  /** Identity of this edge: "from|to|TYPE". */
  public String key() {
    return fromPersonId + "|" + toPersonId + "|" + type;
  }

  public boolean touches(String personId) {
    return fromPersonId.equals(personId) || toPersonId.equals(personId);
  }

  public String otherEnd(String personId) {
    return fromPersonId.equals(personId) ? toPersonId : fromPersonId;
  }

  public Relationship reversed() {
    return new Relationship(toPersonId, fromPersonId, type, strength, confidence, ghost, metadata);
  }

  public Relationship withConfidence(int newConfidence, boolean newGhost) {
    return new Relationship(
        fromPersonId, toPersonId, type, strength, newConfidence, newGhost, metadata);
  }

  public Relationship withMetadata(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(metadata);
    m.put(key, value);
    return new Relationship(fromPersonId, toPersonId, type, strength, confidence, ghost, m);
  }
}
