package com.gentoro.warmpath.ingestion;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulates pairs reported by evidence sources and turns them into symmetric relationships.
 *
 * <p>Only one relationship per unordered pair and type survives: the strongest, and among equally
 * strong ones the one reported for the lexicographically smallest group key. The outcome therefore
 * does not depend on the order in which sources report.
 */
public final class EdgeCollector {
  private final Map<String, Person> persons;
  private final Map<String, Candidate> best = new HashMap<>();
  private final Map<String, Integer> reportedBySource = new HashMap<>();
  private String currentSource = "unknown";
  private int dropped;

  private record Candidate(
      String low,
      String high,
      RelationshipType type,
      int strength,
      String groupKey,
      Map<String, Object> metadata) {}

  public EdgeCollector(Map<String, Person> persons) {
    this.persons = persons;
  }

  void beginSource(String sourceId) {
    this.currentSource = sourceId;
    reportedBySource.putIfAbsent(sourceId, 0);
  }

  /**
   * Report a relationship between two persons. Self pairs and pairs referencing unknown persons
   * are ignored.
   */
  public void connect(
      String personA,
      String personB,
      RelationshipType type,
      int strength,
      String groupKey,
      Map<String, Object> metadata) {
    if (personA == null || personB == null || personA.equals(personB)) {
      return;
    }
    if (!persons.containsKey(personA) || !persons.containsKey(personB)) {
      dropped++;
      return;
    }
    reportedBySource.merge(currentSource, 1, Integer::sum);
    String low = personA.compareTo(personB) < 0 ? personA : personB;
    String high = low.equals(personA) ? personB : personA;
    Candidate next =
        new Candidate(low, high, type, Relationship.clamp(strength), groupKey, metadata);
    best.merge(low + "|" + high + "|" + type, next, EdgeCollector::stronger);
  }

  private static Candidate stronger(Candidate current, Candidate next) {
    if (next.strength() != current.strength()) {
      return next.strength() > current.strength() ? next : current;
    }
    return next.groupKey().compareTo(current.groupKey()) < 0 ? next : current;
  }

  /** Both directions of every surviving pair, in {@link Relationship#ORDER}. */
  public List<Relationship> edges() {
    List<Relationship> out = new ArrayList<>(best.size() * 2);
    for (Candidate c : best.values()) {
      boolean lowGhost = persons.get(c.low()).ghost();
      boolean highGhost = persons.get(c.high()).ghost();
      Relationship r =
          new Relationship(
              c.low(),
              c.high(),
              c.type(),
              c.strength(),
              ConfidencePolicy.confidence(lowGhost, highGhost),
              lowGhost || highGhost,
              c.metadata());
      out.add(r);
      out.add(r.reversed());
    }
    out.sort(Relationship.ORDER);
    return out;
  }

  /** Number of pairs each source reported, before de-duplication. */
  public Map<String, Integer> reportedBySource() {
    return Map.copyOf(reportedBySource);
  }

  /** Pairs ignored because an endpoint is not a known person. */
  public int dropped() {
    return dropped;
  }
}
