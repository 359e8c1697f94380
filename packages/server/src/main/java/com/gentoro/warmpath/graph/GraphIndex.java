package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable adjacency view over one generation of relationships.
 *
 * <p>An index is built in a single pass over the edges and never changes afterwards; fresher data
 * means building a new index. Edges whose endpoints are not known persons are left out of the
 * adjacency and counted as orphans.
 */
public final class GraphIndex {
  private static final Comparator<Relationship> STRONGEST_FIRST =
      Comparator.comparingInt(Relationship::strength)
          .thenComparingInt(r -> r.type().trustRank())
          .reversed()
          .thenComparing(Relationship::type);

  private final Map<String, Person> persons;
  private final Map<String, List<Neighbor>> adjacency;
  private final List<Relationship> edges;
  private final int orphanedEdges;
  private final Instant builtAt;

  private GraphIndex(
      Map<String, Person> persons,
      Map<String, List<Neighbor>> adjacency,
      List<Relationship> edges,
      int orphanedEdges,
      Instant builtAt) {
    this.persons = persons;
    this.adjacency = adjacency;
    this.edges = edges;
    this.orphanedEdges = orphanedEdges;
    this.builtAt = builtAt;
  }

  public static GraphIndex empty() {
    return new GraphIndex(Map.of(), Map.of(), List.of(), 0, null);
  }

  public static GraphIndex build(
      Collection<Person> persons, Collection<Relationship> edges, Instant builtAt) {
    Map<String, Person> byId = new TreeMap<>();
    persons.forEach(p -> byId.put(p.id(), p));

    List<Relationship> sorted = new ArrayList<>(edges);
    sorted.sort(Relationship.ORDER);

    Map<String, List<Neighbor>> adjacency = new LinkedHashMap<>();
    List<Relationship> kept = new ArrayList<>(sorted.size());
    int orphans = 0;
    for (Relationship r : sorted) {
      if (!byId.containsKey(r.fromPersonId()) || !byId.containsKey(r.toPersonId())) {
        orphans++;
        continue;
      }
      kept.add(r);
      adjacency
          .computeIfAbsent(r.fromPersonId(), k -> new ArrayList<>())
          .add(new Neighbor(r.toPersonId(), r.type(), r));
    }
    adjacency.replaceAll((k, v) -> Collections.unmodifiableList(v));
    return new GraphIndex(
        Collections.unmodifiableMap(byId),
        Collections.unmodifiableMap(adjacency),
        Collections.unmodifiableList(kept),
        orphans,
        builtAt);
  }

  /**
   * New index with {@code person} replaced and {@code changed} edges swapped in by their (from, to,
   * type) identity.
   */
  public GraphIndex withChanges(Person person, Collection<Relationship> changed) {
    Map<String, Person> nextPersons = new LinkedHashMap<>(persons);
    if (person != null) nextPersons.put(person.id(), person);
    Map<String, Relationship> nextEdges = new LinkedHashMap<>();
    edges.forEach(r -> nextEdges.put(r.key(), r));
    changed.forEach(r -> nextEdges.put(r.key(), r));
    return build(nextPersons.values(), nextEdges.values(), builtAt);
  }

  /** Neighbors of a person ordered by neighbor id, then relationship type. */
  public List<Neighbor> neighbors(String personId) {
    return adjacency.getOrDefault(personId, List.of());
  }

  public Optional<Person> person(String personId) {
    return personId == null ? Optional.empty() : Optional.ofNullable(persons.get(personId));
  }

  public boolean contains(String personId) {
    return personId != null && persons.containsKey(personId);
  }

  /** All persons ordered by id. */
  public Collection<Person> persons() {
    return persons.values();
  }

  /** All indexed relationships in {@link Relationship#ORDER}. */
  public List<Relationship> edges() {
    return edges;
  }

  /** Strongest relationship between two persons; ties go to the more trusted type. */
  public Optional<Relationship> strongestEdge(String from, String to) {
    return neighbors(from).stream()
        .filter(n -> n.personId().equals(to))
        .map(Neighbor::edge)
        .min(STRONGEST_FIRST);
  }

  /** Strongest relationship a person has to anyone. */
  public Optional<Relationship> strongestEdge(String personId) {
    return neighbors(personId).stream().map(Neighbor::edge).min(STRONGEST_FIRST);
  }

  public int nodeCount() {
    return persons.size();
  }

  public int edgeCount() {
    return edges.size();
  }

  public int orphanedEdges() {
    return orphanedEdges;
  }

  /** When the underlying relationship generation was committed; null for the empty index. */
  public Instant builtAt() {
    return builtAt;
  }
}
