package com.gentoro.warmpath.pathfinding;

import com.gentoro.warmpath.exception.ValidationException;
import com.gentoro.warmpath.graph.GraphIndex;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.graph.Neighbor;
import com.gentoro.warmpath.matching.FuzzyIdentityMatcher;
import com.gentoro.warmpath.matching.MatchResult;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Finds and ranks introduction paths over the current graph snapshot.
 *
 * <p>Paths are simple (nobody appears twice) and found breadth first up to the hop bound. Each hop
 * uses the strongest relationship between its two people, and a path scores the product of its
 * normalized hop strengths, so one weak link drags the whole path down. Equal scores prefer fewer
 * hops, then a more trusted weakest hop, then more distinct relationship types.
 *
 * <p>Every search runs against one snapshot and holds no lock, so searches may run in parallel
 * with each other and with rebuilds.
 */
public class PathDiscoveryService {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(PathDiscoveryService.class);

  private final GraphService graphService;
  private final FuzzyIdentityMatcher matcher;
  private final int defaultMaxHops;
  private final int maxHopsLimit;
  private final int maxResults;
  private final int maxExpansions;

  public PathDiscoveryService(
      Configuration configuration, GraphService graphService, FuzzyIdentityMatcher matcher) {
    this.graphService = graphService;
    this.matcher = matcher;
    this.defaultMaxHops = configuration.getInt("pathfinding.defaultMaxHops", 3);
    this.maxHopsLimit = configuration.getInt("pathfinding.maxHopsLimit", 6);
    this.maxResults = configuration.getInt("pathfinding.maxResults", 10);
    this.maxExpansions = configuration.getInt("pathfinding.maxExpansions", 50_000);
  }

  /** Partial path kept as a parent chain so extending it is O(1). */
  private record Trail(String personId, Trail parent, int depth) {
    boolean contains(String id) {
      for (Trail t = this; t != null; t = t.parent) {
        if (t.personId.equals(id)) return true;
      }
      return false;
    }

    List<String> ids() {
      String[] out = new String[depth + 1];
      Trail t = this;
      for (int i = depth; i >= 0; i--) {
        out[i] = t.personId;
        t = t.parent;
      }
      return List.of(out);
    }
  }

  private record Ranked(IntroductionPath path, int weakestTrust, int distinctTypes, String key) {}

  private static final Comparator<Ranked> RANKING =
      Comparator.comparingDouble((Ranked r) -> r.path().score())
          .reversed()
          .thenComparingInt(r -> r.path().hops())
          .thenComparing(Comparator.comparingInt(Ranked::weakestTrust).reversed())
          .thenComparing(Comparator.comparingInt(Ranked::distinctTypes).reversed())
          .thenComparing(Ranked::key);

  public ConnectionSearchResult findConnections(String sourceId, String targetId, Integer maxHops) {
    return findConnections(sourceId, targetId == null ? List.of() : List.of(targetId), maxHops);
  }

  /**
   * Search paths from {@code sourceId} to any of {@code targetIds}.
   *
   * @param maxHops hop bound, defaults to {@code pathfinding.defaultMaxHops}; values above {@code
   *     pathfinding.maxHopsLimit} are lowered to the limit
   * @throws ValidationException when {@code maxHops} is below 1
   */
  public ConnectionSearchResult findConnections(
      String sourceId, Collection<String> targetIds, Integer maxHops) {
    int hops = effectiveMaxHops(maxHops);
    GraphIndex index = graphService.snapshot();
    List<String> targets = new ArrayList<>(new LinkedHashSet<>(targetIds));

    if (!index.contains(sourceId)) {
      return ConnectionSearchResult.empty(
          sourceId, targets, hops, "unknown source person: " + sourceId);
    }
    List<String> unknown = targets.stream().filter(t -> !index.contains(t)).toList();
    targets.removeAll(unknown);
    if (targets.isEmpty()) {
      String message =
          unknown.isEmpty()
              ? "no target person given"
              : "unknown target person: " + String.join(", ", unknown);
      return ConnectionSearchResult.empty(sourceId, unknown, hops, message);
    }
    if (targets.size() == 1 && targets.get(0).equals(sourceId)) {
      return ConnectionSearchResult.empty(
          sourceId, targets, hops, "source and target are the same person");
    }
    return search(index, sourceId, targets, hops);
  }

  /** Resolve a described target first, then search paths to every resolved candidate. */
  public DescribedConnectionSearch findConnectionsByDescription(
      String sourceId, String name, String company, String title, Integer maxHops) {
    int hops = effectiveMaxHops(maxHops);
    MatchResult resolution = matcher.resolveTarget(sourceId, name, company, title);
    if (!resolution.found()) {
      return new DescribedConnectionSearch(
          resolution,
          ConnectionSearchResult.empty(sourceId, List.of(), hops, "target could not be resolved"));
    }
    List<String> targets = resolution.matches().stream().map(m -> m.person().id()).toList();
    return new DescribedConnectionSearch(resolution, findConnections(sourceId, targets, hops));
  }

  /** Ghost persons along a path of person ids, in path order. */
  public List<String> checkPathRequiresInvite(List<String> personIds) {
    GraphIndex index = graphService.snapshot();
    return personIds.stream()
        .filter(id -> index.person(id).map(Person::ghost).orElse(false))
        .distinct()
        .toList();
  }

  private int effectiveMaxHops(Integer requested) {
    if (requested == null) return Math.min(defaultMaxHops, maxHopsLimit);
    if (requested < 1) {
      throw new ValidationException("maxHops must be at least 1", Map.of("maxHops", requested));
    }
    if (requested > maxHopsLimit) {
      log.debug("Requested maxHops {} lowered to limit {}", requested, maxHopsLimit);
      return maxHopsLimit;
    }
    return requested;
  }

  private ConnectionSearchResult search(
      GraphIndex index, String sourceId, List<String> targets, int maxHops) {
    Set<String> targetSet = new HashSet<>(targets);
    Map<String, Ranked> found = new LinkedHashMap<>();
    Deque<Trail> queue = new ArrayDeque<>();
    queue.add(new Trail(sourceId, null, 0));
    int expansions = 0;
    boolean truncated = false;

    while (!queue.isEmpty()) {
      Trail trail = queue.poll();
      if (expansions >= maxExpansions) {
        truncated = true;
        break;
      }
      expansions++;
      Set<String> seen = new HashSet<>();
      for (Neighbor n : index.neighbors(trail.personId())) {
        String next = n.personId();
        if (!seen.add(next) || trail.contains(next)) continue;
        Trail extended = new Trail(next, trail, trail.depth() + 1);
        if (targetSet.contains(next)) {
          Ranked ranked = toPath(index, extended.ids());
          found.putIfAbsent(ranked.key(), ranked);
        } else if (extended.depth() < maxHops) {
          queue.add(extended);
        }
      }
    }
    if (truncated) {
      log.warn(
          "Path search from {} stopped after {} expansions, results may be incomplete",
          sourceId,
          expansions);
    }

    List<IntroductionPath> paths =
        found.values().stream().sorted(RANKING).limit(maxResults).map(Ranked::path).toList();
    double topScore = paths.isEmpty() ? 0 : paths.get(0).score();
    String message =
        paths.isEmpty()
            ? "no path found within %d hops".formatted(maxHops)
            : "found %d path(s) within %d hops".formatted(found.size(), maxHops);
    if (truncated) {
      message += " (search truncated after %d expansions)".formatted(expansions);
    }
    log.debug("Path search {} -> {}: {}", sourceId, targets, message);
    return new ConnectionSearchResult(
        !paths.isEmpty(),
        sourceId,
        targets,
        maxHops,
        paths,
        topScore,
        message,
        truncated,
        expansions);
  }

  private static Ranked toPath(GraphIndex index, List<String> ids) {
    List<PathHop> steps = new ArrayList<>(ids.size() - 1);
    List<RelationshipType> types = new ArrayList<>(ids.size() - 1);
    double product = 1.0;
    int confidence = 100;
    int weakestStrength = Integer.MAX_VALUE;
    int weakestTrust = Integer.MAX_VALUE;
    for (int i = 0; i + 1 < ids.size(); i++) {
      Relationship edge = index.strongestEdge(ids.get(i), ids.get(i + 1)).orElseThrow();
      steps.add(
          new PathHop(
              ids.get(i),
              name(index, ids.get(i)),
              ids.get(i + 1),
              name(index, ids.get(i + 1)),
              edge.type(),
              edge.strength(),
              edge.confidence(),
              edge.ghost(),
              edge.metadata()));
      types.add(edge.type());
      product *= edge.strength() / 100.0;
      confidence = Math.min(confidence, edge.confidence());
      if (edge.strength() < weakestStrength) {
        weakestStrength = edge.strength();
        weakestTrust = edge.type().trustRank();
      } else if (edge.strength() == weakestStrength) {
        weakestTrust = Math.min(weakestTrust, edge.type().trustRank());
      }
    }

    List<String> ghosts =
        ids.subList(1, ids.size()).stream()
            .filter(id -> index.person(id).map(Person::ghost).orElse(false))
            .toList();
    IntroductionPath path =
        new IntroductionPath(
            ids,
            ids.stream().map(id -> name(index, id)).toList(),
            List.copyOf(steps),
            List.copyOf(types),
            steps.size(),
            Math.round(product * 10_000) / 100.0,
            confidence,
            ghosts,
            !ghosts.isEmpty());
    int distinct = types.isEmpty() ? 0 : EnumSet.copyOf(types).size();
    return new Ranked(path, weakestTrust, distinct, String.join("\u0000", ids));
  }

  private static String name(GraphIndex index, String id) {
    return index.person(id).map(Person::name).orElse(id);
  }
}
