package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.exception.ConfigException;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.exception.NotFoundException;
import com.gentoro.warmpath.exception.StateException;
import com.gentoro.warmpath.ingestion.ConfidencePolicy;
import com.gentoro.warmpath.ingestion.IngestionResult;
import com.gentoro.warmpath.ingestion.RelationshipIngestionService;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.apache.commons.configuration2.Configuration;

/**
 * Owns the current {@link GraphIndex} snapshot and every write to the relationship set.
 *
 * <p>Readers call {@link #snapshot()} and keep working on that instance; a rebuild prepares the
 * next generation off to the side and publishes it with a single reference swap. Only one rebuild
 * runs at a time, a concurrent request gets the statistics of the last completed one. Rebuild
 * commits and profile activations serialize on one commit lock so an activation that lands while a
 * rebuild is computing is not lost.
 */
public class GraphService {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(GraphService.class);

  private static final int TOP_COMPANIES = 10;

  private final EvidenceStore store;
  private final RelationshipIngestionService ingestion;
  private final Clock clock;
  private final Duration rebuildInterval;
  private final AtomicReference<GraphIndex> current = new AtomicReference<>(GraphIndex.empty());
  private final AtomicReference<GraphStats> lastStats = new AtomicReference<>(GraphStats.empty());
  private final ReentrantLock rebuildLock = new ReentrantLock();
  private final ReentrantLock commitLock = new ReentrantLock();

  public GraphService(
      Configuration configuration,
      EvidenceStore store,
      RelationshipIngestionService ingestion,
      Clock clock) {
    this.store = store;
    this.ingestion = ingestion;
    this.clock = clock;
    String interval = configuration.getString("ingestion.schedule.rebuildInterval", "PT1H");
    try {
      this.rebuildInterval = Duration.parse(interval);
    } catch (DateTimeParseException e) {
      throw new ConfigException(
          "Invalid ingestion.schedule.rebuildInterval: " + interval, Map.of("value", interval));
    }
  }

  /** The current snapshot. Never null; empty until the first load or rebuild. */
  public GraphIndex snapshot() {
    return current.get();
  }

  /** Statistics of the last completed rebuild. */
  public GraphStats stats() {
    return lastStats.get();
  }

  public boolean isRebuilding() {
    return rebuildLock.isLocked();
  }

  /** True when the graph was never rebuilt or the last rebuild is older than the interval. */
  public boolean shouldRebuild() {
    Instant last = lastStats.get().lastRebuild();
    return last == null || !last.plus(rebuildInterval).isAfter(clock.instant());
  }

  /** Index the relationships already persisted in the store, without re-ingesting. */
  public GraphIndex loadPersisted() {
    commitLock.lock();
    try {
      GraphIndex index = GraphIndex.build(store.listPersons(), store.listEdges(), null);
      current.set(index);
      log.info(
          "Loaded persisted graph with {} persons and {} relationships",
          index.nodeCount(),
          index.edgeCount());
      return index;
    } finally {
      commitLock.unlock();
    }
  }

  /**
   * Recompute every relationship from the evidence in the store and publish the result. Returns
   * the statistics of the previous rebuild without doing anything when a rebuild is already in
   * progress.
   *
   * @throws EvidenceStoreException when the store cannot be read or written; the persisted
   *     relationships and the current snapshot are left untouched
   */
  public GraphStats rebuildGraph() {
    if (!rebuildLock.tryLock()) {
      log.info("Rebuild already in progress, returning previous statistics");
      return lastStats.get();
    }
    try {
      return doRebuild();
    } finally {
      rebuildLock.unlock();
    }
  }

  /** Rebuild even if a rebuild is running: waits for it to finish, then starts a fresh one. */
  public GraphStats forceRebuild() {
    rebuildLock.lock();
    try {
      return doRebuild();
    } finally {
      rebuildLock.unlock();
    }
  }

  /** Rebuild only when {@link #shouldRebuild()} says the graph is stale. */
  public GraphStats rebuildIfStale() {
    return shouldRebuild() ? rebuildGraph() : lastStats.get();
  }

  private GraphStats doRebuild() {
    long started = System.nanoTime();
    log.info("Starting graph rebuild from '{}' evidence store", store.driver());

    List<Person> persons;
    try {
      persons = store.listPersons();
    } catch (EvidenceStoreException e) {
      log.error("Evidence store unreadable, keeping the existing graph", e);
      throw e;
    }
    IngestionResult result = ingestion.ingest(persons);

    GraphStats stats;
    commitLock.lock();
    try {
      List<Person> latest = store.listPersons();
      List<Relationship> edges = reconcileActivations(persons, latest, result.edges());
      store.replaceEdges(edges);
      Instant committedAt = clock.instant();
      GraphIndex index = GraphIndex.build(latest, edges, committedAt);
      current.set(index);
      stats =
          computeStats(
              latest,
              edges,
              result,
              committedAt,
              (System.nanoTime() - started) / 1_000_000);
      lastStats.set(stats);
    } catch (EvidenceStoreException e) {
      log.error("Failed to commit rebuilt relationships, keeping the existing graph", e);
      throw e;
    } finally {
      commitLock.unlock();
    }

    logStats(stats);
    return stats;
  }

  /**
   * Persons activated while ingestion was running were ingested as ghosts. Lift the ghost discount
   * from their edges so the committed set matches their verified state.
   */
  private List<Relationship> reconcileActivations(
      List<Person> ingested, List<Person> latest, List<Relationship> edges) {
    Set<String> wereGhosts = new HashSet<>();
    ingested.stream().filter(Person::ghost).forEach(p -> wereGhosts.add(p.id()));
    Set<String> activated = new HashSet<>();
    Map<String, Boolean> ghostNow = new HashMap<>();
    for (Person p : latest) {
      ghostNow.put(p.id(), p.ghost());
      if (wereGhosts.contains(p.id()) && !p.ghost()) activated.add(p.id());
    }
    if (activated.isEmpty()) return edges;

    log.info("Reconciling {} persons activated during the rebuild", activated.size());
    Predicate<String> isGhost = id -> ghostNow.getOrDefault(id, false);
    List<Relationship> out = new ArrayList<>(edges.size());
    for (Relationship r : edges) {
      Relationship next = r;
      if (activated.contains(r.fromPersonId())) {
        next = ConfidencePolicy.boost(next, ConfidencePolicy.GHOST_PENALTY, isGhost);
      }
      if (activated.contains(r.toPersonId())) {
        next = ConfidencePolicy.boost(next, ConfidencePolicy.GHOST_PENALTY, isGhost);
      }
      out.add(next);
    }
    return out;
  }

  /** Promote a ghost person with nothing else to commit alongside. */
  public List<Relationship> applyActivation(
      String personId, UnaryOperator<Person> promotion, int confidenceBoost) {
    return applyActivation(personId, promotion, confidenceBoost, () -> true);
  }

  /**
   * Promote a ghost person and re-weight every relationship touching them, without re-ingesting.
   * The ghost check and all writes happen under the commit lock, so a person is promoted once.
   *
   * @param promotion derives the promoted person from the stored one
   * @param confidenceBoost added to the confidence of each touching relationship, capped at 100
   * @param commit runs last, after the person and its relationships are written; returning false
   *     or throwing puts both back as they were
   * @return the relationships after re-weighting
   * @throws NotFoundException when the person does not exist
   * @throws StateException when the person is no longer a ghost or {@code commit} returned false
   */
  public List<Relationship> applyActivation(
      String personId,
      UnaryOperator<Person> promotion,
      int confidenceBoost,
      BooleanSupplier commit) {
    commitLock.lock();
    try {
      Person stored =
          store
              .findPerson(personId)
              .orElseThrow(() -> new NotFoundException("Unknown person: " + personId));
      if (!stored.ghost()) {
        throw new StateException(
            "Person is already verified: " + personId, Map.of("personId", personId));
      }
      Person promoted = promotion.apply(stored);

      Predicate<String> isGhost =
          id ->
              id.equals(promoted.id())
                  ? promoted.ghost()
                  : store.findPerson(id).map(Person::ghost).orElse(false);
      List<Relationship> original = new ArrayList<>();
      List<Relationship> changed = new ArrayList<>();
      for (Relationship r : store.listEdges()) {
        if (r.touches(personId)) {
          original.add(r);
          changed.add(ConfidencePolicy.boost(r, confidenceBoost, isGhost));
        }
      }
      store.upsertEdges(changed);
      try {
        store.savePerson(promoted);
      } catch (EvidenceStoreException e) {
        // the person is still a ghost, so are its edges
        store.upsertEdges(original);
        throw e;
      }
      boolean committed;
      try {
        committed = commit.getAsBoolean();
      } catch (RuntimeException e) {
        revert(stored, original);
        throw e;
      }
      if (!committed) {
        revert(stored, original);
        throw new StateException(
            "Activation of " + personId + " was not committed", Map.of("personId", personId));
      }
      current.set(current.get().withChanges(promoted, changed));
      log.info("Activated person {} and re-weighted {} relationships", personId, changed.size());
      return changed;
    } finally {
      commitLock.unlock();
    }
  }

  private void revert(Person stored, List<Relationship> original) {
    log.debug("Reverting activation of {}", stored.id());
    store.savePerson(stored);
    store.upsertEdges(original);
  }

  private GraphStats computeStats(
      List<Person> persons,
      List<Relationship> edges,
      IngestionResult result,
      Instant committedAt,
      long durationMillis) {
    Map<String, Integer> byType = new LinkedHashMap<>();
    for (RelationshipType t : RelationshipType.values()) byType.put(t.name(), 0);
    edges.forEach(r -> byType.merge(r.type().name(), 1, Integer::sum));

    Map<String, String> companyNames = new HashMap<>();
    Map<String, Integer> companyCounts = new HashMap<>();
    for (Person p : persons) {
      if (TextNormalizer.isBlank(p.company())) continue;
      String key = TextNormalizer.normalizeCompany(p.company());
      companyNames.putIfAbsent(key, p.company().trim());
      companyCounts.merge(key, 1, Integer::sum);
    }
    Map<String, Integer> topCompanies = new LinkedHashMap<>();
    companyCounts.entrySet().stream()
        .sorted(
            Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.comparingByKey()))
        .limit(TOP_COMPANIES)
        .forEach(e -> topCompanies.put(companyNames.get(e.getKey()), e.getValue()));

    int ghosts = (int) persons.stream().filter(Person::ghost).count();
    return new GraphStats(
        persons.size(),
        edges.size(),
        ghosts,
        byType,
        topCompanies,
        committedAt,
        durationMillis,
        result.pairsBySource(),
        result.skippedSources(),
        IntegrityReport.inspect(persons, edges));
  }

  private void logStats(GraphStats stats) {
    log.info(
        "Graph rebuilt: {} persons ({} ghosts), {} relationships in {} ms",
        stats.nodes(),
        stats.ghostNodes(),
        stats.edges(),
        stats.durationMillis());
    log.info("Relationship breakdown: {}", stats.relationshipBreakdown());
    log.debug("Top companies: {}", stats.companyBreakdown());
    if (!stats.skippedSources().isEmpty()) {
      log.warn("Skipped evidence sources: {}", stats.skippedSources());
    }
    IntegrityReport integrity = stats.integrity();
    if (integrity.healthy()) {
      log.info("Integrity check passed, {} isolated persons", integrity.isolatedPersons());
    } else {
      log.warn(
          "Integrity check failed: {} orphaned, {} duplicate, {} asymmetric relationships",
          integrity.orphanedEdges(),
          integrity.duplicateEdges(),
          integrity.asymmetricEdges());
    }
  }
}
