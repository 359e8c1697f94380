package com.gentoro.warmpath.graph;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.warmpath.TestNetworks;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.exception.StateException;
import com.gentoro.warmpath.ingestion.EdgeCollector;
import com.gentoro.warmpath.ingestion.EvidenceSource;
import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.ingestion.RelationshipIngestionService;
import com.gentoro.warmpath.ingestion.source.CoworkerEvidenceSource;
import com.gentoro.warmpath.model.Employment;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.store.InMemoryEvidenceStore;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Graph service")
class GraphServiceTest {

  private BaseConfiguration configuration;

  @BeforeEach
  void setUp() {
    configuration = TestNetworks.configuration();
  }

  private GraphService service(EvidenceStore store) {
    return new GraphService(
        configuration,
        store,
        new RelationshipIngestionService(configuration, TestNetworks.CLOCK),
        TestNetworks.CLOCK);
  }

  @Test
  @DisplayName("Rebuild replaces persisted edges, publishes a snapshot and reports statistics")
  void rebuildPublishesSnapshot() {
    InMemoryEvidenceStore store = TestNetworks.store(TestNetworks.alexJamieSam());
    GraphService service = service(store);

    GraphStats stats = service.rebuildGraph();

    assertEquals(3, stats.nodes());
    assertEquals(4, stats.edges());
    assertEquals(2, stats.relationshipBreakdown().get("COWORKER"));
    assertEquals(2, stats.relationshipBreakdown().get("EDUCATION"));
    assertEquals(0, stats.relationshipBreakdown().get("SOCIAL"));
    assertEquals(2, stats.companyBreakdown().get("Acme Corp"));
    assertEquals(TestNetworks.NOW, stats.lastRebuild());
    assertTrue(stats.integrity().healthy());
    assertEquals(0, stats.integrity().isolatedPersons());

    assertEquals(4, store.listEdges().size());
    assertEquals(3, service.snapshot().nodeCount());
    assertEquals(4, service.snapshot().edgeCount());
    assertEquals(stats, service.stats());
  }

  @Test
  @DisplayName("An unreadable store aborts the rebuild without touching anything")
  void unreadableStoreAbortsRebuild() {
    EvidenceStore store = mock(EvidenceStore.class);
    when(store.driver()).thenReturn("mock");
    when(store.listPersons()).thenThrow(new EvidenceStoreException("store offline"));
    GraphService service = service(store);
    GraphIndex before = service.snapshot();

    assertThrows(EvidenceStoreException.class, service::rebuildGraph);

    verify(store, never()).replaceEdges(any());
    assertSame(before, service.snapshot());
    assertNull(service.stats().lastRebuild());
    assertFalse(service.isRebuilding());
  }

  @Test
  @DisplayName("A failed commit keeps the previous generation in store and snapshot")
  void failedCommitKeepsPreviousGeneration() {
    InMemoryEvidenceStore store = spy(TestNetworks.store(TestNetworks.alexJamieSam()));
    GraphService service = service(store);
    service.rebuildGraph();
    GraphIndex committed = service.snapshot();
    List<Relationship> persisted = store.listEdges();

    doThrow(new EvidenceStoreException("disk full")).when(store).replaceEdges(any());
    assertThrows(EvidenceStoreException.class, service::rebuildGraph);

    assertSame(committed, service.snapshot());
    assertEquals(persisted, store.listEdges());
  }

  @Test
  @DisplayName("A rebuild requested while another runs returns the previous statistics")
  void concurrentRebuildReturnsPreviousStats() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    EvidenceSource blocking =
        new EvidenceSource() {
          @Override
          public String id() {
            return "blocking";
          }

          @Override
          public void collect(IngestionContext context, EdgeCollector collector) {
            entered.countDown();
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
        };
    InMemoryEvidenceStore store = TestNetworks.store(TestNetworks.alexJamieSam());
    GraphService service =
        new GraphService(
            configuration,
            store,
            new RelationshipIngestionService(
                configuration,
                TestNetworks.CLOCK,
                List.of(blocking, new CoworkerEvidenceSource())),
            TestNetworks.CLOCK);

    CompletableFuture<GraphStats> running = CompletableFuture.supplyAsync(service::rebuildGraph);
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    assertTrue(service.isRebuilding());

    GraphStats concurrent = service.rebuildGraph();
    assertNull(concurrent.lastRebuild());

    release.countDown();
    GraphStats completed = running.get(5, TimeUnit.SECONDS);
    assertEquals(2, completed.edges());
    assertFalse(service.isRebuilding());
  }

  @Test
  @DisplayName("A forced rebuild waits for the running one and then rebuilds again")
  void forcedRebuildWaitsForRunningRebuild() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger runs = new AtomicInteger();
    EvidenceSource blocking =
        new EvidenceSource() {
          @Override
          public String id() {
            return "blocking";
          }

          @Override
          public void collect(IngestionContext context, EdgeCollector collector) {
            if (runs.incrementAndGet() > 1) return;
            entered.countDown();
            try {
              release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
          }
        };
    GraphService service =
        new GraphService(
            configuration,
            TestNetworks.store(TestNetworks.alexJamieSam()),
            new RelationshipIngestionService(
                configuration,
                TestNetworks.CLOCK,
                List.of(blocking, new CoworkerEvidenceSource())),
            TestNetworks.CLOCK);

    CompletableFuture<GraphStats> running = CompletableFuture.supplyAsync(service::rebuildGraph);
    assertTrue(entered.await(5, TimeUnit.SECONDS));
    CompletableFuture<GraphStats> forced = CompletableFuture.supplyAsync(service::forceRebuild);

    assertThrows(TimeoutException.class, () -> forced.get(200, TimeUnit.MILLISECONDS));
    assertEquals(1, runs.get());

    release.countDown();
    running.get(5, TimeUnit.SECONDS);
    GraphStats stats = forced.get(5, TimeUnit.SECONDS);
    assertEquals(2, runs.get());
    assertEquals(TestNetworks.NOW, stats.lastRebuild());
    assertEquals(2, stats.edges());
  }

  @Test
  @DisplayName("The graph is stale before the first rebuild and once the interval elapsed")
  void stalenessFollowsRebuildInterval() {
    configuration.setProperty("ingestion.schedule.rebuildInterval", "PT1H");
    TestNetworks.MutableClock clock = new TestNetworks.MutableClock(TestNetworks.NOW);
    GraphService service =
        new GraphService(
            configuration,
            TestNetworks.store(TestNetworks.alexJamieSam()),
            new RelationshipIngestionService(configuration, clock),
            clock);

    assertTrue(service.shouldRebuild());
    service.rebuildIfStale();
    assertFalse(service.shouldRebuild());

    clock.advance(Duration.ofMinutes(59));
    assertSame(service.stats(), service.rebuildIfStale());

    clock.advance(Duration.ofMinutes(1));
    assertTrue(service.shouldRebuild());
    assertEquals(clock.instant(), service.rebuildIfStale().lastRebuild());
  }

  @Test
  @DisplayName("Activation promotes the person and lifts the ghost discount of touching edges")
  void activationReweightsTouchingEdges() {
    Person verified =
        Person.builder("v", "Vera Stone")
            .company("Hooli")
            .employment(new Employment("Hooli", "Engineer", 2019, null))
            .build();
    Person ghost =
        Person.builder("g", "Gus Hale")
            .company("Hooli")
            .employment(new Employment("Hooli", "Engineer", 2021, null))
            .ghost(true)
            .build();
    InMemoryEvidenceStore store = TestNetworks.store(List.of(verified, ghost));
    GraphService service = service(store);
    service.rebuildGraph();
    assertEquals(60, service.snapshot().strongestEdge("v", "g").orElseThrow().confidence());

    List<Relationship> changed =
        service.applyActivation("g", p -> p.toBuilder().ghost(false).trustScore(90).build(), 40);

    assertEquals(2, changed.size());
    Relationship edge = service.snapshot().strongestEdge("v", "g").orElseThrow();
    assertEquals(100, edge.confidence());
    assertFalse(edge.ghost());
    assertEquals(true, edge.metadata().get("activated"));
    assertFalse(service.snapshot().person("g").orElseThrow().ghost());
    assertFalse(store.findPerson("g").orElseThrow().ghost());
    assertTrue(store.listEdges().stream().allMatch(r -> r.confidence() == 100));
  }

  @Test
  @DisplayName("A verified person cannot be activated again")
  void secondActivationIsRejected() {
    InMemoryEvidenceStore store = TestNetworks.store(hooliPair());
    GraphService service = service(store);
    service.rebuildGraph();
    service.applyActivation("g", p -> p.toBuilder().ghost(false).build(), 40);

    StateException again =
        assertThrows(
            StateException.class,
            () -> service.applyActivation("g", p -> p.toBuilder().ghost(false).build(), 40));

    assertEquals("Person is already verified: g", again.getMessage());
    assertTrue(store.listEdges().stream().allMatch(r -> r.confidence() == 100));
  }

  @Test
  @DisplayName("A declined commit puts the person and its relationships back")
  void declinedCommitReverts() {
    InMemoryEvidenceStore store = TestNetworks.store(hooliPair());
    GraphService service = service(store);
    service.rebuildGraph();
    GraphIndex before = service.snapshot();

    assertThrows(
        StateException.class,
        () ->
            service.applyActivation(
                "g", p -> p.toBuilder().ghost(false).build(), 40, () -> false));

    assertTrue(store.findPerson("g").orElseThrow().ghost());
    assertTrue(store.listEdges().stream().allMatch(r -> r.confidence() == 60 && r.ghost()));
    assertSame(before, service.snapshot());
  }

  private static List<Person> hooliPair() {
    return List.of(
        Person.builder("v", "Vera Stone")
            .company("Hooli")
            .employment(new Employment("Hooli", "Engineer", 2019, null))
            .build(),
        Person.builder("g", "Gus Hale")
            .company("Hooli")
            .employment(new Employment("Hooli", "Engineer", 2021, null))
            .ghost(true)
            .build());
  }

  @Test
  @DisplayName("Persisted relationships can be indexed without re-ingesting")
  void loadPersistedIndexesStoredEdges() {
    InMemoryEvidenceStore store = TestNetworks.store(TestNetworks.alexJamieSam());
    service(store).rebuildGraph();

    GraphService restarted = service(store);
    GraphIndex index = restarted.loadPersisted();

    assertEquals(4, index.edgeCount());
    assertSame(index, restarted.snapshot());
    assertNull(restarted.stats().lastRebuild());
  }
}
