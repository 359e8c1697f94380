package com.gentoro.warmpath.activation;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.warmpath.TestNetworks;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.exception.NotFoundException;
import com.gentoro.warmpath.exception.NotificationException;
import com.gentoro.warmpath.exception.StateException;
import com.gentoro.warmpath.exception.ValidationException;
import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.notification.InvitationNotification;
import com.gentoro.warmpath.notification.NotificationDispatcher;
import com.gentoro.warmpath.store.InMemoryEvidenceStore;
import com.gentoro.warmpath.store.StoreSnapshot;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("Invitation lifecycle")
@ExtendWith(MockitoExtension.class)
class InvitationServiceTest {

  @Mock private NotificationDispatcher dispatcher;
  private TestNetworks.MutableClock clock;
  private ExecutorService pool;

  @BeforeEach
  void setUp() {
    lenient().when(dispatcher.id()).thenReturn("mock");
    clock = new TestNetworks.MutableClock(TestNetworks.NOW);
  }

  @AfterEach
  void tearDown() {
    if (pool != null) pool.shutdownNow();
  }

  /** Alex, Jamie and Sam where Sam is a ghost with a known email address. */
  private static List<Person> withGhostSam() {
    List<Person> persons = new ArrayList<>(TestNetworks.alexJamieSam());
    persons.set(
        2, persons.get(2).toBuilder().ghost(true).email("sam@example.com").trustScore(30).build());
    return persons;
  }

  private TestNetworks.Services services(InMemoryEvidenceStore store, Clock clock) {
    TestNetworks.Services services =
        new TestNetworks.Services(TestNetworks.configuration(), store, dispatcher, clock);
    services.graph.rebuildGraph();
    return services;
  }

  private TestNetworks.Services services() {
    return services(TestNetworks.store(withGhostSam()), clock);
  }

  private static Relationship edge(TestNetworks.Services s, String from, String to) {
    return s.graph.snapshot().strongestEdge(from, to).orElseThrow();
  }

  @Test
  @DisplayName("Creating an invitation stores it and dispatches the rendered message")
  void createsInvitation() {
    TestNetworks.Services s = services();

    InvitationReceipt receipt = s.invitations.createInvitation("sam", "alex", "jamie");

    assertTrue(receipt.emailSent());
    assertNull(receipt.dispatchError());
    assertEquals(64, receipt.token().length());
    assertEquals(TestNetworks.NOW.plus(Duration.ofDays(7)), receipt.expiresAt());

    Invitation stored = s.store.findInvitation(receipt.inviteId()).orElseThrow();
    assertEquals(InvitationStatus.SENT, stored.status());
    assertTrue(stored.emailSent());

    ArgumentCaptor<InvitationNotification> sent =
        ArgumentCaptor.forClass(InvitationNotification.class);
    verify(dispatcher).dispatch(sent.capture());
    InvitationNotification message = sent.getValue();
    assertEquals("sam@example.com", message.recipientEmail());
    assertEquals("Alex Rivera would like your help connecting with Jamie Lee", message.subject());
    assertEquals(
        "http://localhost:8080/activate?token=" + receipt.token(), message.activationUrl());
    assertTrue(message.body().startsWith("Hi Sam Patel,"));
    assertTrue(message.body().contains("Jamie Lee at Acme Corp"));
  }

  @Test
  @DisplayName("Invitations need an existing ghost, requester and target")
  void rejectsInvalidInvitations() {
    TestNetworks.Services s = services();

    assertThrows(ValidationException.class, () -> s.invitations.createInvitation(" ", "a", "b"));
    NotFoundException missing =
        assertThrows(
            NotFoundException.class,
            () -> s.invitations.createInvitation("nobody", "alex", "jamie"));
    assertEquals("Unknown ghost person: nobody", missing.getMessage());
    assertThrows(
        NotFoundException.class, () -> s.invitations.createInvitation("sam", "alex", "nobody"));
    StateException active =
        assertThrows(
            StateException.class, () -> s.invitations.createInvitation("jamie", "alex", "sam"));
    assertEquals(InvitationService.ALREADY_ACTIVE, active.getMessage());
    assertTrue(s.store.listInvitations().isEmpty());
  }

  @Test
  @DisplayName("A failed delivery is recorded but the invitation stays valid")
  void recordsDispatchFailure() {
    doThrow(new NotificationException("gateway down")).when(dispatcher).dispatch(any());
    TestNetworks.Services s = services();

    InvitationReceipt receipt = s.invitations.createInvitation("sam", "alex", "jamie");

    assertFalse(receipt.emailSent());
    assertEquals("gateway down", receipt.dispatchError());
    Invitation stored = s.store.findInvitation(receipt.inviteId()).orElseThrow();
    assertFalse(stored.emailSent());
    assertEquals("gateway down", stored.dispatchError());
    assertTrue(s.invitations.activateProfile(receipt.token(), ActivationData.none()).success());
  }

  @Test
  @DisplayName("Activation verifies the ghost and raises the confidence of its relationships")
  void activatesProfile() {
    TestNetworks.Services s = services();
    assertEquals(60, edge(s, "jamie", "sam").confidence());
    String token = s.invitations.createInvitation("sam", "alex", "jamie").token();

    ActivationResult result =
        s.invitations.activateProfile(
            token, new ActivationData(null, "sam.patel@globex.com", " ", "CTO", "Berlin"));

    assertEquals(new ActivationResult(true, "sam", "Profile activated"), result);
    Person sam = s.store.findPerson("sam").orElseThrow();
    assertFalse(sam.ghost());
    assertEquals(90, sam.trustScore());
    assertEquals("Sam Patel", sam.name());
    assertEquals("sam.patel@globex.com", sam.email());
    assertEquals("Globex", sam.company());
    assertEquals("CTO", sam.title());
    assertEquals("Berlin", sam.location());
    assertEquals(TestNetworks.NOW, sam.updatedAt());

    Relationship boosted = edge(s, "jamie", "sam");
    assertEquals(RelationshipType.EDUCATION, boosted.type());
    assertEquals(100, boosted.confidence());
    assertFalse(boosted.ghost());
    assertEquals(100, edge(s, "sam", "jamie").confidence());
    assertFalse(s.graph.snapshot().person("sam").orElseThrow().ghost());

    Invitation stored = s.invitations.findByToken(token).orElseThrow();
    assertEquals(InvitationStatus.ACCEPTED, stored.status());
    assertEquals(TestNetworks.NOW, stored.activatedAt());
  }

  @Test
  @DisplayName("A token works once")
  void tokenIsSingleUse() {
    TestNetworks.Services s = services();
    String token = s.invitations.createInvitation("sam", "alex", "jamie").token();

    assertTrue(s.invitations.activateProfile(token, ActivationData.none()).success());
    ActivationResult again = s.invitations.activateProfile(token, ActivationData.none());

    assertFalse(again.success());
    assertEquals(InvitationService.ALREADY_USED, again.message());
    assertEquals("sam", again.userId());
  }

  @Test
  void unknownTokens() {
    TestNetworks.Services s = services();

    assertEquals(
        InvitationService.INVALID_TOKEN,
        s.invitations.activateProfile("deadbeef", ActivationData.none()).message());
    assertEquals(
        InvitationService.INVALID_TOKEN, s.invitations.activateProfile(null, null).message());
    assertTrue(s.invitations.findByToken("deadbeef").isEmpty());
  }

  @Test
  @DisplayName("Overdue invitations expire lazily and in the sweep")
  void expiresOverdueInvitations() {
    TestNetworks.Services s = services();
    String first = s.invitations.createInvitation("sam", "alex", "jamie").token();
    String second = s.invitations.createInvitation("sam", "jamie", "alex").token();

    clock.advance(Duration.ofDays(7));
    assertEquals(0, s.invitations.expireOverdue());
    clock.advance(Duration.ofSeconds(1));

    ActivationResult late = s.invitations.activateProfile(first, ActivationData.none());
    assertFalse(late.success());
    assertEquals(InvitationService.EXPIRED, late.message());
    assertEquals(InvitationStatus.EXPIRED, s.invitations.findByToken(first).get().status());
    assertTrue(s.store.findPerson("sam").orElseThrow().ghost());

    assertEquals(1, s.invitations.expireOverdue());
    Invitation swept = s.store.findInvitationByToken(second).orElseThrow();
    assertEquals(InvitationStatus.EXPIRED, swept.status());
    assertEquals(clock.instant(), swept.expiredAt());
    assertEquals(
        InvitationService.EXPIRED,
        s.invitations.activateProfile(second, ActivationData.none()).message());
  }

  @Test
  @DisplayName("Concurrent activations of one token produce exactly one success")
  void concurrentActivation() throws Exception {
    TestNetworks.Services s = services();
    String token = s.invitations.createInvitation("sam", "alex", "jamie").token();
    int threads = 8;
    pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);

    List<Future<ActivationResult>> futures = new ArrayList<>();
    for (int i = 0; i < threads; i++) {
      Callable<ActivationResult> attempt =
          () -> {
            start.await();
            return s.invitations.activateProfile(token, ActivationData.none());
          };
      futures.add(pool.submit(attempt));
    }
    start.countDown();

    int successes = 0;
    for (Future<ActivationResult> f : futures) {
      ActivationResult r = f.get(10, TimeUnit.SECONDS);
      if (r.success()) {
        successes++;
      } else {
        assertEquals(InvitationService.ALREADY_USED, r.message());
      }
    }
    assertEquals(1, successes);
  }

  @Test
  @DisplayName("Two invitations of one ghost used at the same time promote the ghost once")
  void concurrentInvitationsOfOneGhost() throws Exception {
    List<Person> persons = withGhostSam();
    persons.set(1, persons.get(1).toBuilder().ghost(true).build());
    CountDownLatch bothRead = new CountDownLatch(2);
    AtomicBoolean gated = new AtomicBoolean();
    InMemoryEvidenceStore store =
        new InMemoryEvidenceStore(new StoreSnapshot(persons, List.of(), List.of())) {
          @Override
          public Optional<Invitation> findInvitationByToken(String token) {
            Optional<Invitation> found = super.findInvitationByToken(token);
            if (gated.get()) {
              bothRead.countDown();
              try {
                bothRead.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            }
            return found;
          }
        };
    TestNetworks.Services s = services(store, clock);
    assertEquals(20, edge(s, "sam", "jamie").confidence());
    String first = s.invitations.createInvitation("sam", "alex", "jamie").token();
    String second = s.invitations.createInvitation("sam", "alex", "jamie").token();
    gated.set(true);

    pool = Executors.newFixedThreadPool(2);
    Future<ActivationResult> a =
        pool.submit(() -> s.invitations.activateProfile(first, ActivationData.none()));
    Future<ActivationResult> b =
        pool.submit(() -> s.invitations.activateProfile(second, ActivationData.none()));
    List<ActivationResult> results =
        List.of(a.get(10, TimeUnit.SECONDS), b.get(10, TimeUnit.SECONDS));
    gated.set(false);

    assertEquals(1, results.stream().filter(ActivationResult::success).count());
    ActivationResult loser = results.stream().filter(r -> !r.success()).findFirst().get();
    assertEquals(InvitationService.ALREADY_ACTIVE, loser.message());

    assertFalse(store.findPerson("sam").orElseThrow().ghost());
    Relationship samJamie = edge(s, "sam", "jamie");
    assertEquals(60, samJamie.confidence());
    assertTrue(samJamie.ghost());
    assertTrue(
        store.listEdges().stream()
            .filter(r -> r.touches("sam"))
            .allMatch(r -> r.confidence() == 60));
    assertEquals(
        List.of(InvitationStatus.ACCEPTED, InvitationStatus.EXPIRED),
        store.listInvitations().stream().map(Invitation::status).sorted().toList());
  }

  @Test
  @DisplayName("Accepting one invitation closes the other pending invitations of that ghost")
  void acceptingExpiresSiblings() {
    TestNetworks.Services s = services();
    String used = s.invitations.createInvitation("sam", "alex", "jamie").token();
    String pending = s.invitations.createInvitation("sam", "jamie", "alex").token();

    assertTrue(s.invitations.activateProfile(used, ActivationData.none()).success());

    Invitation closed = s.store.findInvitationByToken(pending).orElseThrow();
    assertEquals(InvitationStatus.EXPIRED, closed.status());
    assertEquals(TestNetworks.NOW, closed.expiredAt());
    assertEquals(
        InvitationService.EXPIRED,
        s.invitations.activateProfile(pending, ActivationData.none()).message());
  }

  @Test
  @DisplayName("An activation is undone when its invitation changed state meanwhile")
  void declinedCommitRevertsActivation() {
    InMemoryEvidenceStore store = spy(TestNetworks.store(withGhostSam()));
    TestNetworks.Services s = services(store, clock);
    String token = s.invitations.createInvitation("sam", "alex", "jamie").token();
    doAnswer(
            call -> {
              Invitation current = store.findInvitationByToken(token).orElseThrow();
              store.compareAndSetInvitation(
                  current.id(), InvitationStatus.SENT, current.expired(clock.instant()));
              return call.callRealMethod();
            })
        .when(store)
        .savePerson(any());

    ActivationResult result = s.invitations.activateProfile(token, ActivationData.none());

    assertFalse(result.success());
    assertEquals(InvitationService.EXPIRED, result.message());
    assertTrue(store.findPerson("sam").orElseThrow().ghost());
    assertEquals(
        InvitationStatus.EXPIRED, store.findInvitationByToken(token).orElseThrow().status());
    assertTrue(
        store.listEdges().stream()
            .filter(r -> r.touches("sam"))
            .allMatch(r -> r.confidence() == 60));
    assertTrue(s.graph.snapshot().person("sam").orElseThrow().ghost());
  }

  @Test
  @DisplayName("A store failure during activation leaves the token usable")
  void storeFailureRollsBack() {
    InMemoryEvidenceStore store = spy(TestNetworks.store(withGhostSam()));
    TestNetworks.Services s = services(store, clock);
    String token = s.invitations.createInvitation("sam", "alex", "jamie").token();
    doThrow(new EvidenceStoreException("disk full")).when(store).savePerson(any());

    assertThrows(
        EvidenceStoreException.class,
        () -> s.invitations.activateProfile(token, ActivationData.none()));

    assertEquals(InvitationStatus.SENT, store.findInvitationByToken(token).get().status());
    assertTrue(store.findPerson("sam").orElseThrow().ghost());
    assertTrue(
        store.listEdges().stream()
            .filter(r -> r.touches("sam"))
            .allMatch(r -> r.confidence() == 60));

    doCallRealMethod().when(store).savePerson(any());
    assertTrue(s.invitations.activateProfile(token, ActivationData.none()).success());
  }

  @Test
  @DisplayName("Token collisions are retried with a fresh token")
  void retriesTokenCollision() {
    TokenGenerator tokens = mock(TokenGenerator.class);
    when(tokens.next()).thenReturn("same", "same", "fresh");
    InMemoryEvidenceStore store = TestNetworks.store(withGhostSam());
    TestNetworks.Services s = services(store, clock);
    InvitationService invitations =
        new InvitationService(
            TestNetworks.configuration(),
            store,
            s.graph,
            dispatcher,
            new com.gentoro.warmpath.notification.InvitationMessageRenderer(),
            tokens,
            clock);

    assertEquals("same", invitations.createInvitation("sam", "alex", "jamie").token());
    assertEquals("fresh", invitations.createInvitation("sam", "jamie", "alex").token());
  }

  @Test
  @DisplayName("Statistics count every status and list the latest invitations first")
  void stats() {
    TestNetworks.Services s = services();
    Invitation old =
        s.store
            .findInvitation(s.invitations.createInvitation("sam", "alex", "jamie").inviteId())
            .orElseThrow();
    clock.advance(Duration.ofDays(8));
    String accepted = s.invitations.createInvitation("sam", "jamie", "alex").token();
    s.invitations.createInvitation("sam", "alex", "jamie");
    assertTrue(s.invitations.activateProfile(accepted, ActivationData.none()).success());

    InviteStats stats = s.invitations.stats();

    assertEquals(3, stats.totalSent());
    assertEquals(1, stats.accepted());
    assertEquals(2, stats.expired());
    assertEquals(0, stats.pending());
    assertEquals(33.33, stats.conversionRate(), 1e-9);
    assertEquals(3, stats.recent().size());
    assertEquals(old.id(), stats.recent().get(2).id());
    assertEquals(InvitationStatus.EXPIRED, stats.recent().get(2).status());
  }

  @Test
  void emptyStats() {
    InviteStats stats = services().invitations.stats();

    assertEquals(0, stats.totalSent());
    assertEquals(0.0, stats.conversionRate());
    assertTrue(stats.recent().isEmpty());
  }
}
