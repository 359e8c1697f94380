package com.gentoro.warmpath.store;

import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Evidence store kept entirely in process memory.
 *
 * <p>The relationship set is held as one immutable map swapped by reference, so {@link
 * #replaceEdges(Collection)} is atomic for readers. Invitation status changes go through {@link
 * ConcurrentHashMap#compute}, which makes the compare-and-set atomic per invitation.
 */
public class InMemoryEvidenceStore implements EvidenceStore {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(InMemoryEvidenceStore.class);

  private final Map<String, Person> persons = new ConcurrentHashMap<>();
  private final Map<String, Invitation> invitations = new ConcurrentHashMap<>();
  private final Map<String, String> invitationIdsByToken = new ConcurrentHashMap<>();
  private final Object edgeLock = new Object();
  private volatile Map<String, Relationship> edges = Map.of();

  public InMemoryEvidenceStore() {}

  public InMemoryEvidenceStore(StoreSnapshot snapshot) {
    load(snapshot);
  }

  /** Replace the whole content of this store with the given snapshot. */
  protected void load(StoreSnapshot snapshot) {
    persons.clear();
    invitations.clear();
    invitationIdsByToken.clear();
    snapshot.persons().forEach(p -> persons.put(p.id(), p));
    snapshot
        .invitations()
        .forEach(
            i -> {
              invitations.put(i.id(), i);
              invitationIdsByToken.put(i.token(), i.id());
            });
    synchronized (edgeLock) {
      edges = index(snapshot.relationships());
    }
    log.debug(
        "Loaded {} persons, {} relationships and {} invitations",
        persons.size(),
        edges.size(),
        invitations.size());
  }

  /** Current content as a snapshot, in canonical order. */
  public StoreSnapshot snapshot() {
    return new StoreSnapshot(listPersons(), listEdges(), listInvitations());
  }

  @Override
  public String driver() {
    return "in-memory";
  }

  @Override
  public List<Person> listPersons() {
    List<Person> out = new ArrayList<>(persons.values());
    out.sort(Comparator.comparing(Person::id));
    return out;
  }

  @Override
  public Optional<Person> findPerson(String personId) {
    if (personId == null) return Optional.empty();
    return Optional.ofNullable(persons.get(personId));
  }

  @Override
  public void savePerson(Person person) {
    Objects.requireNonNull(person, "person");
    persons.put(person.id(), person);
  }

  @Override
  public List<Relationship> listEdges() {
    List<Relationship> out = new ArrayList<>(edges.values());
    out.sort(Relationship.ORDER);
    return out;
  }

  @Override
  public void replaceEdges(Collection<Relationship> newEdges) {
    Map<String, Relationship> next = index(newEdges);
    synchronized (edgeLock) {
      edges = next;
    }
  }

  @Override
  public void upsertEdges(Collection<Relationship> changed) {
    synchronized (edgeLock) {
      Map<String, Relationship> next = new LinkedHashMap<>(edges);
      changed.forEach(r -> next.put(r.key(), r));
      edges = Collections.unmodifiableMap(next);
    }
  }

  @Override
  public boolean insertInvitation(Invitation invitation) {
    if (invitationIdsByToken.putIfAbsent(invitation.token(), invitation.id()) != null) {
      return false;
    }
    invitations.put(invitation.id(), invitation);
    return true;
  }

  @Override
  public Optional<Invitation> findInvitation(String invitationId) {
    if (invitationId == null) return Optional.empty();
    return Optional.ofNullable(invitations.get(invitationId));
  }

  @Override
  public Optional<Invitation> findInvitationByToken(String token) {
    if (token == null) return Optional.empty();
    String id = invitationIdsByToken.get(token);
    return id == null ? Optional.empty() : findInvitation(id);
  }

  @Override
  public List<Invitation> listInvitations() {
    List<Invitation> out = new ArrayList<>(invitations.values());
    out.sort(
        Comparator.comparing(
                Invitation::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(Invitation::id));
    return out;
  }

  @Override
  public boolean compareAndSetInvitation(
      String invitationId, InvitationStatus expected, Invitation replacement) {
    AtomicBoolean swapped = new AtomicBoolean(false);
    invitations.computeIfPresent(
        invitationId,
        (id, current) -> {
          if (current.status() != expected) {
            return current;
          }
          swapped.set(true);
          return replacement;
        });
    return swapped.get();
  }

  @Override
  public void recordDispatchOutcome(String invitationId, boolean emailSent, String dispatchError) {
    invitations.computeIfPresent(
        invitationId, (id, current) -> current.withDispatchOutcome(emailSent, dispatchError));
  }

  private static Map<String, Relationship> index(Collection<Relationship> relationships) {
    Map<String, Relationship> m = new LinkedHashMap<>();
    relationships.forEach(r -> m.put(r.key(), r));
    return Collections.unmodifiableMap(m);
  }
}
