package com.gentoro.warmpath.store;

import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of persons, their raw evidence, the derived relationships and invitations.
 *
 * <p>Implementations must be safe for concurrent use. Every method may throw {@link
 * com.gentoro.warmpath.exception.EvidenceStoreException} when the backing storage cannot be read or
 * written; no method leaves a partial effect behind when it fails.
 */
public interface EvidenceStore extends AutoCloseable {

  /** Identifier of the driver backing this store, e.g. "in-memory". */
  String driver();

  /** All persons ordered by id. */
  List<Person> listPersons();

  Optional<Person> findPerson(String personId);

  /** Insert or replace a person by id. */
  void savePerson(Person person);

  /** All relationships in {@link Relationship#ORDER}. */
  List<Relationship> listEdges();

  /**
   * Atomically replace the complete relationship set. Readers observe either the previous or the
   * new generation, never a mix.
   */
  void replaceEdges(Collection<Relationship> edges);

  /** Insert or replace individual relationships by their (from, to, type) identity. */
  void upsertEdges(Collection<Relationship> edges);

  /**
   * Store a new invitation.
   *
   * @return false when another invitation already uses the same token; nothing is stored then
   */
  boolean insertInvitation(Invitation invitation);

  Optional<Invitation> findInvitation(String invitationId);

  Optional<Invitation> findInvitationByToken(String token);

  List<Invitation> listInvitations();

  /**
   * Replace an invitation only if its current status equals {@code expected}.
   *
   * @return true if this call performed the swap
   */
  boolean compareAndSetInvitation(
      String invitationId, InvitationStatus expected, Invitation replacement);

  /** Record whether the invitation notification was delivered, leaving its status untouched. */
  void recordDispatchOutcome(String invitationId, boolean emailSent, String dispatchError);

  @Override
  default void close() {}
}
