package com.gentoro.warmpath.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Request sent to a ghost person so that they claim their profile. Invitations are immutable
 * values; status changes produce a new instance that the store swaps in with a compare-and-set.
 */
public record Invitation(
    String id,
    String ghostPersonId,
    String requesterId,
    String targetId,
    String token,
    InvitationStatus status,
    boolean emailSent,
    String dispatchError,
    Instant createdAt,
    Instant expiresAt,
    Instant activatedAt,
    Instant expiredAt) {

  public Invitation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(status, "status");
  }

  public boolean isOverdue(Instant now) {
    return status == InvitationStatus.SENT && expiresAt != null && now.isAfter(expiresAt);
  }

  public Invitation accepted(Instant at) {
    return new Invitation(
        id,
        ghostPersonId,
        requesterId,
        targetId,
        token,
        InvitationStatus.ACCEPTED,
        emailSent,
        dispatchError,
        createdAt,
        expiresAt,
        at,
        null);
  }

  public Invitation expired(Instant at) {
    return new Invitation(
        id,
        ghostPersonId,
        requesterId,
        targetId,
        token,
        InvitationStatus.EXPIRED,
        emailSent,
        dispatchError,
        createdAt,
        expiresAt,
        null,
        at);
  }

  public Invitation withDispatchOutcome(boolean sent, String error) {
    return new Invitation(
        id,
        ghostPersonId,
        requesterId,
        targetId,
        token,
        status,
        sent,
        error,
        createdAt,
        expiresAt,
        activatedAt,
        expiredAt);
  }
}
