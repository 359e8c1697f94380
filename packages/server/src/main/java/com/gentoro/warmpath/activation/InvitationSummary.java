package com.gentoro.warmpath.activation;

import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import java.time.Instant;

/** Invitation as reported in statistics, without its token. */
public record InvitationSummary(
    String id,
    String ghostPersonId,
    String requesterId,
    String targetId,
    InvitationStatus status,
    boolean emailSent,
    Instant createdAt,
    Instant expiresAt) {

  static InvitationSummary of(Invitation invitation) {
    return new InvitationSummary(
        invitation.id(),
        invitation.ghostPersonId(),
        invitation.requesterId(),
        invitation.targetId(),
        invitation.status(),
        invitation.emailSent(),
        invitation.createdAt(),
        invitation.expiresAt());
  }
}
