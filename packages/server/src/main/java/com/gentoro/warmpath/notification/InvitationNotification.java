package com.gentoro.warmpath.notification;

import java.time.Instant;

/** Rendered invitation ready to be delivered to a ghost person. */
public record InvitationNotification(
    String invitationId,
    String recipientName,
    String recipientEmail,
    String requesterName,
    String subject,
    String body,
    String activationUrl,
    Instant expiresAt) {}
