package com.gentoro.warmpath.activation;

import java.time.Instant;

/**
 * Outcome of creating an invitation. The invitation exists even when {@code emailSent} is false;
 * {@code dispatchError} then carries the reason.
 */
public record InvitationReceipt(
    String inviteId, String token, boolean emailSent, Instant expiresAt, String dispatchError) {}
