package com.gentoro.warmpath.activation;

import java.util.List;

/**
 * Invitation funnel counters. {@code conversionRate} is the accepted share of all invitations, as
 * a percentage rounded to two decimals.
 */
public record InviteStats(
    int totalSent,
    int accepted,
    int expired,
    int pending,
    double conversionRate,
    List<InvitationSummary> recent) {}
