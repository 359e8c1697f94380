package com.gentoro.warmpath.activation;

import com.gentoro.warmpath.exception.ConfigException;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.exception.NotFoundException;
import com.gentoro.warmpath.exception.NotificationException;
import com.gentoro.warmpath.exception.StateException;
import com.gentoro.warmpath.exception.ValidationException;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.InvitationStatus;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.notification.InvitationMessageRenderer;
import com.gentoro.warmpath.notification.NotificationDispatcher;
import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Invitation lifecycle for ghost persons: SENT, then ACCEPTED or EXPIRED. Both terminal states are
 * final.
 *
 * <p>Status changes go through {@link EvidenceStore#compareAndSetInvitation}, so two concurrent
 * activations of the same token produce exactly one success. Accepting is the last write of an
 * activation and runs under the graph commit lock together with the ghost check, so a person is
 * promoted once even when several of their invitations are used at the same time.
 */
public class InvitationService {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(InvitationService.class);

  static final String INVALID_TOKEN = "Invalid invitation token";
  static final String ALREADY_USED = "Invitation already used";
  static final String EXPIRED = "Invitation has expired";
  static final String ALREADY_ACTIVE = "Profile is already active";
  static final String ACTIVATED = "Profile activated";

  private static final int TOKEN_ATTEMPTS = 3;
  private static final int RECENT_LIMIT = 10;

  private final EvidenceStore store;
  private final GraphService graphService;
  private final NotificationDispatcher dispatcher;
  private final InvitationMessageRenderer renderer;
  private final TokenGenerator tokens;
  private final Clock clock;
  private final Duration invitationTtl;
  private final int trustFloor;
  private final int confidenceBoost;
  private final String baseUrl;

  public InvitationService(
      Configuration configuration,
      EvidenceStore store,
      GraphService graphService,
      NotificationDispatcher dispatcher,
      Clock clock) {
    this(
        configuration,
        store,
        graphService,
        dispatcher,
        new InvitationMessageRenderer(),
        new TokenGenerator(),
        clock);
  }

  public InvitationService(
      Configuration configuration,
      EvidenceStore store,
      GraphService graphService,
      NotificationDispatcher dispatcher,
      InvitationMessageRenderer renderer,
      TokenGenerator tokens,
      Clock clock) {
    this.store = store;
    this.graphService = graphService;
    this.dispatcher = dispatcher;
    this.renderer = renderer;
    this.tokens = tokens;
    this.clock = clock;
    String ttl = configuration.getString("activation.invitationTtl", "P7D");
    try {
      this.invitationTtl = Duration.parse(ttl);
    } catch (DateTimeParseException e) {
      throw new ConfigException("Invalid activation.invitationTtl: " + ttl, Map.of("value", ttl));
    }
    this.trustFloor = configuration.getInt("activation.trustFloor", 90);
    this.confidenceBoost = configuration.getInt("activation.confidenceBoost", 40);
    String url = configuration.getString("activation.baseUrl", "http://localhost:8080");
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /**
   * Create an invitation asking a ghost person to claim their profile, on behalf of a requester
   * who wants to reach the target. Delivery is best effort: a dispatch failure is recorded on the
   * invitation and reported in the receipt.
   *
   * @throws NotFoundException when the ghost, requester or target does not exist
   * @throws StateException when the ghost person has already been activated
   */
  public InvitationReceipt createInvitation(String ghostId, String requesterId, String targetId) {
    require(ghostId, "ghostId");
    require(requesterId, "requesterId");
    require(targetId, "targetId");

    Person ghost = person(ghostId, "ghost");
    if (!ghost.ghost()) {
      throw new StateException(ALREADY_ACTIVE, Map.of("personId", ghostId));
    }
    Person requester = person(requesterId, "requester");
    Person target = person(targetId, "target");

    Instant now = clock.instant();
    Invitation invitation = null;
    for (int attempt = 1; invitation == null; attempt++) {
      Invitation candidate =
          new Invitation(
              UUID.randomUUID().toString(),
              ghostId,
              requesterId,
              targetId,
              tokens.next(),
              InvitationStatus.SENT,
              false,
              null,
              now,
              now.plus(invitationTtl),
              null,
              null);
      if (store.insertInvitation(candidate)) {
        invitation = candidate;
      } else if (attempt >= TOKEN_ATTEMPTS) {
        throw new StateException("Could not allocate a unique invitation token");
      } else {
        log.warn("Invitation token collision, regenerating");
      }
    }

    boolean sent = false;
    String dispatchError = null;
    try {
      dispatcher.dispatch(
          renderer.render(invitation, ghost, requester, target, activationUrl(invitation)));
      sent = true;
    } catch (NotificationException e) {
      dispatchError = e.getMessage();
      log.warn(
          "Invitation {} created but not delivered through {}: {}",
          invitation.id(),
          dispatcher.id(),
          dispatchError);
    }
    store.recordDispatchOutcome(invitation.id(), sent, dispatchError);
    log.info(
        "Invitation {} created for ghost {} (requester {}, target {})",
        invitation.id(),
        ghostId,
        requesterId,
        targetId);
    return new InvitationReceipt(
        invitation.id(), invitation.token(), sent, invitation.expiresAt(), dispatchError);
  }

  /**
   * Claim a ghost profile with an invitation token. Every rejection is reported in the result;
   * only store failures are thrown, and they leave the invitation usable.
   */
  public ActivationResult activateProfile(String token, ActivationData data) {
    if (TextNormalizer.isBlank(token)) {
      return ActivationResult.failed(null, INVALID_TOKEN);
    }
    Optional<Invitation> found = store.findInvitationByToken(token.trim());
    if (found.isEmpty()) {
      return ActivationResult.failed(null, INVALID_TOKEN);
    }
    Invitation invitation = found.get();
    Instant now = clock.instant();
    switch (invitation.status()) {
      case ACCEPTED:
        return ActivationResult.failed(invitation.ghostPersonId(), ALREADY_USED);
      case EXPIRED:
        return ActivationResult.failed(invitation.ghostPersonId(), EXPIRED);
      default:
        break;
    }
    if (invitation.isOverdue(now)) {
      expire(invitation, now);
      return ActivationResult.failed(invitation.ghostPersonId(), EXPIRED);
    }

    // the ghost check and the status change happen together under the graph commit lock
    String ghostId = invitation.ghostPersonId();
    Invitation accepted = invitation.accepted(now);
    ActivationData enrichment = data == null ? ActivationData.none() : data;
    AtomicBoolean committing = new AtomicBoolean();
    try {
      graphService.applyActivation(
          ghostId,
          p -> promote(p, enrichment, now),
          confidenceBoost,
          () -> {
            committing.set(true);
            return store.compareAndSetInvitation(
                invitation.id(), InvitationStatus.SENT, accepted);
          });
    } catch (NotFoundException e) {
      return ActivationResult.failed(null, INVALID_TOKEN);
    } catch (StateException e) {
      InvitationStatus latest =
          store.findInvitation(invitation.id()).map(Invitation::status).orElse(null);
      if (latest == InvitationStatus.ACCEPTED) {
        return ActivationResult.failed(ghostId, ALREADY_USED);
      }
      if (!committing.get()) {
        return ActivationResult.failed(ghostId, ALREADY_ACTIVE);
      }
      return ActivationResult.failed(
          ghostId, latest == InvitationStatus.EXPIRED ? EXPIRED : ALREADY_USED);
    }
    log.info("Ghost {} activated with invitation {}", ghostId, invitation.id());
    expireSiblings(accepted, now);
    return new ActivationResult(true, ghostId, ACTIVATED);
  }

  /** Pending invitations for a person who just claimed their profile can no longer be used. */
  private void expireSiblings(Invitation accepted, Instant now) {
    int count = 0;
    try {
      for (Invitation other : store.listInvitations()) {
        if (other.status() == InvitationStatus.SENT
            && other.ghostPersonId().equals(accepted.ghostPersonId())
            && store.compareAndSetInvitation(
                other.id(), InvitationStatus.SENT, other.expired(now))) {
          count++;
        }
      }
    } catch (EvidenceStoreException e) {
      // the activation itself is committed; leftovers are rejected as already active
      log.warn("Could not expire pending invitations of {}", accepted.ghostPersonId(), e);
    }
    if (count > 0) {
      log.info("Expired {} pending invitation(s) of {}", count, accepted.ghostPersonId());
    }
  }

  /** Look up an invitation by token, expiring it first when it is overdue. */
  public Optional<Invitation> findByToken(String token) {
    if (TextNormalizer.isBlank(token)) return Optional.empty();
    return store
        .findInvitationByToken(token.trim())
        .map(i -> i.isOverdue(clock.instant()) ? expire(i, clock.instant()) : i);
  }

  /** Move every overdue SENT invitation to EXPIRED. Returns how many changed. */
  public int expireOverdue() {
    Instant now = clock.instant();
    int count = 0;
    for (Invitation invitation : store.listInvitations()) {
      if (invitation.isOverdue(now)
          && store.compareAndSetInvitation(
              invitation.id(), InvitationStatus.SENT, invitation.expired(now))) {
        count++;
      }
    }
    if (count > 0) {
      log.info("Expired {} overdue invitation(s)", count);
    }
    return count;
  }

  public InviteStats stats() {
    expireOverdue();
    List<Invitation> all = store.listInvitations();
    int accepted = 0;
    int expired = 0;
    int pending = 0;
    for (Invitation invitation : all) {
      switch (invitation.status()) {
        case ACCEPTED -> accepted++;
        case EXPIRED -> expired++;
        case SENT -> pending++;
      }
    }
    double conversion =
        all.isEmpty() ? 0.0 : Math.round(accepted * 10000.0 / all.size()) / 100.0;
    List<InvitationSummary> recent =
        all.stream()
            .sorted(
                Comparator.comparing(
                        Invitation::createdAt, Comparator.nullsLast(Comparator.reverseOrder()))
                    .thenComparing(Invitation::id))
            .limit(RECENT_LIMIT)
            .map(InvitationSummary::of)
            .toList();
    return new InviteStats(all.size(), accepted, expired, pending, conversion, recent);
  }

  String activationUrl(Invitation invitation) {
    return baseUrl + "/activate?token=" + invitation.token();
  }

  private Person promote(Person stored, ActivationData data, Instant now) {
    Person.Builder b =
        stored
            .toBuilder()
            .ghost(false)
            .trustScore(Math.max(stored.trustScore(), trustFloor))
            .updatedAt(now);
    if (!TextNormalizer.isBlank(data.name())) b.name(data.name().trim());
    if (!TextNormalizer.isBlank(data.email())) b.email(data.email().trim());
    if (!TextNormalizer.isBlank(data.company())) b.company(data.company().trim());
    if (!TextNormalizer.isBlank(data.title())) b.title(data.title().trim());
    if (!TextNormalizer.isBlank(data.location())) b.location(data.location().trim());
    return b.build();
  }

  private Invitation expire(Invitation invitation, Instant now) {
    Invitation expired = invitation.expired(now);
    if (store.compareAndSetInvitation(invitation.id(), InvitationStatus.SENT, expired)) {
      log.debug("Invitation {} expired", invitation.id());
      return expired;
    }
    return store.findInvitation(invitation.id()).orElse(expired);
  }

  private Person person(String id, String role) {
    return store
        .findPerson(id)
        .orElseThrow(
            () -> new NotFoundException("Unknown " + role + " person: " + id, Map.of(role, id)));
  }

  private static void require(String value, String field) {
    if (TextNormalizer.isBlank(value)) {
      throw new ValidationException("Missing " + field, Map.of("field", field));
    }
  }
}
