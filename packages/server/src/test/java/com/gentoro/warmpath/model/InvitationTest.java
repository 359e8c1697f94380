package com.gentoro.warmpath.model;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class InvitationTest {

  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

  @Test
  void overdueOnlyWhileSent() {
    Invitation sent =
        new Invitation(
            "i",
            "g",
            "r",
            "t",
            "tok",
            InvitationStatus.SENT,
            false,
            null,
            NOW,
            NOW.plusSeconds(60),
            null,
            null);

    assertFalse(sent.isOverdue(NOW.plusSeconds(60)));
    assertTrue(sent.isOverdue(NOW.plusSeconds(61)));
    assertFalse(sent.accepted(NOW).isOverdue(NOW.plusSeconds(61)));
    assertEquals(NOW, sent.accepted(NOW).activatedAt());
    assertEquals(NOW, sent.expired(NOW).expiredAt());
    assertEquals("boom", sent.withDispatchOutcome(false, "boom").dispatchError());
  }
}
