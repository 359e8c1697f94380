package com.gentoro.warmpath.model;

public enum InvitationStatus {
  SENT,
  ACCEPTED,
  EXPIRED;

  public boolean isTerminal() {
    return this != SENT;
  }
}
