package com.gentoro.warmpath.notification;

/**
 * Best-effort delivery of invitation messages (email gateway, chat, webhook...).
 *
 * <p>Implementations throw {@link com.gentoro.warmpath.exception.NotificationException} when
 * delivery fails; callers record the failure and carry on.
 */
public interface NotificationDispatcher {

  String id();

  void dispatch(InvitationNotification notification);
}
