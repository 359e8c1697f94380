package com.gentoro.warmpath.notification;

/** Writes invitations to the application log instead of delivering them. */
public class LoggingNotificationDispatcher implements NotificationDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(LoggingNotificationDispatcher.class);

  @Override
  public String id() {
    return "logging";
  }

  @Override
  public void dispatch(InvitationNotification notification) {
    log.info(
        "Invitation {} for {} <{}>: {}\n{}",
        notification.invitationId(),
        notification.recipientName(),
        notification.recipientEmail() == null ? "no email" : notification.recipientEmail(),
        notification.subject(),
        notification.body());
  }
}
