package com.gentoro.warmpath.notification;

import com.gentoro.warmpath.exception.ConfigException;
import com.gentoro.warmpath.http.OkHttpFactory;
import org.apache.commons.configuration2.Configuration;

/** Picks the dispatcher named by {@code notification.driver}. */
public final class NotificationDispatcherFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(NotificationDispatcherFactory.class);

  private NotificationDispatcherFactory() {}

  /**
   * A webhook driver without {@code notification.webhook.url} falls back to the logging dispatcher
   * so that invitations can still be created.
   *
   * @throws ConfigException for an unknown driver
   */
  public static NotificationDispatcher create(Configuration configuration) {
    String driver = configuration.getString("notification.driver", "logging").trim();
    switch (driver) {
      case "logging":
        return new LoggingNotificationDispatcher();
      case "webhook":
        String url = configuration.getString("notification.webhook.url", null);
        if (url == null || url.isBlank()) {
          log.warn(
              "notification.webhook.url is not configured, invitations will only be logged",
              new ConfigException("Missing notification.webhook.url"));
          return new LoggingNotificationDispatcher();
        }
        return new WebhookNotificationDispatcher(
            url.trim(),
            configuration.getString("notification.webhook.apiKey", null),
            OkHttpFactory.create());
      default:
        throw new ConfigException("Unknown notification.driver: " + driver);
    }
  }
}
