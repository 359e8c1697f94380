package com.gentoro.warmpath.notification;

import com.gentoro.warmpath.exception.NotificationException;
import com.gentoro.warmpath.utility.JacksonUtility;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts invitations as JSON to an external messaging service, which performs the actual email
 * delivery. An optional API key is sent as a bearer token.
 */
public class WebhookNotificationDispatcher implements NotificationDispatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(WebhookNotificationDispatcher.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final String url;
  private final String apiKey;
  private final OkHttpClient client;

  public WebhookNotificationDispatcher(String url, String apiKey, OkHttpClient client) {
    this.url = url;
    this.apiKey = apiKey;
    this.client = client;
  }

  @Override
  public String id() {
    return "webhook";
  }

  @Override
  public void dispatch(InvitationNotification notification) {
    if (notification.recipientEmail() == null || notification.recipientEmail().isBlank()) {
      throw new NotificationException(
          "Recipient has no email address",
          Map.of("invitationId", notification.invitationId()));
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "invitation");
    payload.put("invitationId", notification.invitationId());
    payload.put("to", notification.recipientEmail());
    payload.put("toName", notification.recipientName());
    payload.put("subject", notification.subject());
    payload.put("body", notification.body());
    payload.put("activationUrl", notification.activationUrl());
    payload.put("expiresAt", notification.expiresAt());

    Request.Builder request =
        new Request.Builder()
            .url(url)
            .post(RequestBody.create(JacksonUtility.toJson(payload), JSON));
    if (apiKey != null && !apiKey.isBlank()) {
      request.header("Authorization", "Bearer " + apiKey);
    }
    try (Response response = client.newCall(request.build()).execute()) {
      if (!response.isSuccessful()) {
        throw new NotificationException(
            "Notification webhook answered HTTP " + response.code(),
            Map.of("invitationId", notification.invitationId(), "status", response.code()));
      }
      log.debug("Invitation {} delivered to webhook", notification.invitationId());
    } catch (IOException e) {
      throw new NotificationException("Notification webhook unreachable: " + url, e);
    }
  }
}
