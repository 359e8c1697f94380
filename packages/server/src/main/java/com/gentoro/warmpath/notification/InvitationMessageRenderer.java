package com.gentoro.warmpath.notification;

import com.gentoro.warmpath.exception.NotificationException;
import com.gentoro.warmpath.model.Invitation;
import com.gentoro.warmpath.model.Person;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

/** Renders invitation messages from the {@code templates/invitation.peb} Pebble template. */
public class InvitationMessageRenderer {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().autoEscaping(false).strictVariables(false).build();
  static final String TEMPLATE = "templates/invitation.peb";

  private final PebbleTemplate template;

  public InvitationMessageRenderer() {
    this(TEMPLATE);
  }

  public InvitationMessageRenderer(String templateName) {
    this.template = ENGINE.getTemplate(templateName);
  }

  public InvitationNotification render(
      Invitation invitation, Person ghost, Person requester, Person target, String activationUrl) {
    Map<String, Object> ctx = new HashMap<>();
    ctx.put("ghost", ghost);
    ctx.put("requester", requester);
    ctx.put("target", target);
    ctx.put("activationUrl", activationUrl);
    ctx.put("expiresAt", invitation.expiresAt());
    Writer writer = new StringWriter();
    try {
      template.evaluate(writer, ctx);
    } catch (IOException e) {
      throw new NotificationException("Failed to render invitation " + invitation.id(), e);
    }
    return new InvitationNotification(
        invitation.id(),
        ghost.name(),
        ghost.email(),
        requester.name(),
        "%s would like your help connecting with %s".formatted(requester.name(), target.name()),
        writer.toString().trim(),
        activationUrl,
        invitation.expiresAt());
  }
}
