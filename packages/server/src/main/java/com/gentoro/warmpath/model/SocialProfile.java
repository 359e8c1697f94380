package com.gentoro.warmpath.model;

import java.util.List;

/**
 * Handle on a social platform together with the handles this person lists as connections on the
 * same platform.
 */
public record SocialProfile(String platform, String handle, List<String> connections) {
  public SocialProfile {
    connections = connections == null ? List.of() : List.copyOf(connections);
  }
}
