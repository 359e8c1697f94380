package com.gentoro.warmpath.matching;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;

/** Advice on how to reach a resolved candidate, derived from the relationship evidence. */
final class ApproachStrategies {
  private ApproachStrategies() {}

  static String suggest(Person candidate, Relationship edge, boolean direct) {
    String advice;
    if (edge == null) {
      advice =
          "No known connection to %s yet; ask a mutual contact for an introduction."
              .formatted(candidate.name());
    } else {
      String via = direct ? "your" : "their";
      advice =
          switch (edge.type()) {
            case COWORKER -> "Reference %s shared time at %s."
                .formatted(via, evidence(edge, "company", "the same company"));
            case EDUCATION -> "Open with %s common background at %s."
                .formatted(via, evidence(edge, "school", "the same school"));
            case FAMILY -> "Ask for a personal introduction through family.";
            case AFFILIATION -> "Reach out through %s."
                .formatted(evidence(edge, "organization", "the shared organization"));
            case HOMETOWN -> "Connect over the shared hometown of %s."
                .formatted(evidence(edge, "city", "origin"));
            case SOCIAL -> "Engage on %s before asking for an introduction."
                .formatted(evidence(edge, "platform", "social media"));
          };
    }
    if (candidate.ghost()) {
      advice += " Their profile is not claimed yet, so an invitation is needed first.";
    }
    return advice;
  }

  private static String evidence(Relationship edge, String key, String fallback) {
    Object value = edge.metadata().get(key);
    return value == null ? fallback : value.toString();
  }
}
