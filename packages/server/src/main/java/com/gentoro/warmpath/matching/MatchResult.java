package com.gentoro.warmpath.matching;

import java.util.List;

/** Outcome of target resolution. An empty result is a valid answer, not an error. */
public record MatchResult(boolean found, List<RankedMatch> matches, String strategy) {

  public static MatchResult none(String strategy) {
    return new MatchResult(false, List.of(), strategy);
  }
}
