package com.gentoro.warmpath.matching;

public enum MatchTier {
  EXACT,
  FUZZY
}
