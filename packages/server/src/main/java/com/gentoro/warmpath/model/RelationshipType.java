package com.gentoro.warmpath.model;

/**
 * Kinds of relationship evidence. Each type carries its base strength and the trust rank used to
 * order otherwise equal introduction paths.
 */
public enum RelationshipType {
  COWORKER(70, 5),
  EDUCATION(60, 4),
  FAMILY(90, 4),
  AFFILIATION(80, 3),
  HOMETOWN(50, 2),
  SOCIAL(40, 1);

  private final int baseStrength;
  private final int trustRank;

  RelationshipType(int baseStrength, int trustRank) {
    this.baseStrength = baseStrength;
    this.trustRank = trustRank;
  }

  public int baseStrength() {
    return baseStrength;
  }

  public int trustRank() {
    return trustRank;
  }
}
