package com.gentoro.warmpath.model;

/** Membership in a social organization (fraternity, sorority, club), optionally per chapter. */
public record Affiliation(
    String organization, String chapter, String role, Integer startYear, Integer endYear) {}
