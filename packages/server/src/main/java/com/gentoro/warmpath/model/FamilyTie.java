package com.gentoro.warmpath.model;

/**
 * Declared family relation. {@code personId} references another person in the store when known;
 * ties that only carry a name are kept as evidence but produce no edge.
 */
public record FamilyTie(String personId, String name, String relation) {}
