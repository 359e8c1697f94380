package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;

/** Adjacency entry: the person on the other end of {@code edge}. */
public record Neighbor(String personId, RelationshipType type, Relationship edge) {}
