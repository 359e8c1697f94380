package com.gentoro.warmpath.pathfinding;

import com.gentoro.warmpath.matching.MatchResult;

/** Path search towards a target known only by description, with the resolution that preceded it. */
public record DescribedConnectionSearch(
    MatchResult resolution, ConnectionSearchResult connections) {}
