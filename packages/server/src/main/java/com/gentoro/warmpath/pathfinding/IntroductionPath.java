package com.gentoro.warmpath.pathfinding;

import com.gentoro.warmpath.model.RelationshipType;
import java.util.List;

/**
 * A chain of people from source to target.
 *
 * @param score product of the normalized hop strengths on a 0-100 scale, two decimals
 * @param confidence confidence of the least trustworthy hop
 * @param ghostPersonIds ghosts along the path after the source; each one needs an invitation
 */
public record IntroductionPath(
    List<String> personIds,
    List<String> personNames,
    List<PathHop> steps,
    List<RelationshipType> edgeTypes,
    int hops,
    double score,
    int confidence,
    List<String> ghostPersonIds,
    boolean requiresInvitation) {}
