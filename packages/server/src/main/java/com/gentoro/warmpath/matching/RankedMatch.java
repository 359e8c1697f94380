package com.gentoro.warmpath.matching;

import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import java.util.List;

/**
 * One candidate for an imprecise target description.
 *
 * @param confidence 0-100; exact matches cap at 100, fuzzy matches at 95
 * @param relationshipType type of the strongest known relationship used for boosting, or null
 * @param relationshipStrength strength of that relationship, 0 when there is none
 * @param matchedStrengthFactors human readable reasons that contributed to the confidence
 * @param suggestedApproachStrategy advice on how to reach out
 */
public record RankedMatch(
    Person person,
    int confidence,
    MatchTier tier,
    RelationshipType relationshipType,
    int relationshipStrength,
    List<String> matchedStrengthFactors,
    String suggestedApproachStrategy) {}
