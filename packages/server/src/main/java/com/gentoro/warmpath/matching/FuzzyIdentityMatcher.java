package com.gentoro.warmpath.matching;

import com.gentoro.warmpath.graph.GraphIndex;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.Relationship;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Resolves a loosely described target ("John Smith at Acme Corp") to known persons.
 *
 * <p>Exact name and company variants are tried first; only when they produce nothing are
 * candidates scored by the share of matching name, company and title words. Confidence is boosted
 * by the relationship the candidate has with the requester, or with anyone when no requester is
 * known. Resolution only reads the current graph snapshot and never throws for missing matches.
 */
public class FuzzyIdentityMatcher {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(FuzzyIdentityMatcher.class);

  static final int EXACT_BASE = 60;
  static final int VERBATIM_NAME_BONUS = 30;
  static final int COMPANY_MATCH_BONUS = 20;
  static final int FUZZY_BASE = 40;
  static final int FUZZY_RELEVANCE_WEIGHT = 50;
  static final int EXACT_CAP = 100;
  static final int FUZZY_CAP = 95;

  private static final double NAME_WEIGHT = 0.5;
  private static final double COMPANY_WEIGHT = 0.3;
  private static final double TITLE_WEIGHT = 0.2;

  private final GraphService graphService;
  private final int maxResults;
  private final double minRelevance;

  public FuzzyIdentityMatcher(Configuration configuration, GraphService graphService) {
    this.graphService = graphService;
    this.maxResults = configuration.getInt("matching.maxResults", 5);
    this.minRelevance = configuration.getDouble("matching.fuzzy.minRelevance", 0.25);
  }

  public MatchResult resolveTarget(String name, String company, String title) {
    return resolveTarget(null, name, company, title);
  }

  /**
   * @param requesterId person asking for the introduction; excluded from the candidates and used
   *     for relationship boosts. May be null.
   */
  public MatchResult resolveTarget(String requesterId, String name, String company, String title) {
    if (TextNormalizer.isBlank(name)) {
      return MatchResult.none("Provide the name of the person you want to reach.");
    }
    GraphIndex index = graphService.snapshot();
    List<RankedMatch> candidates = exactTier(index, requesterId, name, company);
    MatchTier tier = MatchTier.EXACT;
    if (candidates.isEmpty()) {
      candidates = fuzzyTier(index, requesterId, name, company, title);
      tier = MatchTier.FUZZY;
    }
    log.debug(
        "Resolved '{}' ({}, {}) to {} {} candidates",
        name,
        company,
        title,
        candidates.size(),
        tier);

    List<RankedMatch> ranked = rank(candidates);
    if (ranked.isEmpty()) {
      return MatchResult.none(
          ("No direct connection to %s exists in your network yet. Consider expanding your "
                  + "network, for example through alumni groups or mutual connections, and search "
                  + "again.")
              .formatted(name.trim()));
    }
    RankedMatch best = ranked.get(0);
    String strategy =
        "Best match: %s (%d%% confidence, %s match). %s"
            .formatted(
                best.person().name(),
                best.confidence(),
                best.tier().name().toLowerCase(Locale.ROOT),
                best.suggestedApproachStrategy());
    return new MatchResult(true, ranked, strategy);
  }

  private List<RankedMatch> exactTier(
      GraphIndex index, String requesterId, String name, String company) {
    Set<String> names = NameVariants.of(name);
    Set<String> companies = TextNormalizer.companyVariants(company);
    String verbatim = TextNormalizer.normalizeKey(name);

    List<RankedMatch> out = new ArrayList<>();
    for (Person p : index.persons()) {
      if (p.id().equals(requesterId)) continue;
      String candidateName = TextNormalizer.normalizeKey(p.name());
      if (!names.contains(candidateName)) continue;
      boolean companyGiven = !companies.isEmpty();
      if (companyGiven
          && Collections.disjoint(companies, TextNormalizer.companyVariants(p.company()))) {
        continue;
      }

      List<String> factors = new ArrayList<>();
      int confidence = EXACT_BASE;
      if (candidateName.equals(verbatim)) {
        confidence += VERBATIM_NAME_BONUS;
        factors.add("exact name match");
      } else {
        factors.add("name variant match");
      }
      if (companyGiven) {
        confidence += COMPANY_MATCH_BONUS;
        factors.add("company match");
      }
      out.add(boosted(index, requesterId, p, confidence, MatchTier.EXACT, factors));
    }
    return out;
  }

  private List<RankedMatch> fuzzyTier(
      GraphIndex index, String requesterId, String name, String company, String title) {
    List<String> nameTokens = TextNormalizer.tokens(name);
    List<String> companyTokens = TextNormalizer.tokens(TextNormalizer.normalizeCompany(company));
    List<String> titleTokens = TextNormalizer.tokens(title);

    List<RankedMatch> out = new ArrayList<>();
    for (Person p : index.persons()) {
      if (p.id().equals(requesterId)) continue;
      int nameHits = hits(nameTokens, TextNormalizer.tokens(p.name()));
      if (nameHits == 0) continue;
      double nameScore = fraction(nameHits, nameTokens);
      List<String> candidateCompany =
          TextNormalizer.tokens(TextNormalizer.normalizeCompany(p.company()));
      double companyScore = fraction(hits(companyTokens, candidateCompany), companyTokens);
      double titleScore =
          fraction(hits(titleTokens, TextNormalizer.tokens(p.title())), titleTokens);
      double relevance =
          NAME_WEIGHT * nameScore + COMPANY_WEIGHT * companyScore + TITLE_WEIGHT * titleScore;
      if (relevance < minRelevance) continue;

      List<String> factors = new ArrayList<>();
      factors.add("fuzzy match (relevance %.2f)".formatted(relevance));
      int confidence = (int) Math.round(FUZZY_BASE + relevance * FUZZY_RELEVANCE_WEIGHT);
      out.add(boosted(index, requesterId, p, confidence, MatchTier.FUZZY, factors));
    }
    return out;
  }

  /** Number of target tokens that appear in, or contain, some candidate token. */
  static int hits(List<String> targetTokens, List<String> candidateTokens) {
    int hits = 0;
    for (String t : targetTokens) {
      for (String c : candidateTokens) {
        if (tokenMatches(t, c)) {
          hits++;
          break;
        }
      }
    }
    return hits;
  }

  static boolean tokenMatches(String target, String candidate) {
    if (target.equals(candidate)) return true;
    // single letters would match almost anything
    if (target.length() < 2 || candidate.length() < 2) return false;
    return candidate.contains(target) || target.contains(candidate);
  }

  private static double fraction(int hits, List<String> tokens) {
    return tokens.isEmpty() ? 0 : (double) hits / tokens.size();
  }

  private RankedMatch boosted(
      GraphIndex index,
      String requesterId,
      Person candidate,
      int confidence,
      MatchTier tier,
      List<String> factors) {
    Optional<Relationship> edge =
        requesterId == null
            ? index.strongestEdge(candidate.id())
            : index.strongestEdge(requesterId, candidate.id());
    int strength = edge.map(Relationship::strength).orElse(0);
    RelationshipType type = edge.map(Relationship::type).orElse(null);

    if (strength > 75) {
      confidence += 10;
      factors.add("strong relationship (%d)".formatted(strength));
    }
    if (strength > 90) {
      confidence += 5;
      factors.add("very strong relationship");
    }
    if (type == RelationshipType.COWORKER || type == RelationshipType.EDUCATION) {
      confidence += 15;
      factors.add(type.name().toLowerCase(Locale.ROOT) + " relationship");
    }
    boolean completeProfile =
        !TextNormalizer.isBlank(candidate.company()) && !TextNormalizer.isBlank(candidate.title());
    if (completeProfile) {
      confidence += 5;
      factors.add("complete profile");
    }
    int cap = tier == MatchTier.EXACT ? EXACT_CAP : FUZZY_CAP;
    return new RankedMatch(
        candidate,
        Math.min(cap, confidence),
        tier,
        type,
        strength,
        List.copyOf(factors),
        ApproachStrategies.suggest(candidate, edge.orElse(null), requesterId != null));
  }

  private List<RankedMatch> rank(List<RankedMatch> candidates) {
    Map<String, RankedMatch> unique = new LinkedHashMap<>();
    for (RankedMatch m : candidates) {
      String key =
          TextNormalizer.normalizeKey(m.person().name())
              + "|"
              + TextNormalizer.normalizeCompany(m.person().company());
      unique.merge(key, m, (a, b) -> BY_RANK.compare(a, b) <= 0 ? a : b);
    }
    List<RankedMatch> out = new ArrayList<>(unique.values());
    out.sort(BY_RANK);
    return out.size() > maxResults ? List.copyOf(out.subList(0, maxResults)) : out;
  }

  private static final Comparator<RankedMatch> BY_RANK =
      Comparator.comparingInt(RankedMatch::confidence)
          .reversed()
          .thenComparing(m -> m.person().name())
          .thenComparing(m -> m.person().id());
}
