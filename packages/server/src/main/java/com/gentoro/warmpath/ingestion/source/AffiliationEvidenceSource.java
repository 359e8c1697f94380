package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Affiliation;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/** Pairs members of the same organization chapter; overlapping membership years add 5. */
public class AffiliationEvidenceSource extends GroupingEvidenceSource<Affiliation> {
  static final int OVERLAP_BONUS = 5;

  @Override
  public String id() {
    return "affiliation";
  }

  @Override
  protected RelationshipType type() {
    return RelationshipType.AFFILIATION;
  }

  @Override
  protected void evidence(Person person, BiConsumer<String, Affiliation> sink) {
    for (Affiliation a : person.affiliations()) {
      String org = TextNormalizer.normalizeKey(a.organization());
      if (org.isEmpty()) continue;
      sink.accept(org + "|" + TextNormalizer.normalizeKey(a.chapter()), a);
    }
  }

  @Override
  protected int modifier(Affiliation a, Affiliation b, IngestionContext context) {
    if (a.startYear() == null || b.startYear() == null) return 0;
    int year = context.currentYear();
    int endA = a.endYear() == null ? year : a.endYear();
    int endB = b.endYear() == null ? year : b.endYear();
    return overlapYears(a.startYear(), endA, b.startYear(), endB) > 0 ? OVERLAP_BONUS : 0;
  }

  @Override
  protected Map<String, Object> metadata(String groupKey, Affiliation a, Affiliation b) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("organization", a.organization().trim());
    if (!TextNormalizer.isBlank(a.chapter())) m.put("chapter", a.chapter().trim());
    return m;
  }
}
