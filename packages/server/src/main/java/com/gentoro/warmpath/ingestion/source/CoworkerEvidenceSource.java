package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Employment;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Pairs people who worked for the same company, taken from the current company and the employment
 * history. Overlapping tenure adds 5 per shared year up to 15; two fully known tenures that never
 * overlapped subtract 10.
 */
public class CoworkerEvidenceSource
    extends GroupingEvidenceSource<CoworkerEvidenceSource.Tenure> {
  static final int PER_SHARED_YEAR = 5;
  static final int MAX_OVERLAP_BONUS = 15;
  static final int DISJOINT_PENALTY = -10;

  /** A span at one company; a null end year means the position is current. */
  public record Tenure(String company, Integer startYear, Integer endYear) {
    int end(int currentYear) {
      return endYear == null ? currentYear : endYear;
    }
  }

  @Override
  public String id() {
    return "coworker";
  }

  @Override
  protected RelationshipType type() {
    return RelationshipType.COWORKER;
  }

  @Override
  protected void evidence(Person person, BiConsumer<String, Tenure> sink) {
    for (Employment e : person.employment()) {
      if (TextNormalizer.isBlank(e.company())) continue;
      sink.accept(
          TextNormalizer.normalizeCompany(e.company()),
          new Tenure(e.company().trim(), e.startYear(), e.endYear()));
    }
    if (!TextNormalizer.isBlank(person.company())) {
      sink.accept(
          TextNormalizer.normalizeCompany(person.company()),
          new Tenure(person.company().trim(), null, null));
    }
  }

  @Override
  protected Tenure merge(Tenure existing, Tenure incoming) {
    if (incoming.startYear() == null) return existing;
    if (existing.startYear() == null) return incoming;
    Integer end =
        existing.endYear() == null || incoming.endYear() == null
            ? null
            : Math.max(existing.endYear(), incoming.endYear());
    return new Tenure(
        existing.company(), Math.min(existing.startYear(), incoming.startYear()), end);
  }

  @Override
  protected int modifier(Tenure a, Tenure b, IngestionContext context) {
    if (a.startYear() == null || b.startYear() == null) return 0;
    int year = context.currentYear();
    int shared = overlapYears(a.startYear(), a.end(year), b.startYear(), b.end(year));
    if (shared == 0) return DISJOINT_PENALTY;
    return Math.min(MAX_OVERLAP_BONUS, shared * PER_SHARED_YEAR);
  }

  @Override
  protected Map<String, Object> metadata(String groupKey, Tenure a, Tenure b) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("company", a.company());
    if (a.startYear() != null && b.startYear() != null) {
      int from = Math.max(a.startYear(), b.startYear());
      Integer to = earliest(a.endYear(), b.endYear());
      if (to == null || to >= from) {
        m.put("sharedFrom", from);
        if (to != null) m.put("sharedTo", to);
      }
    }
    return m;
  }

  private static Integer earliest(Integer a, Integer b) {
    if (a == null) return b;
    if (b == null) return a;
    return Math.min(a, b);
  }
}
