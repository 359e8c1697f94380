package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Education;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.stream.Stream;

/**
 * Pairs alumni of the same school. Graduating within a year of each other adds 10, the same major
 * adds 5 and a differing degree level subtracts 10.
 */
public class EducationEvidenceSource extends GroupingEvidenceSource<Education> {
  static final int CLASSMATE_BONUS = 10;
  static final int SAME_MAJOR_BONUS = 5;
  static final int DEGREE_LEVEL_PENALTY = -10;

  @Override
  public String id() {
    return "education";
  }

  @Override
  protected RelationshipType type() {
    return RelationshipType.EDUCATION;
  }

  @Override
  protected void evidence(Person person, BiConsumer<String, Education> sink) {
    for (Education e : person.education()) {
      sink.accept(TextNormalizer.normalizeKey(e.school()), e);
    }
  }

  @Override
  protected int modifier(Education a, Education b, IngestionContext context) {
    int m = 0;
    if (a.graduationYear() != null
        && b.graduationYear() != null
        && Math.abs(a.graduationYear() - b.graduationYear()) <= 1) {
      m += CLASSMATE_BONUS;
    }
    String majorA = TextNormalizer.normalizeKey(a.major());
    if (!majorA.isEmpty() && majorA.equals(TextNormalizer.normalizeKey(b.major()))) {
      m += SAME_MAJOR_BONUS;
    }
    DegreeLevel levelA = DegreeLevel.of(a.degree());
    DegreeLevel levelB = DegreeLevel.of(b.degree());
    if (levelA != DegreeLevel.UNKNOWN && levelB != DegreeLevel.UNKNOWN && levelA != levelB) {
      m += DEGREE_LEVEL_PENALTY;
    }
    return m;
  }

  @Override
  protected Map<String, Object> metadata(String groupKey, Education a, Education b) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("school", a.school().trim());
    // shared by both directions of the pair, so no per-endpoint keys
    List<Integer> years =
        Stream.of(a.graduationYear(), b.graduationYear())
            .filter(Objects::nonNull)
            .sorted()
            .toList();
    if (!years.isEmpty()) m.put("graduationYears", years);
    String major = TextNormalizer.normalizeKey(a.major());
    if (!major.isEmpty() && major.equals(TextNormalizer.normalizeKey(b.major()))) {
      m.put("major", a.major().trim());
    }
    return m;
  }
}
