package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.EdgeCollector;
import com.gentoro.warmpath.ingestion.EvidenceSource;
import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.FamilyTie;
import com.gentoro.warmpath.model.Hometown;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Family relationships. Declared ties between two known persons are taken at full strength; people
 * sharing a surname and a hometown are assumed related at a reduced strength.
 */
public class FamilyEvidenceSource implements EvidenceSource {
  static final int INFERRED_PENALTY = -25;
  private static final int MIN_SURNAME_LENGTH = 2;

  @Override
  public String id() {
    return "family";
  }

  @Override
  public void collect(IngestionContext context, EdgeCollector collector) {
    int strength = RelationshipType.FAMILY.baseStrength();
    for (Person person : context.persons()) {
      for (FamilyTie tie : person.family()) {
        if (TextNormalizer.isBlank(tie.personId())) continue;
        String other = tie.personId().trim();
        String low = person.id().compareTo(other) < 0 ? person.id() : other;
        String high = low.equals(person.id()) ? other : person.id();
        Map<String, Object> m = new LinkedHashMap<>();
        if (!TextNormalizer.isBlank(tie.relation())) m.put("relation", tie.relation().trim());
        m.put("inferred", false);
        collector.connect(
            person.id(),
            other,
            RelationshipType.FAMILY,
            strength,
            "family:declared:" + low + "|" + high,
            m);
      }
    }

    SortedMap<String, List<Person>> groups = new TreeMap<>();
    for (Person person : context.persons()) {
      String surname = TextNormalizer.surname(person.name());
      if (surname.length() < MIN_SURNAME_LENGTH) continue;
      for (Hometown h : person.hometowns()) {
        String town = HometownEvidenceSource.key(h);
        if (town.isEmpty()) continue;
        List<Person> members =
            groups.computeIfAbsent(surname + "|" + town, k -> new ArrayList<>());
        if (!members.contains(person)) members.add(person);
      }
    }
    for (Map.Entry<String, List<Person>> group : groups.entrySet()) {
      List<Person> members = context.sample(group.getKey(), group.getValue());
      for (int i = 0; i < members.size(); i++) {
        for (int j = i + 1; j < members.size(); j++) {
          Map<String, Object> m = new LinkedHashMap<>();
          m.put("surname", TextNormalizer.surname(members.get(i).name()));
          m.put("inferred", true);
          collector.connect(
              members.get(i).id(),
              members.get(j).id(),
              RelationshipType.FAMILY,
              strength + INFERRED_PENALTY,
              "family:inferred:" + group.getKey(),
              m);
        }
      }
    }
  }
}
