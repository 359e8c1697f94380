package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.EdgeCollector;
import com.gentoro.warmpath.ingestion.EvidenceSource;
import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Demo-data generator that links random pairs of people with social and family ties. Disabled
 * unless {@code ingestion.sources.synthetic.enabled} is true, and requires an explicit {@code seed}
 * so that its output is reproducible.
 */
public class SyntheticTiesEvidenceSource implements EvidenceSource {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(SyntheticTiesEvidenceSource.class);

  @Override
  public String id() {
    return "synthetic";
  }

  @Override
  public List<String> requiredSettings() {
    return List.of("seed");
  }

  @Override
  public boolean enabledByDefault() {
    return false;
  }

  @Override
  public void collect(IngestionContext context, EdgeCollector collector) {
    long seed = context.settings().getLong("seed");
    double socialProbability = context.settings().getDouble("socialProbability", 0.05);
    double familyProbability = context.settings().getDouble("familyProbability", 0.01);
    Random random = new Random(seed);
    List<Person> people = context.sample("synthetic", context.persons());
    log.warn("Generating synthetic ties for {} people; not for production data", people.size());

    int family = RelationshipType.FAMILY.baseStrength() + FamilyEvidenceSource.INFERRED_PENALTY;
    for (int i = 0; i < people.size(); i++) {
      for (int j = i + 1; j < people.size(); j++) {
        String a = people.get(i).id();
        String b = people.get(j).id();
        if (random.nextDouble() < socialProbability) {
          collector.connect(
              a,
              b,
              RelationshipType.SOCIAL,
              RelationshipType.SOCIAL.baseStrength(),
              "synthetic",
              Map.of("synthetic", true));
        }
        if (random.nextDouble() < familyProbability) {
          collector.connect(
              a, b, RelationshipType.FAMILY, family, "synthetic", Map.of("synthetic", true));
        }
      }
    }
  }
}
