package com.gentoro.warmpath.ingestion;

import com.gentoro.warmpath.exception.ConfigException;
import com.gentoro.warmpath.ingestion.source.AffiliationEvidenceSource;
import com.gentoro.warmpath.ingestion.source.CoworkerEvidenceSource;
import com.gentoro.warmpath.ingestion.source.EducationEvidenceSource;
import com.gentoro.warmpath.ingestion.source.FamilyEvidenceSource;
import com.gentoro.warmpath.ingestion.source.HometownEvidenceSource;
import com.gentoro.warmpath.ingestion.source.SocialEvidenceSource;
import com.gentoro.warmpath.ingestion.source.SyntheticTiesEvidenceSource;
import com.gentoro.warmpath.model.Person;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Turns the evidence carried by persons into the complete, typed and weighted relationship set.
 *
 * <p>Ingestion is a pure function of its input: persons are processed in id order, every source
 * groups deterministically and the edge list is sorted, so two passes over unchanged evidence
 * produce identical relationships. Persisting the result is left to the caller.
 */
public class RelationshipIngestionService {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(RelationshipIngestionService.class);

  public static final int DEFAULT_MAX_GROUP_SIZE = 200;

  private final Configuration configuration;
  private final Clock clock;
  private final List<EvidenceSource> sources;

  public RelationshipIngestionService(Configuration configuration, Clock clock) {
    this(configuration, clock, defaultSources());
  }

  public RelationshipIngestionService(
      Configuration configuration, Clock clock, List<EvidenceSource> sources) {
    this.configuration = configuration;
    this.clock = clock;
    this.sources = List.copyOf(sources);
  }

  public static List<EvidenceSource> defaultSources() {
    return List.of(
        new FamilyEvidenceSource(),
        new AffiliationEvidenceSource(),
        new CoworkerEvidenceSource(),
        new EducationEvidenceSource(),
        new HometownEvidenceSource(),
        new SocialEvidenceSource(),
        new SyntheticTiesEvidenceSource());
  }

  public List<EvidenceSource> sources() {
    return sources;
  }

  public IngestionResult ingest(List<Person> persons) {
    List<Person> ordered = new ArrayList<>(persons);
    ordered.sort(Comparator.comparing(Person::id));
    Map<String, Person> byId = new LinkedHashMap<>();
    ordered.forEach(p -> byId.put(p.id(), p));

    int maxGroupSize = configuration.getInt("ingestion.maxGroupSize", DEFAULT_MAX_GROUP_SIZE);
    if (maxGroupSize < 2) {
      throw new ConfigException("ingestion.maxGroupSize must be at least 2, was " + maxGroupSize);
    }
    long seed = configuration.getLong("ingestion.samplingSeed", 0L);
    int currentYear = clock.instant().atZone(ZoneOffset.UTC).getYear();

    EdgeCollector collector = new EdgeCollector(byId);
    List<IngestionResult.SkippedSource> skipped = new ArrayList<>();
    for (EvidenceSource source : sources) {
      String prefix = "ingestion.sources." + source.id();
      if (!configuration.getBoolean(prefix + ".enabled", source.enabledByDefault())) {
        log.debug("Evidence source '{}' is disabled", source.id());
        continue;
      }
      Configuration settings = configuration.subset(prefix);
      List<String> missing = new ArrayList<>();
      for (String key : source.requiredSettings()) {
        String value = settings.getString(key, null);
        if (value == null || value.isBlank()) missing.add(prefix + "." + key);
      }
      if (!missing.isEmpty()) {
        String reason = "missing configuration " + String.join(", ", missing);
        log.warn("Skipping evidence source '{}': {}", source.id(), reason);
        skipped.add(new IngestionResult.SkippedSource(source.id(), reason));
        continue;
      }

      long started = System.nanoTime();
      collector.beginSource(source.id());
      source.collect(
          new IngestionContext(ordered, settings, maxGroupSize, seed, currentYear), collector);
      log.debug(
          "Evidence source '{}' reported {} pairs in {} ms",
          source.id(),
          collector.reportedBySource().getOrDefault(source.id(), 0),
          (System.nanoTime() - started) / 1_000_000);
    }

    if (collector.dropped() > 0) {
      log.warn("Ignored {} pairs that reference unknown persons", collector.dropped());
    }
    return new IngestionResult(collector.edges(), collector.reportedBySource(), skipped);
  }
}
