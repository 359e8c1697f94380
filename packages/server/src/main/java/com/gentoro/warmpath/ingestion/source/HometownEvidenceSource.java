package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Hometown;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/** Pairs people who grew up in the same city of the same region. */
public class HometownEvidenceSource extends GroupingEvidenceSource<Hometown> {

  @Override
  public String id() {
    return "hometown";
  }

  @Override
  protected RelationshipType type() {
    return RelationshipType.HOMETOWN;
  }

  /** Grouping key of a hometown, empty when the city is unknown. */
  static String key(Hometown h) {
    String city = TextNormalizer.normalizeKey(h.city());
    return city.isEmpty() ? "" : city + "|" + TextNormalizer.normalizeKey(h.region());
  }

  @Override
  protected void evidence(Person person, BiConsumer<String, Hometown> sink) {
    person.hometowns().forEach(h -> sink.accept(key(h), h));
  }

  @Override
  protected int modifier(Hometown a, Hometown b, IngestionContext context) {
    return 0;
  }

  @Override
  protected Map<String, Object> metadata(String groupKey, Hometown a, Hometown b) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("city", a.city().trim());
    if (!TextNormalizer.isBlank(a.region())) m.put("region", a.region().trim());
    return m;
  }
}
