package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.EdgeCollector;
import com.gentoro.warmpath.ingestion.EvidenceSource;
import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;

/**
 * Base class for sources that group persons by a normalized key and pair every two members of a
 * group. Pairing costs O(g^2) per group of size g; groups above the configured ceiling are sampled
 * down first.
 *
 * @param <E> the piece of evidence a person contributes to a group (a tenure, a degree...)
 */
public abstract class GroupingEvidenceSource<E> implements EvidenceSource {

  protected abstract RelationshipType type();

  /** Report every {@code (groupKey, evidence)} the person contributes. Blank keys are ignored. */
  protected abstract void evidence(Person person, BiConsumer<String, E> sink);

  /** Strength adjustment for a pair on top of the base strength of {@link #type()}. */
  protected abstract int modifier(E a, E b, IngestionContext context);

  protected abstract Map<String, Object> metadata(String groupKey, E a, E b);

  /** Combine two pieces of evidence a single person contributed to the same group. */
  protected E merge(E existing, E incoming) {
    return existing;
  }

  /** Whether a group forms relationships at all. */
  protected boolean acceptGroup(Map<String, E> members) {
    return true;
  }

  /** Evidence whose contributor must survive the sampling of an oversized group. */
  protected boolean pinned(E evidence) {
    return false;
  }

  @Override
  public void collect(IngestionContext context, EdgeCollector collector) {
    SortedMap<String, Map<String, E>> groups = new TreeMap<>();
    for (Person person : context.persons()) {
      evidence(
          person,
          (key, e) -> {
            if (key == null || key.isBlank() || e == null) return;
            groups
                .computeIfAbsent(key, k -> new LinkedHashMap<>())
                .merge(person.id(), e, this::merge);
          });
    }

    String prefix = id() + ":";
    for (Map.Entry<String, Map<String, E>> group : groups.entrySet()) {
      if (group.getValue().size() < 2 || !acceptGroup(group.getValue())) continue;
      List<Map.Entry<String, E>> members =
          context.sample(
              group.getKey(),
              new ArrayList<>(group.getValue().entrySet()),
              e -> pinned(e.getValue()));
      for (int i = 0; i < members.size(); i++) {
        for (int j = i + 1; j < members.size(); j++) {
          Map.Entry<String, E> a = members.get(i);
          Map.Entry<String, E> b = members.get(j);
          collector.connect(
              a.getKey(),
              b.getKey(),
              type(),
              type().baseStrength() + modifier(a.getValue(), b.getValue(), context),
              prefix + group.getKey(),
              metadata(group.getKey(), a.getValue(), b.getValue()));
        }
      }
    }
  }

  /** Inclusive number of shared years, or 0 when the spans are disjoint. */
  protected static int overlapYears(int startA, int endA, int startB, int endB) {
    return Math.max(0, Math.min(endA, endB) - Math.max(startA, startB) + 1);
  }
}
