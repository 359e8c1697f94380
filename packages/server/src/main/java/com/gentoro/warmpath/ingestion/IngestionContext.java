package com.gentoro.warmpath.ingestion;

import com.gentoro.warmpath.model.Person;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;
import org.apache.commons.configuration2.Configuration;

/**
 * Read-only inputs of a single source run: the persons ordered by id, the settings of the source
 * and the group-size ceiling.
 */
public final class IngestionContext {
  private final List<Person> persons;
  private final Configuration settings;
  private final int maxGroupSize;
  private final long samplingSeed;
  private final int currentYear;

  public IngestionContext(
      List<Person> persons,
      Configuration settings,
      int maxGroupSize,
      long samplingSeed,
      int currentYear) {
    this.persons = List.copyOf(persons);
    this.settings = settings;
    this.maxGroupSize = maxGroupSize;
    this.samplingSeed = samplingSeed;
    this.currentYear = currentYear;
  }

  public List<Person> persons() {
    return persons;
  }

  /** The {@code ingestion.sources.<id>} subset of the configuration. */
  public Configuration settings() {
    return settings;
  }

  public int maxGroupSize() {
    return maxGroupSize;
  }

  public long samplingSeed() {
    return samplingSeed;
  }

  /** Year used to close open-ended tenures. */
  public int currentYear() {
    return currentYear;
  }

  /**
   * Reduce a group to at most {@link #maxGroupSize()} members. The choice depends only on the
   * sampling seed and the group key, and the kept members stay in their original order.
   */
  public <T> List<T> sample(String groupKey, List<T> members) {
    return sample(groupKey, members, m -> false);
  }

  /**
   * Same as {@link #sample(String, List)}, except that members matching {@code pinned} are kept
   * first and only the remaining places are sampled.
   */
  public <T> List<T> sample(String groupKey, List<T> members, Predicate<? super T> pinned) {
    if (members.size() <= maxGroupSize) {
      return members;
    }
    List<Integer> kept = new ArrayList<>();
    List<Integer> positions = new ArrayList<>(members.size());
    for (int i = 0; i < members.size(); i++) {
      if (kept.size() < maxGroupSize && pinned.test(members.get(i))) {
        kept.add(i);
      } else {
        positions.add(i);
      }
    }
    Collections.shuffle(positions, new Random(samplingSeed * 31 + groupKey.hashCode()));
    kept.addAll(positions.subList(0, maxGroupSize - kept.size()));
    Collections.sort(kept);
    List<T> out = new ArrayList<>(kept.size());
    for (int i : kept) out.add(members.get(i));
    return out;
  }
}
