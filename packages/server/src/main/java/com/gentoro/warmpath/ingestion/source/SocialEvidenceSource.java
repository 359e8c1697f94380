package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.ingestion.IngestionContext;
import com.gentoro.warmpath.model.Person;
import com.gentoro.warmpath.model.RelationshipType;
import com.gentoro.warmpath.model.SocialProfile;
import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;

/**
 * Groups the owner of a social handle with everyone listing that handle as a connection on the same
 * platform, and pairs all members of the group. A handle nobody owns forms no group. Pairs that
 * list each other add 10.
 */
public class SocialEvidenceSource extends GroupingEvidenceSource<SocialEvidenceSource.Tie> {
  static final int MUTUAL_BONUS = 10;

  /** Handles a person owns and lists on one platform. */
  record Footprint(Set<String> own, Set<String> listed) {}

  /** Membership of a person in one handle group. */
  record Tie(String platform, String handle, Footprint footprint, boolean owner) {}

  @Override
  public String id() {
    return "social";
  }

  @Override
  protected RelationshipType type() {
    return RelationshipType.SOCIAL;
  }

  static String handle(String raw) {
    if (raw == null) return "";
    String h = raw.trim().toLowerCase(Locale.ROOT);
    return h.startsWith("@") ? h.substring(1) : h;
  }

  @Override
  protected void evidence(Person person, BiConsumer<String, Tie> sink) {
    Map<String, Footprint> byPlatform = new LinkedHashMap<>();
    Map<String, String> platformNames = new LinkedHashMap<>();
    for (SocialProfile profile : person.socialProfiles()) {
      String platform = TextNormalizer.normalizeKey(profile.platform());
      if (platform.isEmpty()) continue;
      platformNames.putIfAbsent(platform, profile.platform().trim());
      Footprint f =
          byPlatform.computeIfAbsent(
              platform, k -> new Footprint(new TreeSet<>(), new TreeSet<>()));
      String own = handle(profile.handle());
      if (!own.isEmpty()) f.own().add(own);
      profile.connections().stream()
          .map(SocialEvidenceSource::handle)
          .filter(h -> !h.isEmpty())
          .forEach(f.listed()::add);
    }
    byPlatform.forEach(
        (platform, f) -> {
          Footprint frozen =
              new Footprint(
                  Collections.unmodifiableSet(f.own()), Collections.unmodifiableSet(f.listed()));
          String name = platformNames.get(platform);
          for (String h : frozen.own()) {
            sink.accept(platform + "|" + h, new Tie(name, h, frozen, true));
          }
          for (String h : frozen.listed()) {
            sink.accept(platform + "|" + h, new Tie(name, h, frozen, false));
          }
        });
  }

  @Override
  protected Tie merge(Tie existing, Tie incoming) {
    return existing.owner() ? existing : incoming;
  }

  @Override
  protected boolean acceptGroup(Map<String, Tie> members) {
    return members.values().stream().anyMatch(Tie::owner);
  }

  /** Followers are only related through the owner of the handle. */
  @Override
  protected boolean pinned(Tie tie) {
    return tie.owner();
  }

  @Override
  protected int modifier(Tie a, Tie b, IngestionContext context) {
    return isMutual(a.footprint(), b.footprint()) ? MUTUAL_BONUS : 0;
  }

  static boolean isMutual(Footprint a, Footprint b) {
    return !Collections.disjoint(a.listed(), b.own()) && !Collections.disjoint(b.listed(), a.own());
  }

  @Override
  protected Map<String, Object> metadata(String groupKey, Tie a, Tie b) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("platform", a.platform());
    m.put("handle", a.handle());
    m.put("mutual", isMutual(a.footprint(), b.footprint()));
    return m;
  }
}
