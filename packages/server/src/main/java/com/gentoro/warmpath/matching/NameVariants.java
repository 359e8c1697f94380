package com.gentoro.warmpath.matching;

import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Spellings of a person name considered identical: as given, first and last only, last name first
 * and the two initial forms ("J. Smith", "John S."). Values are normalized with {@link
 * TextNormalizer#normalizeKey(String)}, so punctuation and case do not matter.
 */
final class NameVariants {
  private NameVariants() {}

  static Set<String> of(String name) {
    Set<String> variants = new LinkedHashSet<>();
    String given = TextNormalizer.normalizeKey(name);
    if (given.isEmpty()) return variants;
    variants.add(given);

    String first;
    String last;
    int comma = name.indexOf(',');
    if (comma > 0) {
      List<String> after = TextNormalizer.tokens(name.substring(comma + 1));
      first = after.isEmpty() ? "" : after.get(0);
      last = TextNormalizer.normalizeKey(name.substring(0, comma));
    } else {
      List<String> tokens = TextNormalizer.tokens(name);
      if (tokens.size() < 2) return variants;
      first = tokens.get(0);
      last = tokens.get(tokens.size() - 1);
    }
    if (first.isEmpty() || last.isEmpty()) return variants;

    variants.add(first + " " + last);
    variants.add(last + " " + first);
    variants.add(first.charAt(0) + " " + last);
    variants.add(first + " " + last.charAt(0));
    return variants;
  }
}
