package com.gentoro.warmpath.ingestion.source;

import com.gentoro.warmpath.utility.TextNormalizer;
import java.util.Set;

/** Coarse academic level of a degree title such as "BSc", "MBA" or "PhD". */
public enum DegreeLevel {
  ASSOCIATE,
  BACHELOR,
  MASTER,
  DOCTORATE,
  UNKNOWN;

  private static final Set<String> ASSOCIATE_WORDS = Set.of("associate", "associates", "aa", "as");
  private static final Set<String> BACHELOR_WORDS =
      Set.of("bachelor", "bachelors", "ba", "bs", "bsc", "beng", "bba", "ab");
  private static final Set<String> MASTER_WORDS =
      Set.of("master", "masters", "ma", "ms", "msc", "meng", "mba", "mfa", "mpa");
  private static final Set<String> DOCTORATE_WORDS =
      Set.of("phd", "doctorate", "doctor", "dphil", "md", "jd", "edd");

  public static DegreeLevel of(String degree) {
    for (String word : TextNormalizer.tokens(degree == null ? null : degree.replace(".", ""))) {
      if (DOCTORATE_WORDS.contains(word)) return DOCTORATE;
      if (MASTER_WORDS.contains(word)) return MASTER;
      if (BACHELOR_WORDS.contains(word)) return BACHELOR;
      if (ASSOCIATE_WORDS.contains(word)) return ASSOCIATE;
    }
    return UNKNOWN;
  }
}
