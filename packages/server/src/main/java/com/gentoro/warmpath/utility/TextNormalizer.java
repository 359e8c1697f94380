package com.gentoro.warmpath.utility;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/** Normalization helpers shared by evidence grouping and identity matching. */
public final class TextNormalizer {
  private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
  private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Legal-entity suffixes ignored when comparing company names. */
  public static final Set<String> COMPANY_SUFFIXES =
      Set.of(
          "inc",
          "incorporated",
          "llc",
          "ltd",
          "limited",
          "corp",
          "corporation",
          "company",
          "co",
          "plc",
          "gmbh");

  private TextNormalizer() {}

  /** Lower-cases, drops punctuation and collapses whitespace. Null becomes the empty string. */
  public static String normalizeKey(String value) {
    if (value == null) return "";
    String s = APOSTROPHES.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
    s = NON_WORD.matcher(s).replaceAll(" ");
    return WHITESPACE.matcher(s).replaceAll(" ").trim();
  }

  /** Normalized company name with trailing legal suffixes removed ("Acme, Inc." is "acme"). */
  public static String normalizeCompany(String company) {
    List<String> parts = new ArrayList<>(tokens(company));
    while (parts.size() > 1 && COMPANY_SUFFIXES.contains(parts.get(parts.size() - 1))) {
      parts.remove(parts.size() - 1);
    }
    return String.join(" ", parts);
  }

  public static List<String> tokens(String value) {
    String key = normalizeKey(value);
    if (key.isEmpty()) return List.of();
    return Arrays.asList(key.split(" "));
  }

  /**
   * Surname of a display name: the text before the comma for "Last, First", otherwise the last
   * word.
   */
  public static String surname(String name) {
    if (name == null || name.isBlank()) return "";
    int comma = name.indexOf(',');
    if (comma > 0) {
      return normalizeKey(name.substring(0, comma));
    }
    List<String> parts = tokens(name);
    return parts.isEmpty() ? "" : parts.get(parts.size() - 1);
  }

  /**
   * Company spellings considered equivalent: as given, without legal suffix and with the common
   * "inc" and "llc" suffixes added back. All values are normalized.
   */
  public static Set<String> companyVariants(String company) {
    Set<String> variants = new LinkedHashSet<>();
    String given = normalizeKey(company);
    if (given.isEmpty()) return variants;
    String base = normalizeCompany(company);
    variants.add(given);
    variants.add(base);
    variants.add(base + " inc");
    variants.add(base + " llc");
    return variants;
  }

  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
