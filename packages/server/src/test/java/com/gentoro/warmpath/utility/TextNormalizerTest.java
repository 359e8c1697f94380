package com.gentoro.warmpath.utility;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextNormalizerTest {

  @Test
  void normalizeKey() {
    assertEquals("obrien smith jr", TextNormalizer.normalizeKey("  O'Brien-Smith, Jr. "));
    assertEquals("m i t", TextNormalizer.normalizeKey("M.I.T."));
    assertEquals("", TextNormalizer.normalizeKey(null));
  }

  @Test
  void normalizeCompanyDropsTrailingLegalSuffixes() {
    assertEquals("acme", TextNormalizer.normalizeCompany("Acme, Inc."));
    assertEquals("acme", TextNormalizer.normalizeCompany("ACME Corp"));
    assertEquals("the", TextNormalizer.normalizeCompany("The Co Company"));
    assertEquals("inc", TextNormalizer.normalizeCompany("Inc"));
    assertEquals("", TextNormalizer.normalizeCompany(null));
  }

  @Test
  void companyVariants() {
    assertEquals(
        List.of("acme corp", "acme", "acme inc", "acme llc"),
        List.copyOf(TextNormalizer.companyVariants("Acme Corp")));
    assertTrue(TextNormalizer.companyVariants(" ").isEmpty());
  }

  @Test
  void surname() {
    assertEquals("smith", TextNormalizer.surname("Smith, John"));
    assertEquals("smith", TextNormalizer.surname("John van Smith"));
    assertEquals("", TextNormalizer.surname(null));
  }

  @Test
  void tokens() {
    assertEquals(List.of("vp", "engineering"), TextNormalizer.tokens("VP, Engineering"));
    assertTrue(TextNormalizer.tokens("  ").isEmpty());
  }
}
