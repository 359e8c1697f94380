package com.gentoro.warmpath;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);

    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesNamedArguments() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "rebuild", "stray", "--config-file", "/etc/warmpath.yaml"});

    assertEquals("rebuild", params.mode());
    assertEquals("/etc/warmpath.yaml", params.configFile());
    assertFalse(params.isParameterPresent("stray"));
  }

  @Test
  void flagWithoutValue() {
    StartupParameters params = new StartupParameters(new String[] {"--verbose", "--mode", "help"});

    assertTrue(params.isParameterPresent("verbose"));
    assertTrue(params.getOptionalParameter("verbose", String.class).isEmpty());
    assertEquals("help", params.mode());
  }

  @Test
  void rejectsInvalidArguments() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "serve"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "server", "--config-file"}));
  }
}
