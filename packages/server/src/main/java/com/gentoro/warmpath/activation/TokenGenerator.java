package com.gentoro.warmpath.activation;

import java.security.SecureRandom;
import java.util.HexFormat;

/** Unguessable activation tokens: 32 random bytes, hex encoded. */
public class TokenGenerator {
  private static final int TOKEN_BYTES = 32;

  private final SecureRandom random = new SecureRandom();

  public String next() {
    byte[] bytes = new byte[TOKEN_BYTES];
    random.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
