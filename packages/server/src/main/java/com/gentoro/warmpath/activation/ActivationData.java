package com.gentoro.warmpath.activation;

/** Optional profile details supplied by a ghost person when claiming their profile. */
public record ActivationData(
    String name, String email, String company, String title, String location) {

  public static ActivationData none() {
    return new ActivationData(null, null, null, null, null);
  }
}
