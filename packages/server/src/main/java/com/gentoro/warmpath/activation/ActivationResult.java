package com.gentoro.warmpath.activation;

public record ActivationResult(boolean success, String userId, String message) {

  static ActivationResult failed(String userId, String message) {
    return new ActivationResult(false, userId, message);
  }
}
