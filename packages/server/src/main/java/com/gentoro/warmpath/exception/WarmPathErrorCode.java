package com.gentoro.warmpath.exception;

/**
 * Stable error codes reported by the engine and the HTTP API. Each code carries the HTTP status
 * the API answers with.
 */
public enum WarmPathErrorCode {
  UNKNOWN(500),
  INVALID_ARGUMENT(400),
  NOT_FOUND(404),
  // invitation already used or expired, rebuild already running
  FAILED_PRECONDITION(409),
  UNAVAILABLE(503),

  CONFIGURATION_ERROR(500),
  IO_ERROR(500),
  SERIALIZATION_ERROR(500),
  NETWORK_ERROR(503);

  private final int httpStatus;

  WarmPathErrorCode(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
