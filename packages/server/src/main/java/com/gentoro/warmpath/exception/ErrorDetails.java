package com.gentoro.warmpath.exception;

import java.time.Instant;
import java.util.Map;

/** Error body returned by the API; also handy for structured log lines. */
public final class ErrorDetails {
  public final int status;
  public final WarmPathErrorCode code;
  public final String type;
  public final String message;
  public final Map<String, Object> context;
  public final Instant timestamp;

  ErrorDetails(
      WarmPathErrorCode code,
      String type,
      String message,
      Map<String, Object> context,
      Instant timestamp) {
    this.status = code.httpStatus();
    this.code = code;
    this.type = type;
    this.message = message == null ? "" : message;
    this.context = context == null || context.isEmpty() ? null : context;
    this.timestamp = timestamp;
  }
}
