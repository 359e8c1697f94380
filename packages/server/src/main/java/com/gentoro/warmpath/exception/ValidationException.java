package com.gentoro.warmpath.exception;

import java.util.Map;

/** Input validation failure or illegal argument. */
public class ValidationException extends WarmPathException {
  public ValidationException(String message) {
    super(WarmPathErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(WarmPathErrorCode.INVALID_ARGUMENT, message, cause);
  }

  public ValidationException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.INVALID_ARGUMENT, message, context);
  }
}
