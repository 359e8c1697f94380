package com.gentoro.warmpath.exception;

import java.util.Map;

/** Referenced person or invitation does not exist. */
public class NotFoundException extends WarmPathException {
  public NotFoundException(String message) {
    super(WarmPathErrorCode.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(WarmPathErrorCode.NOT_FOUND, message, cause);
  }

  public NotFoundException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.NOT_FOUND, message, context);
  }
}
