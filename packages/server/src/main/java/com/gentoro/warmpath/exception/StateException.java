package com.gentoro.warmpath.exception;

import java.util.Map;

/** Transition attempted from a state that does not allow it. */
public class StateException extends WarmPathException {
  public StateException(String message) {
    super(WarmPathErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(WarmPathErrorCode.FAILED_PRECONDITION, message, cause);
  }

  public StateException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.FAILED_PRECONDITION, message, context);
  }
}
