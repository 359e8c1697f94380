package com.gentoro.warmpath.exception;

import java.util.Map;

/** Notification dispatch failed; never fatal to the operation that triggered it. */
public class NotificationException extends WarmPathException {
  public NotificationException(String message) {
    super(WarmPathErrorCode.NETWORK_ERROR, message);
  }

  public NotificationException(String message, Throwable cause) {
    super(WarmPathErrorCode.NETWORK_ERROR, message, cause);
  }

  public NotificationException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.NETWORK_ERROR, message, context);
  }
}
