package com.gentoro.warmpath.exception;

import java.util.Map;

/** I/O operation failed (filesystem, classpath, network streams). */
public class IoException extends WarmPathException {
  public IoException(String message) {
    super(WarmPathErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(WarmPathErrorCode.IO_ERROR, message, cause);
  }

  public IoException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.IO_ERROR, message, context);
  }
}
