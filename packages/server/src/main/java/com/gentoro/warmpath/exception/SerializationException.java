package com.gentoro.warmpath.exception;

import java.util.Map;

/** Serialization or deserialization failure (JSON, YAML). */
public class SerializationException extends WarmPathException {
  public SerializationException(String message) {
    super(WarmPathErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(WarmPathErrorCode.SERIALIZATION_ERROR, message, cause);
  }

  public SerializationException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.SERIALIZATION_ERROR, message, context);
  }
}
