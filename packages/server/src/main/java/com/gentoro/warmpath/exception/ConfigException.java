package com.gentoro.warmpath.exception;

import java.util.Map;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends WarmPathException {
  public ConfigException(String message) {
    super(WarmPathErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(WarmPathErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.CONFIGURATION_ERROR, message, context);
  }
}
