package com.gentoro.warmpath.exception;

import java.util.Map;

/** The evidence store could not be read or written. Callers treat it as transient. */
public class EvidenceStoreException extends WarmPathException {
  public EvidenceStoreException(String message) {
    super(WarmPathErrorCode.UNAVAILABLE, message);
  }

  public EvidenceStoreException(String message, Throwable cause) {
    super(WarmPathErrorCode.UNAVAILABLE, message, cause);
  }

  public EvidenceStoreException(String message, Map<String, ?> context) {
    super(WarmPathErrorCode.UNAVAILABLE, message, context);
  }
}
