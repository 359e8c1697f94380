package com.gentoro.warmpath.exception;

import java.time.Instant;
import java.util.function.Function;

/** Helpers for mapping exceptions onto {@link ErrorDetails} and error codes. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Describe a throwable for an API response. Codes and context of {@link WarmPathException}s are
   * kept, anything else is reported as {@link WarmPathErrorCode#UNKNOWN}.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    WarmPathErrorCode code = WarmPathErrorCode.UNKNOWN;
    java.util.Map<String, Object> context = null;
    if (t instanceof WarmPathException ex) {
      code = ex.getCode();
      context = ex.getContext();
    }
    return new ErrorDetails(
        code, t.getClass().getSimpleName(), t.getMessage(), context, Instant.now());
  }

  public static int httpStatus(WarmPathErrorCode code) {
    return code == null ? 500 : code.httpStatus();
  }

  /** Pass {@link WarmPathException}s through, wrap anything else with {@code wrapper}. */
  public static WarmPathException rethrowIfUnchecked(
      Throwable t, Function<Throwable, WarmPathException> wrapper) {
    if (t instanceof WarmPathException) {
      return (WarmPathException) t;
    }
    return wrapper.apply(t);
  }
}
