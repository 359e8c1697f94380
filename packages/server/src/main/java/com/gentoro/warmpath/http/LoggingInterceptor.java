package com.gentoro.warmpath.http;

import java.io.IOException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okio.Buffer;
import org.jetbrains.annotations.NotNull;

/** Logs outbound calls at debug level. Authorization headers are redacted. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(LoggingInterceptor.class);

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "Sending {} {}\nHeaders:\n{}\nBody:\n{}\n",
          request.method(),
          request.url(),
          request.headers().newBuilder().removeAll("Authorization").build(),
          bodyToString(request));
    }

    Response response = chain.proceed(request);

    log.debug(
        "Received HTTP {} from {} in {} ms",
        response.code(),
        response.request().url(),
        String.format("%.1f", (System.nanoTime() - startTime) / 1e6d));
    if (log.isTraceEnabled()) {
      log.trace("Response body:\n{}\n", response.peekBody(64 * 1024).string());
    }
    return response;
  }

  private static String bodyToString(Request request) {
    if (request.body() == null) return "";
    try {
      Buffer buffer = new Buffer();
      request.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
