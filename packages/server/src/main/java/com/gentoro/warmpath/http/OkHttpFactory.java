package com.gentoro.warmpath.http;

import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create() {
    return create(10, 20);
  }

  public static OkHttpClient create(int connectTimeoutSeconds, int readTimeoutSeconds) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
        .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
