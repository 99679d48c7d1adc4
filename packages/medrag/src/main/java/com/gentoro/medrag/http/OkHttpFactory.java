package com.gentoro.medrag.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .callTimeout(connectTimeout.plus(readTimeout))
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
