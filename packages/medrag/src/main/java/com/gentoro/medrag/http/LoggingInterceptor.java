package com.gentoro.medrag.http;

import java.io.IOException;
import java.util.Set;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.medrag.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final Set<String> SECRET_PARAMS = Set.of("apikey", "api_key", "ticket");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    String url = redact(request.url());

    long startTime = System.nanoTime();
    log.debug("Sending {} {}", request.method(), url);

    Response response = chain.proceed(request);

    long endTime = System.nanoTime();
    log.debug(
        "Received response for {} in {} ms, status {}",
        url,
        String.format("%.1f", (endTime - startTime) / 1e6d),
        response.code());

    if (log.isTraceEnabled()) {
      ResponseBody responseBody = response.peekBody(Long.MAX_VALUE);
      log.trace("Response body:\n{}\n", responseBody.string());
    }

    return response;
  }

  /** Renders the URL with credential-bearing query parameters masked. */
  public static String redact(HttpUrl url) {
    HttpUrl.Builder builder = url.newBuilder();
    for (String name : url.queryParameterNames()) {
      if (SECRET_PARAMS.contains(name.toLowerCase())) {
        builder.setQueryParameter(name, "***");
      }
    }
    return builder.build().toString();
  }
}
