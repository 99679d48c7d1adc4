package com.gentoro.medrag.http;

import static org.junit.jupiter.api.Assertions.*;

import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

class LoggingInterceptorTest {

  @Test
  void redactsCredentialQueryParameters() {
    HttpUrl url =
        HttpUrl.get("https://uts.example.org/rest/content/current/CUI/C1?apiKey=top-secret&page=2");

    String redacted = LoggingInterceptor.redact(url);

    assertFalse(redacted.contains("top-secret"));
    assertTrue(redacted.contains("apiKey="));
    assertTrue(redacted.contains("page=2"));
    assertTrue(redacted.contains("/CUI/C1"));
  }

  @Test
  void leavesUrlsWithoutCredentialsUntouched() {
    HttpUrl url = HttpUrl.get("https://uts.example.org/rest/search?string=fever");

    assertEquals(url.toString(), LoggingInterceptor.redact(url));
  }
}
