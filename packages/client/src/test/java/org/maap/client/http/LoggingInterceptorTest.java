package org.maap.client.http;

import static org.junit.jupiter.api.Assertions.*;

import okhttp3.Headers;
import org.junit.jupiter.api.Test;

class LoggingInterceptorTest {

  @Test
  void redactsCredentialHeaders() {
    Headers headers =
        new Headers.Builder()
            .add("Authorization", "Bearer secret")
            .add("token", "abc123")
            .add("proxy-ticket", "PGT-1")
            .add("dps-machine-token", "m-value")
            .add("Accept", "application/xml")
            .build();

    String rendered = LoggingInterceptor.redact(headers);

    assertFalse(rendered.contains("secret"));
    assertFalse(rendered.contains("abc123"));
    assertFalse(rendered.contains("PGT-1"));
    assertFalse(rendered.contains("m-value"));
    assertTrue(rendered.contains("token: ***"));
    assertTrue(rendered.contains("application/xml"));
  }
}
