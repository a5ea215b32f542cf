package org.maap.client.http;

import static org.junit.jupiter.api.Assertions.*;

import okhttp3.Headers;
import org.junit.jupiter.api.Test;

class ApiHeadersTest {

  @Test
  void plainTokenGoesInTokenHeader() {
    Headers h = ApiHeaders.build("application/xml", "abc123", null);

    assertEquals("application/xml", h.get("Accept"));
    assertEquals("application/xml", h.get("Content-Type"));
    assertEquals("abc123", h.get("token"));
    assertNull(h.get("Authorization"));
    assertNull(h.get("proxy-ticket"));
  }

  @Test
  void schemedTokenGoesInAuthorization() {
    assertEquals(
        "Bearer xyz", ApiHeaders.build("application/json", "Bearer xyz", "").get("Authorization"));
    assertEquals(
        "basic dXNlcg==",
        ApiHeaders.build("application/json", "basic dXNlcg==", "").get("Authorization"));
  }

  @Test
  void proxyTicketIsAddedWhenPresent() {
    Headers h = ApiHeaders.build("application/json", "", "PGT-1-abc");

    assertEquals("PGT-1-abc", h.get("proxy-ticket"));
    assertNull(h.get("token"));
  }

  @Test
  void eachCallReturnsIndependentHeaders() {
    Headers first = ApiHeaders.build("application/xml", "t1", null);
    Headers second = ApiHeaders.build("application/json", "t2", null);

    assertEquals("t1", first.get("token"));
    assertEquals("application/xml", first.get("Accept"));
    assertEquals("t2", second.get("token"));
  }
}
