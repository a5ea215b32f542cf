package org.maap.client.auth;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DpsTokenClientTest {

  MockWebServer server;
  DpsTokenClient client;
  AuthContext.JobRuntimeToken ctx;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    client = new DpsTokenClient(new OkHttpClient());
    ctx = new AuthContext.JobRuntimeToken("mt-1", "job-1", server.url("/token").toString());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void exchangesMachineTokenForPair() throws Exception {
    server.enqueue(new MockResponse().setBody("{\"user_token\":\"u1\",\"app_token\":\"a1\"}"));

    Optional<DpsTokenClient.TokenPair> pair = client.exchange(ctx);

    assertTrue(pair.isPresent());
    assertEquals("Bearer u1,Basic a1", pair.get().authorizationHeader());
    RecordedRequest req = server.takeRequest();
    assertEquals("mt-1", req.getHeader("dps-machine-token"));
    assertEquals("job-1", req.getHeader("dps-job-id"));
  }

  @Test
  void refusedOrIncompleteExchangeIsEmpty() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(403));
    server.enqueue(new MockResponse().setBody("{\"user_token\":\"u1\"}"));
    server.enqueue(new MockResponse().setBody("not json"));

    assertTrue(client.exchange(ctx).isEmpty());
    assertTrue(client.exchange(ctx).isEmpty());
    assertTrue(client.exchange(ctx).isEmpty());
  }
}
