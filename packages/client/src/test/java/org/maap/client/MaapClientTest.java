package org.maap.client;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.maap.client.auth.AuthContext;
import org.maap.client.dps.CancellationSignal;
import org.maap.client.dps.DpsJob;
import org.maap.client.dps.JobSpec;
import org.maap.client.dps.JobStatus;
import org.maap.client.dps.PollResult;
import org.maap.client.retrieval.Granule;

class MaapClientTest {

  @TempDir Path temp;

  MockWebServer server;
  AtomicInteger statusCalls;
  AtomicInteger downloads;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    statusCalls = new AtomicInteger();
    downloads = new AtomicInteger();
    server.setDispatcher(
        new Dispatcher() {
          @NotNull
          @Override
          public MockResponse dispatch(@NotNull RecordedRequest request) {
            String path = request.getPath();
            if ("POST".equals(request.getMethod()) && "/api/dps/job".equals(path)) {
              return new MockResponse()
                  .setBody("{\"status\":\"success\",\"http_status_code\":200,\"job_id\":\"j-1\"}");
            }
            if ("/api/dps/job/j-1/status".equals(path)) {
              String status = statusCalls.incrementAndGet() < 3 ? "Running" : "Succeeded";
              return new MockResponse()
                  .setBody(
                      "<StatusInfo><JobID>j-1</JobID><Status>" + status + "</Status></StatusInfo>");
            }
            if ("/api/dps/job/j-1".equals(path)) {
              return new MockResponse()
                  .setBody(
                      "<Result><Output><Data>s3://bucket/out/result.tif</Data><Data>"
                          + server.url("/out/result.tif")
                          + "</Data><Data>https://console.example/out/result.tif</Data>"
                          + "</Output></Result>");
            }
            if ("/api/dps/job/j-1/metrics".equals(path)) {
              return new MockResponse()
                  .setBody("<metrics><machine_type>t3.large</machine_type></metrics>");
            }
            if ("/out/result.tif".equals(path)) {
              downloads.incrementAndGet();
              return new MockResponse().setBody("tif-bytes");
            }
            return new MockResponse().setResponseCode(404);
          }
        });
    server.start();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  private MaapClient client() {
    return MaapClient.builder()
        .config(TestConfigs.forServer(server.url("/").toString(), temp))
        .sleeper((duration, signal) -> signal.isCancelled())
        .s3Fetcher(
            (object, target) -> {
              throw new AssertionError("unexpected S3 fetch");
            })
        .ftpFetcher(
            (url, target) -> {
              throw new AssertionError("unexpected FTP fetch");
            })
        .build();
  }

  @Test
  void submitPollFetchAndDownload() throws Exception {
    try (MaapClient maap = client()) {
      DpsJob job = maap.submitJob(JobSpec.builder("algo", "main", "queue").build());
      assertEquals(JobStatus.ACCEPTED, job.status());

      PollResult result = maap.waitForCompletion(job);
      assertTrue(result.completed());
      assertEquals(3, result.attempts());

      maap.getJobResult(job.requireSucceeded());
      List<String> outputs = job.outputs();
      assertEquals(
          List.of(
              "s3://bucket/out/result.tif",
              server.url("/out/result.tif").toString(),
              "https://console.example/out/result.tif"),
          outputs);

      Path dir = temp.resolve("downloads");
      Path file = maap.downloadGranule(outputs.get(1), dir, false);
      assertEquals(dir.resolve("result.tif"), file);
      assertEquals("tif-bytes", Files.readString(file));

      maap.downloadGranule(outputs.get(1), dir, false);
      assertEquals(1, downloads.get());
    }
  }

  @Test
  void getJobLoadsStatusResultsAndMetrics() throws Exception {
    statusCalls.set(10);
    try (MaapClient maap = client()) {
      DpsJob job = maap.getJob("j-1");

      assertEquals(JobStatus.SUCCEEDED, job.status());
      assertEquals(3, job.outputs().size());
      assertEquals("t3.large", job.jobMetrics().machineType());
    }
  }

  @Test
  void cancelledWaitReportsCancellation() throws Exception {
    CancellationSignal signal = new CancellationSignal();
    signal.cancel();
    try (MaapClient maap = client()) {
      PollResult result = maap.waitForCompletion(DpsJob.forId("j-1"), signal);

      assertEquals(PollResult.Termination.CANCELLED, result.termination());
      assertEquals(0, statusCalls.get());
    }
  }

  @Test
  void getDataUsesGranuleLocation() throws Exception {
    String url = server.url("/out/result.tif").toString();
    try (MaapClient maap = client()) {
      assertInstanceOf(AuthContext.ProxyDelegate.class, maap.authContext());
      Granule granule =
          maap.granule(
              new ObjectMapper()
                  .readTree(
                      "{\"Granule\":{\"OnlineAccessURLs\":{\"OnlineAccessURL\":[{\"URL\":\""
                          + url
                          + "\"}]}}}"));

      Optional<Path> file = maap.getData(granule, temp, false);

      assertEquals(temp.resolve("result.tif"), file.orElseThrow());
      Granule empty = maap.granule(new ObjectMapper().readTree("{\"Granule\":{}}"));
      assertTrue(maap.getData(empty, temp, false).isEmpty());
    }
  }
}
