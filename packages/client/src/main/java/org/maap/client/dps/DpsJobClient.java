package org.maap.client.dps;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import okhttp3.Headers;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.maap.client.config.MaapConfig;
import org.maap.client.exception.DocumentParseException;
import org.maap.client.exception.ExceptionUtil;
import org.maap.client.exception.MaapException;
import org.maap.client.exception.RemoteCallException;
import org.maap.client.exception.TransportException;
import org.maap.client.http.ApiHeaders;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Talks to the DPS job API on behalf of {@link DpsJob} handles: submission, status, results,
 * metrics and cancellation.
 *
 * <p>Submission never throws for business outcomes; a rejected, malformed or unreachable
 * submission yields a job in {@link JobStatus#FAILED} with the cause in {@link
 * DpsJob#errorDetails()}. The refresh operations throw {@link RemoteCallException} for non-success
 * HTTP codes, {@link TransportException} for network failures and {@link DocumentParseException}
 * for undecodable bodies.
 */
public class DpsJobClient {
  private static final Logger log = LoggingService.getLogger(DpsJobClient.class);

  static final String XML = "application/xml";
  static final String JSON = "application/json";
  private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient http;
  private final MaapConfig config;
  private final StatusDocumentParser parser;
  private final ObjectMapper mapper;

  public DpsJobClient(OkHttpClient http, MaapConfig config) {
    this(http, config, new ObjectMapper());
  }

  public DpsJobClient(OkHttpClient http, MaapConfig config, ObjectMapper mapper) {
    this.http = http;
    this.config = config;
    this.mapper = mapper;
    this.parser = new StatusDocumentParser(mapper);
  }

  // --------------------------------------------------------------------
  // Submission
  // --------------------------------------------------------------------

  public DpsJob submit(JobSpec spec) {
    return submit(spec, false);
  }

  /**
   * Submit a job. When {@code retrieveAttributes} is set and the submission was accepted, the
   * job's status (and results/metrics, if already terminal) are fetched right away; failures of
   * that follow-up are logged and ignored.
   */
  public DpsJob submit(JobSpec spec, boolean retrieveAttributes) {
    if (spec == null) {
      throw new IllegalArgumentException("JobSpec cannot be null");
    }
    DpsJob job = DpsJob.fromAck(sendSubmission(spec));
    log.debug("Submitted {}:{} on {} -> {}", spec.algorithmId(), spec.version(), spec.queue(), job);
    if (retrieveAttributes && job.status() == JobStatus.ACCEPTED) {
      try {
        refreshAttributes(job);
      } catch (MaapException e) {
        log.debug(
            "Unable to retrieve attributes for job {}: {}",
            job.id(),
            ExceptionUtil.formatCompactStackTrace(e));
      }
    }
    return job;
  }

  private SubmissionAck sendSubmission(JobSpec spec) {
    String url = config.dpsJobEndpoint();
    String payload;
    try {
      payload = mapper.writeValueAsString(spec);
    } catch (JsonProcessingException e) {
      return SubmissionAck.failed(0, "Could not serialize job spec: " + e.getOriginalMessage());
    }

    Request request =
        new Request.Builder()
            .url(url)
            .headers(headers(JSON))
            .post(RequestBody.create(payload, JSON_MEDIA_TYPE))
            .build();
    try (Response response = http.newCall(request).execute()) {
      String body = bodyOf(response);
      if (response.code() != 200 && response.code() != 201) {
        log.debug("Submission rejected with HTTP {}", response.code());
        return SubmissionAck.failed(response.code(), body);
      }
      try {
        return parser.parseAck(body);
      } catch (DocumentParseException e) {
        log.debug("Unparsable submission acknowledgment: {}", e.getMessage());
        return SubmissionAck.failed(response.code(), body);
      }
    } catch (IOException e) {
      log.warn("Submission to {} failed: {}", url, e.toString());
      return SubmissionAck.failed(0, ExceptionUtil.extractErrorMessage(e));
    }
  }

  // --------------------------------------------------------------------
  // Refresh operations
  // --------------------------------------------------------------------

  /** Fetch the status document and update {@code job} in place. */
  public DpsJob refreshStatus(DpsJob job) {
    String body = get(jobUrl(job, config.statusSuffix()), XML);
    StatusDocumentParser.StatusInfo info = parser.parseStatus(body);
    job.updateStatus(info.jobId(), info.status());
    return job;
  }

  /**
   * Fetch the output URLs of a finished job. Each call replaces the previous outputs.
   *
   * @throws IllegalStateException if the job is not in a terminal state
   */
  public DpsJob refreshResult(DpsJob job) {
    requireTerminal(job, "results");
    String body = get(jobUrl(job, null), XML);
    StatusDocumentParser.ResultDocument doc = parser.parseResults(body);
    job.replaceResults(doc.outputs(), doc.traceback());
    return job;
  }

  /**
   * Fetch the metrics of a finished job. Each call replaces the previous metrics.
   *
   * @throws IllegalStateException if the job is not in a terminal state
   */
  public DpsJob refreshMetrics(DpsJob job) {
    requireTerminal(job, "metrics");
    String body = get(jobUrl(job, config.metricsSuffix()), XML);
    job.replaceMetrics(parser.parseMetrics(body));
    return job;
  }

  /**
   * Refresh the status, then results and metrics when the job succeeded or failed. Failed jobs
   * may not publish metrics, so errors from those two calls are logged at debug and ignored.
   */
  public DpsJob refreshAttributes(DpsJob job) {
    refreshStatus(job);
    if (job.status().hasOutcome()) {
      try {
        refreshResult(job);
      } catch (MaapException e) {
        log.debug("No results for job {}: {}", job.id(), ExceptionUtil.extractErrorMessage(e));
      }
      try {
        refreshMetrics(job);
      } catch (MaapException e) {
        log.debug("No metrics for job {}: {}", job.id(), ExceptionUtil.extractErrorMessage(e));
      }
    }
    return job;
  }

  /**
   * Ask the service to dismiss the job. Returns the service's response body without waiting for
   * the transition; refresh the status to observe {@link JobStatus#DISMISSED}.
   */
  public String cancel(DpsJob job) {
    HttpUrl url =
        HttpUrl.get(config.dpsJobEndpoint())
            .newBuilder()
            .addPathSegment(config.dismissSuffix())
            .addPathSegment(job.id())
            .build();
    Request request =
        new Request.Builder()
            .url(url)
            .headers(headers(XML))
            .post(RequestBody.create(new byte[0], null))
            .build();
    return execute(request);
  }

  // --------------------------------------------------------------------
  // Internals
  // --------------------------------------------------------------------

  private Headers headers(String contentType) {
    return ApiHeaders.build(contentType, config.token(), config.proxyTicket());
  }

  private HttpUrl jobUrl(DpsJob job, String suffix) {
    HttpUrl.Builder builder =
        HttpUrl.get(config.dpsJobEndpoint()).newBuilder().addPathSegment(job.id());
    if (suffix != null && !suffix.isBlank()) builder.addPathSegment(suffix);
    return builder.build();
  }

  private String get(HttpUrl url, String accept) {
    Request request = new Request.Builder().url(url).headers(headers(accept)).get().build();
    return execute(request);
  }

  private String execute(Request request) {
    try (Response response = http.newCall(request).execute()) {
      String body = bodyOf(response);
      if (response.code() != 200 && response.code() != 201) {
        throw new RemoteCallException(request.url().toString(), response.code(), body);
      }
      return body;
    } catch (IOException e) {
      throw new TransportException(request.url().toString(), e);
    }
  }

  private static String bodyOf(Response response) throws IOException {
    ResponseBody body = response.body();
    return body == null ? "" : body.string();
  }

  private static void requireTerminal(DpsJob job, String what) {
    if (!job.isTerminal()) {
      throw new IllegalStateException(
          "Job " + job.id() + " is " + job.statusText() + "; " + what + " are not available yet");
    }
  }
}
