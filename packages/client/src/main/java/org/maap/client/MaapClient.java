package org.maap.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;
import okhttp3.OkHttpClient;
import org.maap.client.auth.AuthContext;
import org.maap.client.auth.AuthContextResolver;
import org.maap.client.auth.DpsTokenClient;
import org.maap.client.config.MaapConfig;
import org.maap.client.dps.BackoffPolicy;
import org.maap.client.dps.CancellationSignal;
import org.maap.client.dps.DpsJob;
import org.maap.client.dps.DpsJobClient;
import org.maap.client.dps.JobPoller;
import org.maap.client.dps.JobSpec;
import org.maap.client.dps.PollResult;
import org.maap.client.http.OkHttpFactory;
import org.maap.client.logging.LoggingService;
import org.maap.client.retrieval.AwsS3ObjectFetcher;
import org.maap.client.retrieval.Collection;
import org.maap.client.retrieval.CommonsNetFtpFetcher;
import org.maap.client.retrieval.DownloadCandidate;
import org.maap.client.retrieval.FtpFetcher;
import org.maap.client.retrieval.Granule;
import org.maap.client.retrieval.HttpDownloader;
import org.maap.client.retrieval.Location;
import org.maap.client.retrieval.LocationResolver;
import org.maap.client.retrieval.Retriever;
import org.maap.client.retrieval.S3ObjectFetcher;
import org.maap.client.retrieval.SearchResult;
import org.slf4j.Logger;

/**
 * Entry point of the client: submits and tracks DPS jobs and downloads catalog results.
 *
 * <pre>{@code
 * try (MaapClient maap = MaapClient.builder().build()) {
 *   DpsJob job = maap.submitJob(JobSpec.builder("my-algo", "main", "maap-dps-worker-8gb").build());
 *   maap.waitForCompletion(job).requireSucceeded();
 *   maap.getJobResult(job).outputs().forEach(System.out::println);
 * }
 * }</pre>
 */
public class MaapClient implements AutoCloseable {
  private static final Logger log = LoggingService.getLogger(MaapClient.class);

  private final MaapConfig config;
  private final AuthContext auth;
  private final DpsJobClient jobs;
  private final JobPoller poller;
  private final LocationResolver locations;
  private final Retriever retriever;
  private final AutoCloseable s3Resource;

  private MaapClient(Builder builder) {
    this.config = builder.config != null ? builder.config : MaapConfig.load();
    LoggingService.applyConfiguration(config.source());

    ObjectMapper mapper = new ObjectMapper();
    OkHttpClient http = builder.http != null ? builder.http : OkHttpFactory.create(config);
    this.auth =
        builder.auth != null ? builder.auth : new AuthContextResolver(mapper).resolve(config);
    log.debug("Using authorization context {}", auth);

    this.jobs = new DpsJobClient(http, config, mapper);
    BackoffPolicy policy =
        new BackoffPolicy(
            config.pollBaseInterval(), config.pollMaxInterval(), config.pollMaxTotalTime());
    JobPoller.Sleeper sleeper =
        builder.sleeper != null ? builder.sleeper : JobPoller.SIGNAL_AWARE_SLEEPER;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.poller = new JobPoller(jobs, policy, sleeper, clock);

    S3ObjectFetcher s3 = builder.s3;
    AutoCloseable owned = null;
    if (s3 == null) {
      AwsS3ObjectFetcher aws = new AwsS3ObjectFetcher(config);
      s3 = aws;
      owned = aws;
    }
    this.s3Resource = owned;
    FtpFetcher ftp =
        builder.ftp != null ? builder.ftp : new CommonsNetFtpFetcher(config.readTimeout());
    HttpDownloader downloader = new HttpDownloader(http, auth, new DpsTokenClient(http, mapper));
    this.locations = new LocationResolver();
    this.retriever = new Retriever(s3, ftp, downloader);
  }

  public static Builder builder() {
    return new Builder();
  }

  public MaapConfig config() {
    return config;
  }

  public AuthContext authContext() {
    return auth;
  }

  // --------------------------------------------------------------------
  // Jobs
  // --------------------------------------------------------------------

  /** Submit a job; a rejected submission comes back as a job in {@code Failed} state. */
  public DpsJob submitJob(JobSpec spec) {
    return jobs.submit(spec);
  }

  public DpsJob submitJob(JobSpec spec, boolean retrieveAttributes) {
    return jobs.submit(spec, retrieveAttributes);
  }

  /** Handle for an existing job, with its status, results and metrics fetched. */
  public DpsJob getJob(String jobId) {
    return jobs.refreshAttributes(DpsJob.forId(jobId));
  }

  public DpsJob getJobStatus(DpsJob job) {
    return jobs.refreshStatus(job);
  }

  public DpsJob getJobResult(DpsJob job) {
    return jobs.refreshResult(job);
  }

  public DpsJob getJobMetrics(DpsJob job) {
    return jobs.refreshMetrics(job);
  }

  public String cancelJob(DpsJob job) {
    return jobs.cancel(job);
  }

  public PollResult waitForCompletion(DpsJob job) {
    return poller.poll(job);
  }

  public PollResult waitForCompletion(DpsJob job, CancellationSignal signal) {
    return poller.poll(job, signal);
  }

  // --------------------------------------------------------------------
  // Data
  // --------------------------------------------------------------------

  public Granule granule(JsonNode metadata) {
    return Granule.fromMetadata(metadata, locations);
  }

  public Collection collection(JsonNode metadata) {
    return Collection.fromMetadata(metadata, config.apiHost());
  }

  /**
   * Download a search result into {@code destinationDir}.
   *
   * @return the local file, or empty when the result lists no downloadable location
   */
  public Optional<Path> getData(SearchResult result, Path destinationDir, boolean overwrite)
      throws IOException {
    Optional<Location> location = result.location();
    if (location.isEmpty()) {
      log.debug("Nothing to download for {}", result.metadata().path("concept-id").asText("?"));
      return Optional.empty();
    }
    return Optional.of(retriever.retrieve(location.get(), destinationDir, overwrite));
  }

  /** Download a single URL into {@code destinationDir}, named after its basename. */
  public Path downloadGranule(String url, Path destinationDir, boolean overwrite)
      throws IOException {
    DownloadCandidate candidate = DownloadCandidate.of(url);
    Location location = Location.direct(candidate, candidate.basename().replace("/", ""));
    return retriever.retrieve(location, destinationDir, overwrite);
  }

  @Override
  public void close() throws Exception {
    if (s3Resource != null) s3Resource.close();
  }

  /** Optional collaborators; anything left unset is built from configuration. */
  public static final class Builder {
    private MaapConfig config;
    private OkHttpClient http;
    private AuthContext auth;
    private JobPoller.Sleeper sleeper;
    private Clock clock;
    private S3ObjectFetcher s3;
    private FtpFetcher ftp;

    private Builder() {}

    public Builder config(MaapConfig config) {
      this.config = config;
      return this;
    }

    public Builder httpClient(OkHttpClient http) {
      this.http = http;
      return this;
    }

    public Builder authContext(AuthContext auth) {
      this.auth = auth;
      return this;
    }

    public Builder sleeper(JobPoller.Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder s3Fetcher(S3ObjectFetcher s3) {
      this.s3 = s3;
      return this;
    }

    public Builder ftpFetcher(FtpFetcher ftp) {
      this.ftp = ftp;
      return this;
    }

    public MaapClient build() {
      return new MaapClient(this);
    }
  }
}
