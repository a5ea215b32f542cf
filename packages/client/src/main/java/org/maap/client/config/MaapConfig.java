package org.maap.client.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.maap.client.exception.ConfigurationException;

/**
 * Typed, immutable view of the client configuration.
 *
 * <p>Values come from the YAML configuration; the environment variables {@code MAAP_API_TOKEN},
 * {@code MAAP_PGT} and {@code MAAP_CMR_CONTENT_TYPE} take precedence when set.
 */
public final class MaapConfig {
  public static final String ENV_TOKEN = "MAAP_API_TOKEN";
  public static final String ENV_PROXY_TICKET = "MAAP_PGT";
  public static final String ENV_CONTENT_TYPE = "MAAP_CMR_CONTENT_TYPE";

  private final Configuration source;
  private final String token;
  private final String contentType;
  private final String proxyTicket;
  private final String apiHost;
  private final String dpsJobEndpoint;
  private final String dpsTokenEndpoint;
  private final String statusSuffix;
  private final String metricsSuffix;
  private final String dismissSuffix;
  private final Path sentinelDirectory;
  private final Duration pollBaseInterval;
  private final Duration pollMaxInterval;
  private final Duration pollMaxTotalTime;
  private final String granuleEndpoint;
  private final String relaySuffix;
  private final Duration connectTimeout;
  private final Duration readTimeout;
  private final String awsRegion;

  private MaapConfig(Configuration c, Map<String, String> env) {
    this.source = c;
    this.token = envOr(env, ENV_TOKEN, c.getString("api.token", ""));
    this.contentType =
        envOr(env, ENV_CONTENT_TYPE, c.getString("api.content-type", "application/echo10+xml"));
    this.proxyTicket = envOr(env, ENV_PROXY_TICKET, c.getString("api.proxy-ticket", ""));
    this.apiHost = c.getString("api.host", "api.maap-project.org");
    this.dpsJobEndpoint = trimSlash(required(c, "dps.job-endpoint"));
    this.dpsTokenEndpoint = required(c, "dps.token-endpoint");
    this.statusSuffix = c.getString("dps.status-suffix", "status");
    this.metricsSuffix = c.getString("dps.metrics-suffix", "metrics");
    this.dismissSuffix = c.getString("dps.dismiss-suffix", "cancel");
    this.sentinelDirectory = Path.of(c.getString("dps.sentinel-directory", "."));
    this.pollBaseInterval = Duration.ofMillis(c.getLong("dps.poll.base-interval-ms", 1000L));
    this.pollMaxInterval = Duration.ofSeconds(c.getLong("dps.poll.max-interval-seconds", 64L));
    this.pollMaxTotalTime = Duration.ofSeconds(c.getLong("dps.poll.max-total-seconds", 172800L));
    this.granuleEndpoint = trimSlash(c.getString("cmr.granule-endpoint", ""));
    this.relaySuffix = c.getString("cmr.relay-suffix", "data");
    this.connectTimeout = Duration.ofSeconds(c.getLong("http.connect-timeout-seconds", 10L));
    this.readTimeout = Duration.ofSeconds(c.getLong("http.read-timeout-seconds", 60L));
    this.awsRegion = c.getString("aws.region", "us-west-2");

    if (pollBaseInterval.isNegative() || pollBaseInterval.isZero()) {
      throw new ConfigurationException("dps.poll.base-interval-ms must be positive");
    }
    if (pollMaxInterval.compareTo(pollBaseInterval) < 0) {
      throw new ConfigurationException(
          "dps.poll.max-interval-seconds must not be shorter than the base interval");
    }
  }

  public static MaapConfig from(Configuration configuration) {
    return from(configuration, System.getenv());
  }

  public static MaapConfig from(Configuration configuration, Map<String, String> environment) {
    return new MaapConfig(configuration, environment);
  }

  /** Defaults from the bundled YAML plus the process environment. */
  public static MaapConfig load() {
    return from(new ConfigurationProvider().configuration());
  }

  public Configuration source() {
    return source;
  }

  public String token() {
    return token;
  }

  public String contentType() {
    return contentType;
  }

  /** Proxy-granting ticket, or empty when none is configured. */
  public String proxyTicket() {
    return proxyTicket;
  }

  public String apiHost() {
    return apiHost;
  }

  public String dpsJobEndpoint() {
    return dpsJobEndpoint;
  }

  public String dpsTokenEndpoint() {
    return dpsTokenEndpoint;
  }

  public String statusSuffix() {
    return statusSuffix;
  }

  public String metricsSuffix() {
    return metricsSuffix;
  }

  public String dismissSuffix() {
    return dismissSuffix;
  }

  public Path sentinelDirectory() {
    return sentinelDirectory;
  }

  public Duration pollBaseInterval() {
    return pollBaseInterval;
  }

  public Duration pollMaxInterval() {
    return pollMaxInterval;
  }

  public Duration pollMaxTotalTime() {
    return pollMaxTotalTime;
  }

  /** Base URL of the granule relay used when an origin rejects an anonymous download. */
  public String granuleEndpoint() {
    return granuleEndpoint;
  }

  public String relaySuffix() {
    return relaySuffix;
  }

  public Duration connectTimeout() {
    return connectTimeout;
  }

  public Duration readTimeout() {
    return readTimeout;
  }

  public String awsRegion() {
    return awsRegion;
  }

  private static String required(Configuration c, String key) {
    String value = c.getString(key, null);
    if (value == null || value.isBlank()) {
      throw new ConfigurationException("Missing required configuration key: " + key);
    }
    return value.trim();
  }

  private static String envOr(Map<String, String> env, String name, String fallback) {
    String value = env.get(name);
    return value == null || value.isBlank() ? fallback : value;
  }

  private static String trimSlash(String value) {
    String v = value.trim();
    while (v.endsWith("/")) v = v.substring(0, v.length() - 1);
    return v;
  }
}
