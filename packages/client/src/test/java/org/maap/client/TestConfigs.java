package org.maap.client;

import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.maap.client.config.MaapConfig;

/** Builds configurations pointing at a local test server. */
public final class TestConfigs {
  private TestConfigs() {}

  public static BaseConfiguration base(String serverUrl, Path sentinelDir) {
    String root =
        serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
    BaseConfiguration c = new BaseConfiguration();
    c.setProperty("api.token", "abc123");
    c.setProperty("api.content-type", "application/xml");
    c.setProperty("api.host", "cmr.example.test");
    c.setProperty("dps.job-endpoint", root + "/api/dps/job");
    c.setProperty("dps.token-endpoint", root + "/api/members/dps/userAccessToken");
    c.setProperty("dps.sentinel-directory", sentinelDir.toString());
    c.setProperty("dps.poll.base-interval-ms", 1000L);
    c.setProperty("dps.poll.max-interval-seconds", 64L);
    c.setProperty("dps.poll.max-total-seconds", 600L);
    c.setProperty("cmr.granule-endpoint", root + "/api/cmr/granules");
    c.setProperty("cmr.relay-suffix", "data");
    c.setProperty("http.connect-timeout-seconds", 2L);
    c.setProperty("http.read-timeout-seconds", 5L);
    return c;
  }

  public static MaapConfig forServer(String serverUrl, Path sentinelDir) {
    return MaapConfig.from(base(serverUrl, sentinelDir), Map.of());
  }
}
