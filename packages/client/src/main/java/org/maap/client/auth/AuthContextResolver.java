package org.maap.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.maap.client.config.MaapConfig;
import org.maap.client.exception.ConfigurationException;
import org.maap.client.http.ApiHeaders;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Detects the execution environment from two sentinel files that DPS places in a job's working
 * directory.
 *
 * <p>Both {@value #JOB_FILE} and {@value #MACHINE_TOKEN_FILE} present: {@link
 * AuthContext.JobRuntimeToken}. Otherwise, with a granule relay endpoint configured: {@link
 * AuthContext.ProxyDelegate}. Otherwise {@link AuthContext.Unauthenticated}.
 */
public class AuthContextResolver {
  private static final Logger log = LoggingService.getLogger(AuthContextResolver.class);

  public static final String JOB_FILE = "_job.json";
  public static final String MACHINE_TOKEN_FILE = "_maap_dps_token.txt";

  private final ObjectMapper mapper;

  public AuthContextResolver() {
    this(new ObjectMapper());
  }

  public AuthContextResolver(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public AuthContext resolve(MaapConfig config) {
    Path dir = config.sentinelDirectory();
    Path jobFile = dir.resolve(JOB_FILE);
    Path tokenFile = dir.resolve(MACHINE_TOKEN_FILE);

    if (Files.exists(jobFile) && Files.exists(tokenFile)) {
      AuthContext ctx =
          new AuthContext.JobRuntimeToken(
              readStripped(tokenFile), readJobId(jobFile), config.dpsTokenEndpoint());
      log.debug("Running inside DPS: {}", ctx);
      return ctx;
    }

    if (!config.granuleEndpoint().isBlank()) {
      return new AuthContext.ProxyDelegate(
          ApiHeaders.build(config.contentType(), config.token(), config.proxyTicket()),
          config.granuleEndpoint(),
          config.relaySuffix());
    }
    return new AuthContext.Unauthenticated();
  }

  private String readJobId(Path jobFile) {
    String content = readStripped(jobFile);
    try {
      JsonNode id =
          mapper.readTree(content).path("job_info").path("job_payload").path("payload_task_id");
      if (!id.isTextual() || id.asText().isBlank()) {
        throw new ConfigurationException(
            jobFile + " has no job_info.job_payload.payload_task_id entry");
      }
      return id.asText();
    } catch (IOException e) {
      throw new ConfigurationException("Could not parse " + jobFile, e);
    }
  }

  private static String readStripped(Path file) {
    try {
      return Files.readString(file, StandardCharsets.UTF_8).replace("\n", "").replace("\r", "");
    } catch (IOException e) {
      throw new ConfigurationException("Could not read " + file, e);
    }
  }
}
