package org.maap.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/** Exchanges a DPS machine token for short-lived user and application tokens. */
public class DpsTokenClient {
  private static final Logger log = LoggingService.getLogger(DpsTokenClient.class);

  static final String MACHINE_TOKEN_HEADER = "dps-machine-token";
  static final String JOB_ID_HEADER = "dps-job-id";

  /** The credential pair the token endpoint hands out. */
  public record TokenPair(String userToken, String appToken) {
    /** Value for the {@code Authorization} header of the retried download. */
    public String authorizationHeader() {
      return "Bearer " + userToken + ",Basic " + appToken;
    }

    @Override
    public String toString() {
      return "TokenPair[***]";
    }
  }

  private final OkHttpClient http;
  private final ObjectMapper mapper;

  public DpsTokenClient(OkHttpClient http) {
    this(http, new ObjectMapper());
  }

  public DpsTokenClient(OkHttpClient http, ObjectMapper mapper) {
    this.http = http;
    this.mapper = mapper;
  }

  /**
   * @return the token pair, or empty when the endpoint refused the exchange or answered with an
   *     unusable body
   * @throws IOException on network failure
   */
  public Optional<TokenPair> exchange(AuthContext.JobRuntimeToken ctx) throws IOException {
    Request request =
        new Request.Builder()
            .url(ctx.tokenEndpoint())
            .header(MACHINE_TOKEN_HEADER, ctx.machineToken())
            .header(JOB_ID_HEADER, ctx.jobId())
            .header("Accept", "application/json")
            .get()
            .build();
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      if (!response.isSuccessful() || body == null) {
        log.debug("Token exchange for job {} refused with HTTP {}", ctx.jobId(), response.code());
        return Optional.empty();
      }
      String text = body.string();
      JsonNode json;
      try {
        json = mapper.readTree(text);
      } catch (IOException e) {
        log.debug("Token endpoint returned a non-JSON body for job {}", ctx.jobId());
        return Optional.empty();
      }
      String user = json.path("user_token").asText("");
      String app = json.path("app_token").asText("");
      if (user.isEmpty() || app.isEmpty()) {
        log.debug("Token endpoint response for job {} lacks user_token/app_token", ctx.jobId());
        return Optional.empty();
      }
      return Optional.of(new TokenPair(user, app));
    }
  }
}
