package org.maap.client.dps;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Acknowledgment returned for a job submission.
 *
 * <p>Sample: {@code {"status": "success", "http_status_code": 200, "job_id": "50314f32-..."}}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubmissionAck(
    @JsonProperty("status") String status,
    @JsonProperty("http_status_code") int httpStatusCode,
    @JsonProperty("job_id") String jobId,
    @JsonProperty("details") String details) {

  public static final String SUCCESS = "success";
  public static final String FAILED = "failed";

  public boolean isSuccess() {
    return SUCCESS.equalsIgnoreCase(status);
  }

  /** Synthetic acknowledgment for a submission the service did not accept or could not answer. */
  public static SubmissionAck failed(int httpStatusCode, String details) {
    return new SubmissionAck(FAILED, httpStatusCode, "", details);
  }
}
