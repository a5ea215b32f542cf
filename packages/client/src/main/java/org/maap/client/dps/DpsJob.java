package org.maap.client.dps;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.maap.client.exception.JobFailedException;

/**
 * Identity and last known state of one DPS job.
 *
 * <p>The id is always assigned by the service. Instances are mutated only by {@link DpsJobClient}
 * refresh operations and {@link JobPoller}; fields are volatile so a job polled on one thread can
 * be read from another. Outputs and metrics stay empty until the job reaches a terminal state.
 */
public final class DpsJob {
  private volatile String id;
  private volatile JobStatus status;
  private volatile String statusText;
  private volatile int responseCode;
  private volatile String errorDetails;
  private volatile List<String> outputs = List.of();
  private volatile List<String> traceback = List.of();
  private volatile Map<String, String> metrics = Map.of();
  private volatile JobMetrics jobMetrics = JobMetrics.EMPTY;

  DpsJob(String id, JobStatus status) {
    this.id = id;
    this.status = status;
    this.statusText = status == null ? null : status.wireName();
  }

  /** Handle for an existing job whose status has not been fetched yet. */
  public static DpsJob forId(String id) {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Job id must not be blank");
    }
    return new DpsJob(id, null);
  }

  /** Build a job from a submission acknowledgment. */
  static DpsJob fromAck(SubmissionAck ack) {
    String id = ack.jobId() == null ? "" : ack.jobId();
    DpsJob job = new DpsJob(id, ack.isSuccess() ? JobStatus.ACCEPTED : JobStatus.FAILED);
    job.responseCode = ack.httpStatusCode();
    job.errorDetails = ack.details();
    return job;
  }

  public String id() {
    return id;
  }

  /** Last known status, or {@code null} when it was never fetched. */
  public JobStatus status() {
    return status;
  }

  /** Status exactly as the service spelled it. */
  public String statusText() {
    return statusText;
  }

  public int responseCode() {
    return responseCode;
  }

  public String errorDetails() {
    return errorDetails;
  }

  public List<String> outputs() {
    return outputs;
  }

  public List<String> traceback() {
    return traceback;
  }

  /** Raw metric values keyed by element name, in document order. */
  public Map<String, String> metrics() {
    return metrics;
  }

  public JobMetrics jobMetrics() {
    return jobMetrics;
  }

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }

  /**
   * Return this job when it did not fail.
   *
   * @throws JobFailedException when the job's status is {@link JobStatus#FAILED}
   */
  public DpsJob requireSucceeded() {
    if (status == JobStatus.FAILED) {
      String detail = errorDetails != null ? errorDetails : String.join("\n", traceback);
      throw new JobFailedException(
          id, "Job " + id + " failed" + (detail.isBlank() ? "" : ": " + detail));
    }
    return this;
  }

  void updateStatus(String id, String statusText) {
    if (id != null && !id.isBlank()) this.id = id;
    this.statusText = statusText;
    this.status = JobStatus.fromWire(statusText);
  }

  void replaceResults(List<String> outputs, List<String> traceback) {
    this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
    this.traceback = Collections.unmodifiableList(new ArrayList<>(traceback));
  }

  void replaceMetrics(Map<String, String> metrics) {
    this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    this.jobMetrics = JobMetrics.fromMap(metrics);
  }

  @Override
  public String toString() {
    return "DpsJob{id="
        + id
        + ", status="
        + statusText
        + ", responseCode="
        + responseCode
        + ", errorDetails="
        + errorDetails
        + ", outputs="
        + outputs
        + ", metrics="
        + metrics
        + '}';
  }
}
