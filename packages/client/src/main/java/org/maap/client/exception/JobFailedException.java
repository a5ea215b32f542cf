package org.maap.client.exception;

/** The remote job finished in the {@code Failed} state. */
public class JobFailedException extends MaapException {
  private final String jobId;

  public JobFailedException(String jobId, String message) {
    super(MaapErrorCode.JOB_FAILED, message);
    this.jobId = jobId;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }
}
