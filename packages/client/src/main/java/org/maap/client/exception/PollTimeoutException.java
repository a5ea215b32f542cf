package org.maap.client.exception;

import java.time.Duration;

/** Polling ran out of its total time budget while the job was still accepted or running. */
public class PollTimeoutException extends MaapException {
  private final String jobId;
  private final Duration budget;

  public PollTimeoutException(String jobId, Duration budget, Throwable lastError) {
    super(
        MaapErrorCode.POLL_TIMEOUT,
        "Job " + jobId + " did not reach a terminal status within " + budget,
        lastError);
    this.jobId = jobId;
    this.budget = budget;
    withContext("jobId", jobId);
  }

  public String getJobId() {
    return jobId;
  }

  public Duration getBudget() {
    return budget;
  }
}
