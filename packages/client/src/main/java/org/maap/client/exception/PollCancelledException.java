package org.maap.client.exception;

/** Polling was stopped by its caller before the job reached a terminal status. */
public class PollCancelledException extends MaapException {
  public PollCancelledException(String jobId) {
    super(MaapErrorCode.POLL_CANCELLED, "Polling of job " + jobId + " was cancelled");
    withContext("jobId", jobId);
  }
}
