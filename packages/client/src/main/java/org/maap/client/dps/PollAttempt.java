package org.maap.client.dps;

import org.maap.client.exception.MaapException;

/** Outcome of a single status refresh inside the poll loop. */
public sealed interface PollAttempt {

  /** The job is still accepted or running. */
  record Pending(JobStatus status) implements PollAttempt {}

  /** The job left the accepted/running states. */
  record Done(DpsJob job) implements PollAttempt {}

  /** The status request itself failed; the job state is unknown. */
  record TransportError(MaapException error) implements PollAttempt {}
}
