package org.maap.client.dps;

import java.time.Duration;
import java.util.Optional;
import org.maap.client.exception.PollCancelledException;
import org.maap.client.exception.PollTimeoutException;

/**
 * Final state of a poll loop: the job, which branch ended the loop, how many status requests were
 * made, the time spent against the budget, and the last request failure, if any.
 */
public record PollResult(
    DpsJob job,
    Termination termination,
    int attempts,
    Duration elapsed,
    Duration budget,
    Throwable lastError) {

  public enum Termination {
    /** The job reached a terminal status. */
    COMPLETED,
    /** The total time budget ran out first. */
    TIMED_OUT,
    /** The cancellation signal fired or the polling thread was interrupted. */
    CANCELLED
  }

  public boolean completed() {
    return termination == Termination.COMPLETED;
  }

  public Optional<Throwable> lastErrorOptional() {
    return Optional.ofNullable(lastError);
  }

  /**
   * @return the job when the loop completed
   * @throws PollTimeoutException when the time budget ran out
   * @throws PollCancelledException when polling was cancelled
   */
  public DpsJob orThrow() {
    return switch (termination) {
      case COMPLETED -> job;
      case TIMED_OUT -> throw new PollTimeoutException(job.id(), budget, lastError);
      case CANCELLED -> throw new PollCancelledException(job.id());
    };
  }
}
