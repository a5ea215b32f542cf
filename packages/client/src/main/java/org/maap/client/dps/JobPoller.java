package org.maap.client.dps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.maap.client.exception.RemoteCallException;
import org.maap.client.exception.TransportException;
import org.maap.client.logging.LoggingService;
import org.slf4j.Logger;

/**
 * Refreshes a job's status until it leaves {@code Accepted}/{@code Running}, the time budget runs
 * out, or the caller cancels.
 *
 * <p>Polling is synchronous: the calling thread sleeps between attempts. Failed status requests
 * (network errors, non-success HTTP codes) count as "not done yet" and are retried on the same
 * backoff schedule; undecodable status documents are not retried and propagate. Callers polling
 * several jobs run one poller call per thread.
 */
public class JobPoller {
  private static final Logger log = LoggingService.getLogger(JobPoller.class);

  /** Blocks between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    /**
     * Sleep for {@code duration} unless {@code signal} fires first.
     *
     * @return true when woken by cancellation
     */
    boolean sleep(Duration duration, CancellationSignal signal) throws InterruptedException;
  }

  public static final Sleeper SIGNAL_AWARE_SLEEPER = (duration, signal) -> signal.await(duration);

  private final DpsJobClient client;
  private final BackoffPolicy policy;
  private final Sleeper sleeper;
  private final Clock clock;

  public JobPoller(DpsJobClient client, BackoffPolicy policy) {
    this(client, policy, SIGNAL_AWARE_SLEEPER, Clock.systemUTC());
  }

  public JobPoller(DpsJobClient client, BackoffPolicy policy, Sleeper sleeper, Clock clock) {
    this.client = client;
    this.policy = policy;
    this.sleeper = sleeper;
    this.clock = clock;
  }

  public BackoffPolicy policy() {
    return policy;
  }

  public PollResult poll(DpsJob job) {
    return poll(job, CancellationSignal.none());
  }

  public PollResult poll(DpsJob job, CancellationSignal signal) {
    Instant start = clock.instant();
    Duration budget = policy.maxTotalTime();
    int attempts = 0;
    Throwable lastError = null;

    while (true) {
      if (signal.isCancelled()) {
        return finish(job, PollResult.Termination.CANCELLED, attempts, start, lastError);
      }

      PollAttempt outcome = attempt(job);
      attempts++;
      if (outcome instanceof PollAttempt.Done) {
        log.debug("Job {} reached {} after {} attempts", job.id(), job.statusText(), attempts);
        return finish(job, PollResult.Termination.COMPLETED, attempts, start, lastError);
      }
      if (outcome instanceof PollAttempt.TransportError error) {
        lastError = error.error();
        log.debug("Status request for job {} failed: {}", job.id(), error.error().getMessage());
      }

      Duration remaining = budget.minus(Duration.between(start, clock.instant()));
      if (remaining.isNegative() || remaining.isZero()) {
        log.warn(
            "Gave up polling job {} after {} attempts ({} budget)", job.id(), attempts, budget);
        return finish(job, PollResult.Termination.TIMED_OUT, attempts, start, lastError);
      }

      Duration wait = policy.delayFor(attempts - 1);
      if (wait.compareTo(remaining) > 0) wait = remaining;
      if (outcome instanceof PollAttempt.Pending pending) {
        log.debug(
            "Current status of job {} is {}. Backing off {}", job.id(), pending.status(), wait);
      }
      try {
        if (sleeper.sleep(wait, signal)) {
          return finish(job, PollResult.Termination.CANCELLED, attempts, start, lastError);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return finish(job, PollResult.Termination.CANCELLED, attempts, start, lastError);
      }
    }
  }

  /**
   * Poll and unwrap.
   *
   * @throws org.maap.client.exception.PollTimeoutException when the budget ran out
   * @throws org.maap.client.exception.PollCancelledException when cancelled
   */
  public DpsJob awaitCompletion(DpsJob job, CancellationSignal signal) {
    return poll(job, signal).orThrow();
  }

  private PollAttempt attempt(DpsJob job) {
    try {
      client.refreshStatus(job);
    } catch (TransportException | RemoteCallException e) {
      return new PollAttempt.TransportError(e);
    }
    return job.isTerminal() ? new PollAttempt.Done(job) : new PollAttempt.Pending(job.status());
  }

  private PollResult finish(
      DpsJob job,
      PollResult.Termination termination,
      int attempts,
      Instant start,
      Throwable lastError) {
    Duration elapsed = Duration.between(start, clock.instant());
    return new PollResult(job, termination, attempts, elapsed, policy.maxTotalTime(), lastError);
  }
}
