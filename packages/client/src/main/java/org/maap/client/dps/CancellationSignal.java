package org.maap.client.dps;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation flag shared between a polling thread and whoever wants to stop it.
 *
 * <p>{@link #await(Duration)} doubles as the poller's sleep so a cancellation wakes it
 * immediately.
 */
public final class CancellationSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  /** A signal nobody else holds, so it is never cancelled. */
  public static CancellationSignal none() {
    return new CancellationSignal();
  }

  public void cancel() {
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Wait up to {@code timeout}.
   *
   * @return true when the signal was cancelled before the timeout elapsed
   */
  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
