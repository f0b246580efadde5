package io.eventstats.processor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown flag whose waits wake up as soon as shutdown is requested.
 *
 * <p>An interrupt during {@link #await(Duration)} counts as a shutdown request; the
 * thread's interrupt status is restored.
 */
public final class ShutdownSignal {
  private final CountDownLatch latch = new CountDownLatch(1);

  public void request() {
    latch.countDown();
  }

  public boolean isRequested() {
    return latch.getCount() == 0;
  }

  /**
   * Sleeps for up to {@code timeout}, returning early on shutdown.
   *
   * @return {@code true} if shutdown has been requested
   */
  public boolean await(Duration timeout) {
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      return isRequested();
    }
    try {
      return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      request();
      return true;
    }
  }
}
