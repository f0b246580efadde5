package io.eventstats.dead;

import io.eventstats.spi.QueueGateway;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reports how many messages have piled up in the dead-letter queue.
 *
 * <p>Dead-lettered messages are never replayed automatically; a non-zero count is logged
 * as a warning so an operator can look at them.
 */
public final class DeadLetterInspector {
  private static final Logger logger = Logger.getLogger(DeadLetterInspector.class.getName());

  /** Returned by {@link #count()} when the queue could not be queried. */
  public static final long UNKNOWN = -1L;

  private final QueueGateway queueGateway;

  public DeadLetterInspector(QueueGateway queueGateway) {
    this.queueGateway = Objects.requireNonNull(queueGateway, "queueGateway");
  }

  /**
   * Returns the approximate dead-letter queue depth, or {@link #UNKNOWN} if it could not be read.
   */
  public long count() {
    long count;
    try {
      count = queueGateway.approximateDeadLetterCount();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to read dead-letter queue depth", e);
      return UNKNOWN;
    }
    if (count > 0) {
      logger.log(Level.WARNING, "Dead-letter queue holds {0} message(s)", count);
    }
    return count;
  }
}
