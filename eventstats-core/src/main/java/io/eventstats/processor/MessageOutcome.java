package io.eventstats.processor;

import io.eventstats.model.AggregateRecord;
import io.eventstats.spi.StoreUnavailableException;
import io.eventstats.validate.ValidationError;

import java.util.Objects;

/**
 * What happened to one received message, decided before any queue side effect is applied.
 *
 * <ul>
 *   <li>{@link Delivered}: aggregated; the message is deleted.</li>
 *   <li>{@link ValidationFailed}: poison body; the message is deleted without aggregating.</li>
 *   <li>{@link StoreUnavailable}: the store failed; the message is left to reappear after its
 *       visibility timeout.</li>
 *   <li>{@link ExceededRetries}: received more often than allowed; the message is moved to the
 *       dead-letter queue.</li>
 * </ul>
 */
public sealed interface MessageOutcome
    permits MessageOutcome.Delivered, MessageOutcome.ValidationFailed,
    MessageOutcome.StoreUnavailable, MessageOutcome.ExceededRetries {

  /**
   * @param aggregate the aggregate after this event was folded in
   */
  record Delivered(AggregateRecord aggregate) implements MessageOutcome {
    public Delivered {
      Objects.requireNonNull(aggregate, "aggregate");
    }
  }

  record ValidationFailed(ValidationError error) implements MessageOutcome {
    public ValidationFailed {
      Objects.requireNonNull(error, "error");
    }
  }

  record StoreUnavailable(StoreUnavailableException cause) implements MessageOutcome {
    public StoreUnavailable {
      Objects.requireNonNull(cause, "cause");
    }
  }

  /**
   * @param receiveCount    how many times the message has been received
   * @param maxReceiveCount the configured limit it exceeded
   */
  record ExceededRetries(int receiveCount, int maxReceiveCount) implements MessageOutcome {
    String reason() {
      return "receive count " + receiveCount + " exceeded maximum of " + maxReceiveCount;
    }
  }
}
