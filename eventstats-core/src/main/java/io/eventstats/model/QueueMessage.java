package io.eventstats.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A message claimed from the source queue, together with its delivery metadata.
 *
 * <p>The {@code receiptHandle} identifies this particular delivery; it is what
 * {@link io.eventstats.spi.QueueGateway#delete} and friends act on. A redelivered message
 * carries a new handle and a higher {@code receiveCount}.
 *
 * @param messageId     provider-assigned message id
 * @param body          raw message body
 * @param receiptHandle opaque token for this delivery
 * @param receiveCount  number of times the message has been received, starting at 1
 * @param sentAt        approximate enqueue time, or {@code null} if the provider did not report it
 */
public record QueueMessage(
    String messageId,
    String body,
    String receiptHandle,
    int receiveCount,
    Instant sentAt
) {
  public QueueMessage {
    Objects.requireNonNull(messageId, "messageId");
    Objects.requireNonNull(receiptHandle, "receiptHandle");
    if (receiveCount < 1) {
      throw new IllegalArgumentException("receiveCount must be >= 1, got: " + receiveCount);
    }
  }
}
