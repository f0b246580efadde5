package io.eventstats.spi;

import io.eventstats.model.HealthStatus;
import io.eventstats.model.QueueMessage;

import java.time.Duration;
import java.util.List;

/**
 * Source queue plus its dead-letter destination.
 *
 * <p>Delivery is at-least-once: a received message stays invisible for the visibility
 * timeout and reappears with a higher receive count unless it is deleted or moved to the
 * dead-letter queue first. Implementations never create queues.
 *
 * <p>Operations signal failures with {@link TransientQueueException} (worth retrying) or
 * {@link PermanentQueueException} (misconfiguration such as a missing queue).
 *
 * @see io.eventstats.memory.InMemoryQueueGateway
 */
public interface QueueGateway {

    /**
     * Long-polls for up to {@code maxMessages} messages.
     *
     * @param maxMessages upper bound on the batch size (1..10 for SQS)
     * @param wait        how long to wait for at least one message
     * @return received messages; empty if the wait elapsed with nothing available
     */
    List<QueueMessage> receiveBatch(int maxMessages, Duration wait);

    /**
     * Deletes a received message. Idempotent: a stale or already-consumed receipt handle
     * is a no-op.
     *
     * @param message the message to delete
     */
    void delete(QueueMessage message);

    /**
     * Extends how long the message stays invisible to other consumers.
     *
     * @param message the received message
     * @param timeout new visibility timeout, counted from now
     */
    void extendVisibility(QueueMessage message, Duration timeout);

    /**
     * Publishes the message body to the dead-letter queue, then deletes it from the source
     * queue. If publishing fails the exception propagates and the source message is left
     * untouched, so it is redelivered later.
     *
     * @param message the poison message
     * @param reason  why it is being dead-lettered (recorded as a message attribute)
     */
    void moveToDeadLetter(QueueMessage message, String reason);

    /**
     * Probes connectivity to the source queue. Never throws.
     */
    HealthStatus healthCheck();

    /**
     * Returns the approximate number of messages sitting in the dead-letter queue.
     */
    long approximateDeadLetterCount();

    /**
     * Resolves both the source and dead-letter queues.
     *
     * @throws PermanentQueueException if either queue does not exist
     * @throws TransientQueueException if the queue service cannot be reached
     */
    void verify();
}
