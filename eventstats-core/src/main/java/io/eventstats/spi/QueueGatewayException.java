package io.eventstats.spi;

/**
 * Base class for failures reported by a {@link QueueGateway}.
 *
 * @see TransientQueueException
 * @see PermanentQueueException
 */
public abstract class QueueGatewayException extends RuntimeException {

    protected QueueGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether repeating the same call later may succeed.
     */
    public abstract boolean isRetryable();
}
