package io.eventstats.spi;

/**
 * The queue rejected the request for a reason retrying will not fix, such as a missing
 * queue or denied access.
 */
public final class PermanentQueueException extends QueueGatewayException {

    public PermanentQueueException(String message) {
        super(message, null);
    }

    public PermanentQueueException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
