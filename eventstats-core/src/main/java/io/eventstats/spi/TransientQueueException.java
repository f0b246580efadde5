package io.eventstats.spi;

/**
 * The queue service could not be reached or throttled the request. Retry with backoff.
 */
public final class TransientQueueException extends QueueGatewayException {

    public TransientQueueException(String message) {
        super(message, null);
    }

    public TransientQueueException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
