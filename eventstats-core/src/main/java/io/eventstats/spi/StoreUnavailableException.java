package io.eventstats.spi;

/**
 * Unchecked exception thrown by {@link AggregateStore} implementations when the backing
 * store cannot complete an operation.
 */
public final class StoreUnavailableException extends RuntimeException {
    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
