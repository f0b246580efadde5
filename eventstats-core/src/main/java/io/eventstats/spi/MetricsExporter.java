package io.eventstats.spi;

/**
 * Observability hook for exporting processor counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of messages received from the source queue.
     */
    void incrementReceived();

    /**
     * Increments the count of events folded into the aggregate store.
     */
    void incrementAggregated();

    /**
     * Increments the count of messages deleted because they failed validation.
     */
    void incrementDiscarded();

    /**
     * Increments the count of messages moved to the dead-letter queue.
     */
    void incrementDeadLettered();

    /**
     * Increments the count of messages left for redelivery because the store was unavailable.
     */
    void incrementStoreFailure();

    /**
     * Increments the count of failed dead-letter publishes.
     */
    default void incrementDeadLetterFailure() {
    }

    /**
     * Increments the count of receive calls that returned no messages.
     */
    default void incrementEmptyReceive() {
    }

    /**
     * Increments the count of receive calls that failed.
     */
    default void incrementReceiveFailure() {
    }

    /**
     * Records the size of the most recently received batch.
     *
     * @param size number of messages in the batch (0 for an empty receive)
     */
    void recordBatchSize(int size);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementReceived() {
        }

        @Override
        public void incrementAggregated() {
        }

        @Override
        public void incrementDiscarded() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void incrementStoreFailure() {
        }

        @Override
        public void recordBatchSize(int size) {
        }
    }
}
