package io.eventstats.spi;

import io.eventstats.model.AggregateRecord;
import io.eventstats.model.HealthStatus;

import java.util.Map;
import java.util.Optional;

/**
 * Shared, persistent per-event-type statistics.
 *
 * <p>{@link #increment} must be atomic against concurrent callers in any process sharing
 * the store: N concurrent increments of the same type always yield {@code count + N}.
 * Implementations perform the update inside the store, never as read-modify-write on the
 * caller's side.
 *
 * <p>All operations except {@link #healthCheck()} may throw {@link StoreUnavailableException}.
 *
 * @see io.eventstats.memory.InMemoryAggregateStore
 */
public interface AggregateStore {

    /**
     * Atomically adds one event of the given value to the aggregate for {@code eventType},
     * creating the aggregate on first use.
     *
     * @param eventType aggregation key
     * @param amount    value to add to the sum
     * @return the aggregate after the update
     */
    AggregateRecord increment(String eventType, double amount);

    /**
     * Returns the aggregate for one event type, or empty if none was recorded since the last reset.
     */
    Optional<AggregateRecord> get(String eventType);

    /**
     * Returns all aggregates, keyed and sorted by event type.
     */
    Map<String, AggregateRecord> getAll();

    /**
     * Atomically removes every aggregate.
     */
    void reset();

    /**
     * Probes the store. Never throws.
     */
    HealthStatus healthCheck();
}
