package io.eventstats.memory;

import io.eventstats.model.AggregateRecord;
import io.eventstats.model.HealthStatus;
import io.eventstats.spi.AggregateStore;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local {@link AggregateStore}. Atomic within one JVM only, so it suits tests and
 * single-instance runs; horizontally scaled processors need a shared store such as the
 * JDBC one.
 *
 * <p>Increments run under a shared lock and {@link #reset()} under the exclusive one, so a
 * reset never interleaves with a half-applied increment.
 */
public final class InMemoryAggregateStore implements AggregateStore {
  private final ConcurrentHashMap<String, AggregateRecord> records = new ConcurrentHashMap<>();
  private final ReadWriteLock resetLock = new ReentrantReadWriteLock();

  @Override
  public AggregateRecord increment(String eventType, double amount) {
    Objects.requireNonNull(eventType, "eventType");
    resetLock.readLock().lock();
    try {
      return records.compute(eventType, (type, current) -> current == null
          ? new AggregateRecord(type, 1, amount)
          : current.plus(amount));
    } finally {
      resetLock.readLock().unlock();
    }
  }

  @Override
  public Optional<AggregateRecord> get(String eventType) {
    Objects.requireNonNull(eventType, "eventType");
    return Optional.ofNullable(records.get(eventType));
  }

  @Override
  public Map<String, AggregateRecord> getAll() {
    resetLock.readLock().lock();
    try {
      return Collections.unmodifiableMap(new TreeMap<>(records));
    } finally {
      resetLock.readLock().unlock();
    }
  }

  @Override
  public void reset() {
    resetLock.writeLock().lock();
    try {
      records.clear();
    } finally {
      resetLock.writeLock().unlock();
    }
  }

  @Override
  public HealthStatus healthCheck() {
    return HealthStatus.HEALTHY;
  }
}
