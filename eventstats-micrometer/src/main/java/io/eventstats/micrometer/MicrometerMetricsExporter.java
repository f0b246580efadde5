package io.eventstats.micrometer;

import io.eventstats.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and a gauge with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventstats.messages.received}: messages received from the source queue</li>
 *   <li>{@code eventstats.messages.aggregated}: events folded into the aggregate store</li>
 *   <li>{@code eventstats.messages.discarded}: invalid messages deleted</li>
 *   <li>{@code eventstats.messages.dead}: messages moved to the dead-letter queue</li>
 *   <li>{@code eventstats.store.failure}: messages left for redelivery (store unavailable)</li>
 *   <li>{@code eventstats.dead.failure}: failed dead-letter publishes</li>
 *   <li>{@code eventstats.receive.empty}: receives that returned nothing</li>
 *   <li>{@code eventstats.receive.failure}: receives that failed</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventstats.batch.size}: size of the most recent batch</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter received;
  private final Counter aggregated;
  private final Counter discarded;
  private final Counter deadLettered;
  private final Counter storeFailure;
  private final Counter deadLetterFailure;
  private final Counter emptyReceive;
  private final Counter receiveFailure;
  private final Gauge batchSizeGauge;

  private final AtomicInteger batchSize = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventstats"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventstats");
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several processors in one registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "checkout.eventstats"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.received = Counter.builder(namePrefix + ".messages.received")
        .description("Messages received from the source queue")
        .register(registry);
    this.aggregated = Counter.builder(namePrefix + ".messages.aggregated")
        .description("Events folded into the aggregate store")
        .register(registry);
    this.discarded = Counter.builder(namePrefix + ".messages.discarded")
        .description("Invalid messages deleted without aggregation")
        .register(registry);
    this.deadLettered = Counter.builder(namePrefix + ".messages.dead")
        .description("Messages moved to the dead-letter queue")
        .register(registry);
    this.storeFailure = Counter.builder(namePrefix + ".store.failure")
        .description("Messages left for redelivery because the store was unavailable")
        .register(registry);
    this.deadLetterFailure = Counter.builder(namePrefix + ".dead.failure")
        .description("Failed dead-letter publishes")
        .register(registry);
    this.emptyReceive = Counter.builder(namePrefix + ".receive.empty")
        .description("Receives that returned no messages")
        .register(registry);
    this.receiveFailure = Counter.builder(namePrefix + ".receive.failure")
        .description("Receives that failed")
        .register(registry);

    this.batchSizeGauge = Gauge.builder(namePrefix + ".batch.size", batchSize, AtomicInteger::get)
        .description("Size of the most recent batch")
        .register(registry);
  }

  @Override
  public void incrementReceived() {
    if (closed) return;
    received.increment();
  }

  @Override
  public void incrementAggregated() {
    if (closed) return;
    aggregated.increment();
  }

  @Override
  public void incrementDiscarded() {
    if (closed) return;
    discarded.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void incrementStoreFailure() {
    if (closed) return;
    storeFailure.increment();
  }

  @Override
  public void incrementDeadLetterFailure() {
    if (closed) return;
    deadLetterFailure.increment();
  }

  @Override
  public void incrementEmptyReceive() {
    if (closed) return;
    emptyReceive.increment();
  }

  @Override
  public void incrementReceiveFailure() {
    if (closed) return;
    receiveFailure.increment();
  }

  @Override
  public void recordBatchSize(int size) {
    if (closed) return;
    batchSize.set(size);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the processor is closed to prevent a stale batch-size gauge.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(received, aggregated, discarded, deadLettered, storeFailure,
        deadLetterFailure, emptyReceive, receiveFailure, batchSizeGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
