/**
 * Service Provider Interfaces (SPI) for plugging the processor into real infrastructure.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in the message queue, the aggregate store, connection provisioning, and metrics.
 *
 * @see io.eventstats.spi.QueueGateway
 * @see io.eventstats.spi.AggregateStore
 * @see io.eventstats.spi.ConnectionProvider
 * @see io.eventstats.spi.MetricsExporter
 */
package io.eventstats.spi;
