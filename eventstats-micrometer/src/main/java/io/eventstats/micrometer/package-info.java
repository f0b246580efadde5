/**
 * Micrometer bridge for {@link io.eventstats.spi.MetricsExporter}.
 */
package io.eventstats.micrometer;
