/**
 * The message processing loop: receive, validate, aggregate, delete or dead-letter.
 *
 * <p>{@link io.eventstats.processor.ProcessorLoop} drives one batch at a time through the
 * {@link io.eventstats.spi.QueueGateway} and {@link io.eventstats.spi.AggregateStore} SPIs.
 * Each message ends up with a {@link io.eventstats.processor.MessageOutcome}; waits between
 * cycles go through a cancellable {@link io.eventstats.processor.ShutdownSignal}.
 *
 * @see io.eventstats.processor.ProcessorLoop
 * @see io.eventstats.processor.ProcessorState
 */
package io.eventstats.processor;
