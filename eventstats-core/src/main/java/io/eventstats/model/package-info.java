/**
 * Domain model objects: validated events, claimed queue messages and per-type aggregates.
 *
 * @see io.eventstats.model.Event
 * @see io.eventstats.model.QueueMessage
 * @see io.eventstats.model.AggregateRecord
 */
package io.eventstats.model;
