/**
 * Event schema validation: turns raw queue message bodies into typed {@link io.eventstats.model.Event}s.
 *
 * <p>{@link io.eventstats.validate.EventValidator} is pure; failures are reported as an
 * {@link io.eventstats.validate.EventValidationException} carrying a sealed
 * {@link io.eventstats.validate.ValidationError}.
 */
package io.eventstats.validate;
