/**
 * Dead-letter queue monitoring.
 *
 * @see io.eventstats.dead.DeadLetterInspector
 */
package io.eventstats.dead;
