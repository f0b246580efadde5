/**
 * Backoff policies shared by the processor's connect, receive-retry and idle waits.
 */
package io.eventstats.backoff;
