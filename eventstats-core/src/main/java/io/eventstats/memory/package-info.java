/**
 * In-memory adapters for the queue and store SPIs, for tests and local runs without AWS or a database.
 */
package io.eventstats.memory;
