/**
 * Small shared utilities: the zero-dependency JSON codec and a daemon thread factory.
 */
package io.eventstats.util;
