/**
 * Spring Boot auto-configuration for the event stats processor.
 *
 * <p>Add {@code eventstats-spring-boot-starter} and a {@link javax.sql.DataSource} to get an
 * aggregate store, an SQS queue gateway and a processor loop that starts with the context.
 * Settings live under the {@code eventstats.*} prefix, see
 * {@link io.eventstats.spring.boot.EventStatsProperties}.
 */
package io.eventstats.spring.boot;
