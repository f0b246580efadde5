package io.eventstats.service;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Event stats service: the processor loop plus the HTTP stats API.
 *
 * <p>Everything is wired by {@code eventstats-spring-boot-starter}; settings come from
 * {@code application.yml} and the environment variables it maps.
 *
 * <p>Endpoints:
 * GET    /stats          - all aggregates, sorted by type
 * GET    /stats/{type}   - one aggregate, 404 if unknown
 * DELETE /stats          - reset all aggregates
 * GET    /health         - store, queue and processor status
 */
@SpringBootApplication
public class EventStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventStatsApplication.class, args);
    }
}
