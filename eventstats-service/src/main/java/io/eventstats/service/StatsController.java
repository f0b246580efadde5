package io.eventstats.service;

import io.eventstats.dead.DeadLetterInspector;
import io.eventstats.model.AggregateRecord;
import io.eventstats.model.HealthStatus;
import io.eventstats.processor.ProcessorLoop;
import io.eventstats.processor.ProcessorState;
import io.eventstats.spi.AggregateStore;
import io.eventstats.spi.QueueGateway;
import io.eventstats.spi.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
public class StatsController {

    private static final Logger log = LoggerFactory.getLogger(StatsController.class);

    private final AggregateStore aggregateStore;
    private final QueueGateway queueGateway;
    private final DeadLetterInspector deadLetterInspector;
    private final ObjectProvider<ProcessorLoop> processorLoop;

    public StatsController(AggregateStore aggregateStore,
                           QueueGateway queueGateway,
                           DeadLetterInspector deadLetterInspector,
                           ObjectProvider<ProcessorLoop> processorLoop) {
        this.aggregateStore = aggregateStore;
        this.queueGateway = queueGateway;
        this.deadLetterInspector = deadLetterInspector;
        this.processorLoop = processorLoop;
    }

    @GetMapping("/")
    public Map<String, String> index() {
        return Map.of("message", "Welcome to the event stats API");
    }

    @GetMapping("/stats")
    public List<Map<String, Object>> allStats() {
        return aggregateStore.getAll().values().stream()
                .map(StatsController::toJson)
                .toList();
    }

    @GetMapping("/stats/{type}")
    public ResponseEntity<Map<String, Object>> stats(@PathVariable String type) {
        return aggregateStore.get(type)
                .map(record -> ResponseEntity.ok(toJson(record)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("error", "No stats for event type '" + type + "'")));
    }

    @DeleteMapping("/stats")
    public ResponseEntity<Void> reset() {
        aggregateStore.reset();
        log.info("Aggregates reset via API");
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        HealthStatus store = aggregateStore.healthCheck();
        HealthStatus queue = queueGateway.healthCheck();
        ProcessorLoop loop = processorLoop.getIfAvailable();
        ProcessorState processor = loop != null ? loop.state() : null;
        // A failed loop no longer consumes, even when both connections are fine.
        boolean healthy = store.isHealthy() && queue.isHealthy() && processor != ProcessorState.FAILED;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "healthy" : "unhealthy");
        body.put("store", lower(store));
        body.put("queue", lower(queue));
        if (processor != null) {
            body.put("processor", processor.name());
        }
        body.put("deadLetterMessages", deadLetterInspector.count());
        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<Map<String, String>> storeUnavailable(StoreUnavailableException e) {
        log.error("Aggregate store unavailable", e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "Aggregate store unavailable"));
    }

    private static Map<String, Object> toJson(AggregateRecord record) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("type", record.eventType());
        json.put("count", record.count());
        json.put("sum", record.sum());
        json.put("average", record.average());
        return json;
    }

    private static String lower(HealthStatus status) {
        return status.name().toLowerCase(Locale.ROOT);
    }
}
