package com.nectarstudio.realtime.controller;

import com.nectarstudio.realtime.model.domain.JobCursor;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.registry.SubscriptionRegistry;
import com.nectarstudio.realtime.repository.JobCursorRepository;
import com.nectarstudio.realtime.service.EntityCatalog;
import com.nectarstudio.realtime.service.PollingMetricsService;
import com.nectarstudio.realtime.service.SubscriptionService;
import com.nectarstudio.realtime.transport.FanOutTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Internal controller for operations: job inspection and manual polling.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal")
@RequiredArgsConstructor
public class InternalController {

    private final SubscriptionService subscriptionService;
    private final SubscriptionRegistry subscriptionRegistry;
    private final FanOutTransport fanOutTransport;
    private final PollingMetricsService metricsService;
    private final EntityCatalog entityCatalog;
    private final JobCursorRepository jobCursorRepository;

    public record JobView(String key, String table, String watermarkColumn, long currentInterval,
                          int consecutiveEmptyPolls, int consecutiveActivePolls, Instant cursor,
                          Instant nextRunAt, Instant lastPolledAt, String lastError,
                          boolean triggersEnabled, int channels) {

        static JobView of(PollingJob job, int channels) {
            return new JobView(job.getKey().canonical(), job.getTable().table(), job.getTable().watermarkColumn(),
                    job.getCurrentInterval(), job.getConsecutiveEmptyPolls(), job.getConsecutiveActivePolls(),
                    job.getCursor(), job.getNextRunAt(), job.getLastPolledAt(), job.getLastError(),
                    job.isTriggersEnabled(), channels);
        }
    }

    /**
     * List active polling jobs
     */
    @GetMapping("/jobs")
    public ResponseEntity<List<JobView>> jobs() {
        List<JobView> jobs = subscriptionService.activeJobs().stream()
                .map(job -> JobView.of(job, subscriptionRegistry.routeUpdate(job.getKey()).size()))
                .toList();
        return ResponseEntity.ok(jobs);
    }

    /**
     * Persisted cursors for an entity, including those of jobs no longer active
     */
    @GetMapping("/cursors")
    public ResponseEntity<List<JobCursor>> cursors(@RequestParam String serviceName, @RequestParam String entityName) {
        return ResponseEntity.ok(jobCursorRepository.findByServiceNameAndEntityName(serviceName, entityName));
    }

    /**
     * Poll every job of an entity right now
     */
    @PostMapping("/jobs/poll")
    public ResponseEntity<String> poll(@RequestParam String serviceName, @RequestParam String entityName) {
        try {
            log.info("🔄 Manual poll requested for {}/{}", serviceName, entityName);
            int polled = subscriptionService.pollNow(serviceName, entityName);
            return ResponseEntity.ok("✅ Poll scheduled for " + polled + " jobs");
        } catch (Exception e) {
            log.error("❌ Error scheduling manual poll for {}/{}", serviceName, entityName, e);
            return ResponseEntity.status(500).body("❌ Poll failed: " + e.getMessage());
        }
    }

    /**
     * Forget resolved table metadata so the next subscription re-reads it
     */
    @PostMapping("/catalog/evict")
    public ResponseEntity<String> evictCatalog() {
        entityCatalog.evictAll();
        return ResponseEntity.ok("✅ Entity catalog cleared");
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("connections", fanOutTransport.connectionCount());
        health.put("channels", subscriptionRegistry.channelCount());
        health.put("jobs", subscriptionRegistry.activeJobs().size());
        health.put("polls", metricsService.getPollsCount());
        health.put("pollErrors", metricsService.getPollErrorsCount());
        health.put("eventsDelivered", metricsService.getEventsDetectedCount());
        health.put("framesDropped", metricsService.getUpdatesDroppedCount());
        return ResponseEntity.ok(health);
    }
}
