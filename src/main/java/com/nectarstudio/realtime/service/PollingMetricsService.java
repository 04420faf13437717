package com.nectarstudio.realtime.service;

import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.registry.SubscriptionRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polling and delivery counters, exported through Micrometer and logged periodically.
 */
@Slf4j
@Service
public class PollingMetricsService {

    private final SubscriptionRegistry subscriptionRegistry;

    private final Counter pollsCounter;
    private final Counter pollErrorsCounter;
    private final Counter eventsDetectedCounter;
    private final Counter updatesDroppedCounter;

    // Simple counters for the statistics log
    private final AtomicLong polls = new AtomicLong(0);
    private final AtomicLong pollErrors = new AtomicLong(0);
    private final AtomicLong eventsDetected = new AtomicLong(0);
    private final AtomicLong updatesDropped = new AtomicLong(0);

    public PollingMetricsService(MeterRegistry meterRegistry, SubscriptionRegistry subscriptionRegistry) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.pollsCounter = Counter.builder("realtime.polls")
                .description("Completed poll cycles")
                .register(meterRegistry);
        this.pollErrorsCounter = Counter.builder("realtime.poll.errors")
                .description("Poll cycles that failed against the source")
                .register(meterRegistry);
        this.eventsDetectedCounter = Counter.builder("realtime.events.detected")
                .description("Row changes delivered to subscribers")
                .register(meterRegistry);
        this.updatesDroppedCounter = Counter.builder("realtime.updates.dropped")
                .description("Frames dropped by full or resyncing outboxes")
                .register(meterRegistry);
        Gauge.builder("realtime.jobs.active", subscriptionRegistry, r -> r.activeJobs().size())
                .description("Polling jobs with at least one channel")
                .register(meterRegistry);
        Gauge.builder("realtime.channels.active", subscriptionRegistry, SubscriptionRegistry::channelCount)
                .register(meterRegistry);
    }

    public void recordPoll(int changeCount) {
        polls.incrementAndGet();
        pollsCounter.increment();
        log.trace("Recorded poll with {} changes - Total polls: {}", changeCount, polls.get());
    }

    public void recordPollError() {
        pollErrors.incrementAndGet();
        pollErrorsCounter.increment();
        log.debug("Recorded poll error metric - Total: {}", pollErrors.get());
    }

    public void recordEventsDetected(int count) {
        eventsDetected.addAndGet(count);
        eventsDetectedCounter.increment(count);
    }

    public void recordUpdateDropped() {
        updatesDropped.incrementAndGet();
        updatesDroppedCounter.increment();
    }

    public long getPollsCount() {
        return polls.get();
    }

    public long getPollErrorsCount() {
        return pollErrors.get();
    }

    public long getEventsDetectedCount() {
        return eventsDetected.get();
    }

    public long getUpdatesDroppedCount() {
        return updatesDropped.get();
    }

    /**
     * Log polling statistics for monitoring
     * Runs every 5 minutes
     */
    @Scheduled(fixedRateString = "${app.realtime.statistics-interval-ms:300000}",
            initialDelayString = "${app.realtime.statistics-interval-ms:300000}")
    public void logPollingStatistics() {
        List<PollingJob> jobs = subscriptionRegistry.activeJobs();
        log.info("=== POLLING STATISTICS ===");
        log.info("Jobs: {}, Channels: {}", jobs.size(), subscriptionRegistry.channelCount());
        log.info("Polls: {}, Errors: {}, Events delivered: {}, Frames dropped: {}",
                polls.get(), pollErrors.get(), eventsDetected.get(), updatesDropped.get());
        for (PollingJob job : jobs) {
            log.info("  {} every {} ms (empty x{}, active x{}, cursor {})", job.getKey(), job.getCurrentInterval(),
                    job.getConsecutiveEmptyPolls(), job.getConsecutiveActivePolls(), job.getCursor());
        }
        log.info("==========================");

        long failing = jobs.stream().filter(job -> job.getLastError() != null).count();
        if (failing > 0) {
            log.warn("HIGH ALERT: {} polling jobs are failing against their source", failing);
        }
    }
}
