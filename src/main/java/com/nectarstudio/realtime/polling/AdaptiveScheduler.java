package com.nectarstudio.realtime.polling;

import com.nectarstudio.realtime.detection.ChangeDetector;
import com.nectarstudio.realtime.detection.DetectionResult;
import com.nectarstudio.realtime.service.PollingMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Drives every polling job on its own adaptive cadence.
 * <p>
 * Each job is a chain of one-shot tasks on the shared task scheduler: a tick runs detection,
 * hands the batch to the {@link ChangeBatchListener}, commits, updates the interval and
 * schedules its successor. A tick without new rows still lets the listener check the view,
 * but only rows past the cursor count as activity for the interval. Ticks of one job never overlap; different jobs run in parallel.
 */
@Slf4j
@Component
public class AdaptiveScheduler {

    private final ChangeDetector changeDetector;
    private final ChangeBatchListener changeBatchListener;
    private final IntervalPolicy intervalPolicy;
    private final TaskScheduler taskScheduler;
    private final PollingMetricsService metricsService;
    private final Clock clock;

    public AdaptiveScheduler(ChangeDetector changeDetector,
                             ChangeBatchListener changeBatchListener,
                             IntervalPolicy intervalPolicy,
                             @Qualifier("pollingTaskScheduler") TaskScheduler taskScheduler,
                             PollingMetricsService metricsService,
                             Clock clock) {
        this.changeDetector = changeDetector;
        this.changeBatchListener = changeBatchListener;
        this.intervalPolicy = intervalPolicy;
        this.taskScheduler = taskScheduler;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Schedules the first tick of a new job one interval from now.
     */
    public void start(PollingJob job) {
        Instant firstRun = clock.instant().plusMillis(job.getCurrentInterval());
        job.setNextRunAt(firstRun);
        scheduleAt(job, firstRun);
        log.info("▶️ Started polling job {} every {} ms", job.getKey(), job.getCurrentInterval());
    }

    /**
     * Applies the fastest interval requested by the job's channels and pulls the pending tick
     * forward when it is now due sooner.
     */
    public void applyRequestedInterval(PollingJob job, long requestedFloor) {
        long interval = job.applyRequestedFloor(requestedFloor);
        if (job.isCancelled()) {
            return;
        }
        Instant due = clock.instant().plusMillis(interval);
        Instant pending = job.getNextRunAt();
        if (pending == null || pending.isAfter(due)) {
            job.setNextRunAt(due);
            scheduleAt(job, due);
            log.debug("⏩ Job {} rescheduled to {} ({} ms)", job.getKey(), due, interval);
        }
    }

    /**
     * Runs a tick as soon as a scheduler thread is free, outside the regular cadence.
     */
    public void pollNow(PollingJob job) {
        if (!job.isCancelled()) {
            scheduleAt(job, clock.instant());
        }
    }

    /**
     * Cancels future ticks. An in-flight tick completes but delivers nothing.
     */
    public void stop(PollingJob job) {
        job.cancel();
        log.info("⏹️ Stopped polling job {}", job.getKey());
    }

    /**
     * One poll cycle. Failures leave cursor, counters and interval as they were and are
     * retried on the next regular tick.
     */
    public void tick(PollingJob job) {
        if (job.isCancelled()) {
            return;
        }
        job.getTickLock().lock();
        try {
            if (job.isCancelled()) {
                return;
            }
            runDetection(job);
            job.setNextRunAt(clock.instant().plusMillis(job.getCurrentInterval()));
        } finally {
            job.getTickLock().unlock();
        }
        scheduleAt(job, job.getNextRunAt());
    }

    private void runDetection(PollingJob job) {
        PollingJobKey key = job.getKey();
        try {
            DetectionResult result = changeDetector.detect(job);
            if (job.isCancelled()) {
                log.debug("Job {} cancelled during poll, dropping {} changes", key, result.size());
                return;
            }
            if (!result.isEmpty()) {
                changeBatchListener.onChangeBatch(key, result.events());
                changeDetector.commit(job, result);
            } else if (changeBatchListener.onQuietPoll(key)) {
                log.debug("🔄 View of job {} changed without new rows past the cursor", key);
            }
            long previous = job.getCurrentInterval();
            long next = job.completePoll(result.size(), intervalPolicy, clock.instant());
            metricsService.recordPoll(result.size());
            if (next != previous) {
                log.debug("⏱️ Job {} interval {} -> {} ms after {} changes", key, previous, next, result.size());
            }
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("❌ Poll of {} failed, retrying in {} ms: {}", key, job.getCurrentInterval(), error);
            job.failPoll(error, clock.instant());
            metricsService.recordPollError();
            if (!job.isCancelled()) {
                changeBatchListener.onPollingError(key, error);
            }
        }
    }

    private void scheduleAt(PollingJob job, Instant when) {
        if (job.isCancelled()) {
            return;
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> tick(job), when);
        job.replaceScheduledTick(future);
    }
}
