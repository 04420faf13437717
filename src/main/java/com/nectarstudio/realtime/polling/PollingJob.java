package com.nectarstudio.realtime.polling;

import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.detection.cleanup.CleanupStrategy;
import com.nectarstudio.realtime.source.ListQuery;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one polling job.
 * <p>
 * {@link #tickLock} serialises ticks of this job. Interval and counter updates are short
 * {@code synchronized} sections so subscription changes never wait for a running query.
 */
@Getter
public class PollingJob {

    private final PollingJobKey key;
    private final TableDescriptor table;
    private final ListQuery listQuery;
    private final CleanupStrategy cleanupStrategy;
    private final ReentrantLock tickLock = new ReentrantLock();

    @Setter
    private volatile Instant cursor;
    @Setter
    private volatile boolean triggersEnabled;
    @Setter
    private volatile Instant nextRunAt;
    /**
     * Checksum of the last snapshot pushed for this job's view, null until the first one.
     */
    @Setter
    private volatile String snapshotChecksum;

    private long currentInterval;
    private int consecutiveEmptyPolls;
    private int consecutiveActivePolls;
    private long totalPolls;
    private long totalChanges;
    private volatile Instant lastPolledAt;
    private volatile String lastError;
    private volatile boolean cancelled;
    private ScheduledFuture<?> scheduledTick;

    public PollingJob(PollingJobKey key, TableDescriptor table, ListQuery listQuery,
                      CleanupStrategy cleanupStrategy, Instant cursor) {
        this.key = key;
        this.table = table;
        this.listQuery = listQuery;
        this.cleanupStrategy = cleanupStrategy;
        this.cursor = cursor;
        this.currentInterval = table.baseInterval();
    }

    public synchronized long getCurrentInterval() {
        return currentInterval;
    }

    public synchronized int getConsecutiveEmptyPolls() {
        return consecutiveEmptyPolls;
    }

    public synchronized int getConsecutiveActivePolls() {
        return consecutiveActivePolls;
    }

    public synchronized long getTotalPolls() {
        return totalPolls;
    }

    public synchronized long getTotalChanges() {
        return totalChanges;
    }

    /**
     * Records a successful poll and moves the interval as the policy says.
     *
     * @return the new interval
     */
    public synchronized long completePoll(int changeCount, IntervalPolicy policy, Instant polledAt) {
        totalPolls++;
        lastPolledAt = polledAt;
        lastError = null;
        if (changeCount > 0) {
            consecutiveActivePolls++;
            consecutiveEmptyPolls = 0;
            totalChanges += changeCount;
        } else {
            consecutiveEmptyPolls++;
            consecutiveActivePolls = 0;
        }
        currentInterval = clamp(policy.nextInterval(this, changeCount, currentInterval));
        return currentInterval;
    }

    /**
     * Records a failed poll. Counters and interval keep their trend.
     */
    public synchronized void failPoll(String error, Instant polledAt) {
        totalPolls++;
        lastPolledAt = polledAt;
        lastError = error;
    }

    /**
     * Lowers the interval to the fastest cadence any bound channel asked for.
     *
     * @return the new interval
     */
    public synchronized long applyRequestedFloor(long requestedFloor) {
        currentInterval = clamp(Math.min(requestedFloor, currentInterval));
        return currentInterval;
    }

    /**
     * Installs the handle of the next scheduled tick, cancelling the one it replaces.
     *
     * @return false if the job was cancelled meanwhile, in which case {@code next} is cancelled too
     */
    public synchronized boolean replaceScheduledTick(ScheduledFuture<?> next) {
        if (scheduledTick != null && scheduledTick != next) {
            scheduledTick.cancel(false);
        }
        scheduledTick = next;
        if (cancelled) {
            next.cancel(false);
            return false;
        }
        return true;
    }

    /**
     * Stops future ticks. A tick already running finishes but delivers nothing.
     */
    public synchronized void cancel() {
        cancelled = true;
        if (scheduledTick != null) {
            scheduledTick.cancel(false);
        }
    }

    private long clamp(long interval) {
        return Math.max(table.minInterval(), Math.min(table.maxInterval(), interval));
    }
}
