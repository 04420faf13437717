package com.nectarstudio.realtime.polling;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.detection.TableDescriptor;
import org.springframework.stereotype.Component;

/**
 * Speeds up while a table is busy and backs off while it is quiet: every active poll
 * multiplies the interval by the shrink factor, and once the empty-poll threshold is reached
 * every further empty poll multiplies it by the growth factor. In CDC mode a full batch
 * means a backlog, so polling jumps straight to the minimum interval.
 */
@Component
public class ActivityIntervalPolicy implements IntervalPolicy {

    private final RealtimeProperties.Policy policy;

    public ActivityIntervalPolicy(RealtimeProperties properties) {
        this.policy = properties.getPolicy();
    }

    @Override
    public long nextInterval(PollingJob job, int changeCount, long current) {
        TableDescriptor table = job.getTable();
        if (changeCount > 0) {
            if (policy.isDrainOnFullBatch() && table.cdcMode() && changeCount >= table.batchSize()) {
                return table.minInterval();
            }
            return Math.max(table.minInterval(), Math.round(current * policy.getShrinkFactor()));
        }
        if (job.getConsecutiveEmptyPolls() >= policy.getEmptyPollThreshold()) {
            return Math.min(table.maxInterval(), Math.round(current * policy.getGrowthFactor()));
        }
        return current;
    }
}
