package com.nectarstudio.realtime.polling;

/**
 * Strategy for the delay between two polls of a job. The result is clamped to the
 * job's [min, max] bounds by the caller.
 */
public interface IntervalPolicy {

    /**
     * @param job         the job, counters already updated for this poll
     * @param changeCount number of changes found by this poll
     * @param current     interval used before this poll
     */
    long nextInterval(PollingJob job, int changeCount, long current);
}
