package com.nectarstudio.realtime.registry;

import com.nectarstudio.realtime.polling.PollingJob;

/**
 * Outcome of unbinding a channel.
 *
 * @param jobRemoved     true when the channel was the last one and the job must be stopped
 * @param requestedFloor smallest interval requested by the remaining channels, {@link Long#MAX_VALUE} when none remain
 */
public record UnbindResult(PollingJob job, Subscription subscription, boolean jobRemoved, long requestedFloor) { }
