package com.nectarstudio.realtime.registry;

import com.nectarstudio.realtime.polling.PollingJob;

/**
 * Outcome of binding a channel.
 *
 * @param jobCreated     true when this bind created the job, so the caller must start it
 * @param requestedFloor smallest interval requested by any channel now bound to the job
 */
public record BindResult(PollingJob job, Subscription subscription, boolean jobCreated, long requestedFloor) { }
