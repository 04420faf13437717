package com.nectarstudio.realtime.registry;

import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.polling.PollingJobKey;

import java.time.Instant;

/**
 * A channel bound to a polling job.
 *
 * @param requestedPollingInterval the cadence this channel asked for, in milliseconds
 */
public record Subscription(
        ChannelRef channel,
        PollingJobKey jobKey,
        TableFilters filters,
        long requestedPollingInterval,
        boolean enableDatabaseTriggers,
        Instant subscribedAt
) { }
