package com.nectarstudio.realtime.trigger;

import com.nectarstudio.realtime.model.domain.ChangeOperation;
import com.nectarstudio.realtime.model.domain.UpdateType;
import com.nectarstudio.realtime.model.dto.TableUpdate;
import com.nectarstudio.realtime.model.dto.TriggerNotification;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import com.nectarstudio.realtime.registry.SubscriptionRegistry;
import com.nectarstudio.realtime.service.PollingMetricsService;
import com.nectarstudio.realtime.transport.FanOutTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fans a source-side trigger notification out as {@code database_trigger} updates to every
 * job on that entity whose channels enabled triggers. Row filters are not evaluated here;
 * the next polling refresh brings filtered views back in line.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerEventProcessor {

    private final SubscriptionRegistry subscriptionRegistry;
    private final FanOutTransport fanOutTransport;
    private final PollingMetricsService metricsService;
    private final Clock clock;

    /**
     * @return number of channels the change was queued for
     */
    public int process(TriggerNotification notification) {
        if (!notification.hasPayload()) {
            log.warn("⚠️ Ignoring trigger notification without service, table or data: {}", notification);
            return 0;
        }
        Optional<ChangeOperation> operation = ChangeOperation.parse(notification.getOperation());
        if (operation.isEmpty()) {
            log.warn("⚠️ Ignoring trigger notification with unknown operation '{}' on {}/{}",
                    notification.getOperation(), notification.getServiceName(), notification.getEntityName());
            return 0;
        }

        List<PollingJob> jobs = subscriptionRegistry.jobsFor(notification.getServiceName(), notification.getEntityName())
                .stream()
                .filter(PollingJob::isTriggersEnabled)
                .toList();
        if (jobs.isEmpty()) {
            log.debug("No trigger subscribers for {}/{}", notification.getServiceName(), notification.getEntityName());
            return 0;
        }

        Instant occurredAt = notification.occurredAt(clock.instant());
        int delivered = 0;
        for (PollingJob job : jobs) {
            PollingJobKey key = job.getKey();
            TableUpdate update = new TableUpdate(null, key.serviceName(), key.entityName(), UpdateType.DATABASE_TRIGGER,
                    notification.getData(), operation.get().name(), null, null, occurredAt);
            delivered += fanOutTransport.deliverTrigger(key, update);
        }
        metricsService.recordEventsDetected(1);
        log.info("⚡ {} on {}/{} pushed to {} channels across {} jobs", operation.get(),
                notification.getServiceName(), notification.getEntityName(), delivered, jobs.size());
        return delivered;
    }
}
