package com.nectarstudio.realtime.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.detection.ChangeDetector;
import com.nectarstudio.realtime.detection.CursorTracker;
import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.detection.cleanup.CleanupStrategy;
import com.nectarstudio.realtime.exception.MalformedMessageException;
import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.exception.TransientSourceException;
import com.nectarstudio.realtime.model.dto.SubscribeRequest;
import com.nectarstudio.realtime.model.dto.SubscriptionConfirmed;
import com.nectarstudio.realtime.model.dto.UnsubscribeRequest;
import com.nectarstudio.realtime.polling.AdaptiveScheduler;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import com.nectarstudio.realtime.registry.BindResult;
import com.nectarstudio.realtime.registry.ChannelRef;
import com.nectarstudio.realtime.registry.SubscriptionRegistry;
import com.nectarstudio.realtime.registry.UnbindResult;
import com.nectarstudio.realtime.source.ListQuery;
import com.nectarstudio.realtime.transport.DuplexChannel;
import com.nectarstudio.realtime.transport.FanOutTransport;
import com.nectarstudio.realtime.transport.MessageTypes;
import com.nectarstudio.realtime.transport.RealtimeMessage;
import com.nectarstudio.realtime.transport.RealtimeMessageCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Handles the client side of the protocol: accepts connections, binds and unbinds channels,
 * and starts or stops polling jobs as their first channel arrives or last channel leaves.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRegistry subscriptionRegistry;
    private final AdaptiveScheduler adaptiveScheduler;
    private final FanOutTransport fanOutTransport;
    private final EntityCatalog entityCatalog;
    private final ChangeDetector changeDetector;
    private final CursorTracker cursorTracker;
    private final RealtimeMessageCodec codec;
    private final RealtimeProperties properties;

    /**
     * Wires a new client connection into the protocol.
     */
    public void accept(DuplexChannel connection) {
        fanOutTransport.open(connection);
        connection.onMessage(frame -> handleFrame(connection.id(), frame));
        connection.onClose(() -> disconnect(connection.id()));
    }

    void handleFrame(String connectionId, String frame) {
        RealtimeMessage message;
        try {
            message = codec.decode(frame);
        } catch (MalformedMessageException e) {
            log.warn("⚠️ Dropping malformed frame on {}: {}", connectionId, e.getMessage());
            return;
        }
        switch (message.event()) {
            case MessageTypes.SUBSCRIBE_TABLE -> handleSubscribe(connectionId, message);
            case MessageTypes.UNSUBSCRIBE_TABLE -> handleUnsubscribe(connectionId, message);
            default -> log.warn("⚠️ Unknown event '{}' on {}", message.event(), connectionId);
        }
    }

    private void handleSubscribe(String connectionId, RealtimeMessage message) {
        SubscribeRequest request;
        try {
            request = codec.payload(message, SubscribeRequest.class);
        } catch (MalformedMessageException e) {
            JsonNode channelId = message.data().path("channelId");
            if (channelId.isTextual()) {
                fanOutTransport.reject(new ChannelRef(connectionId, channelId.asText()), e.getMessage());
            } else {
                log.warn("⚠️ Unroutable subscribe_table on {}: {}", connectionId, e.getMessage());
            }
            return;
        }
        subscribe(connectionId, request);
    }

    private void handleUnsubscribe(String connectionId, RealtimeMessage message) {
        try {
            UnsubscribeRequest request = codec.payload(message, UnsubscribeRequest.class);
            if (request.channelId() != null) {
                unsubscribe(new ChannelRef(connectionId, request.channelId()));
            }
        } catch (MalformedMessageException e) {
            log.warn("⚠️ Invalid unsubscribe_table on {}: {}", connectionId, e.getMessage());
        }
    }

    /**
     * Binds a channel and confirms it, or answers {@code subscription_error} without creating anything.
     */
    public void subscribe(String connectionId, SubscribeRequest request) {
        if (request.channelId() == null || request.channelId().isBlank()) {
            log.warn("⚠️ subscribe_table without channelId on {}, ignored", connectionId);
            return;
        }
        ChannelRef channel = new ChannelRef(connectionId, request.channelId());
        if (subscriptionRegistry.subscription(channel).isPresent()) {
            log.debug("Channel {} resubscribes, releasing previous binding", channel);
            release(channel);
        }
        fanOutTransport.beginSubscription(channel);
        if (request.serviceName() == null || request.entityName() == null) {
            fanOutTransport.reject(channel, "serviceName and entityName are required");
            return;
        }

        long requested = request.pollingInterval() != null && request.pollingInterval() > 0
                ? request.pollingInterval()
                : properties.getDefaultPollingInterval();
        BindResult result;
        try {
            PollingJobKey key = PollingJobKey.of(request.serviceName(), request.entityName(), request.filtersOrEmpty());
            result = subscriptionRegistry.join(channel, key, requested, request.triggersRequested())
                    .orElseGet(() -> subscriptionRegistry.subscribe(channel, request.serviceName(),
                            request.entityName(), request.filtersOrEmpty(), requested,
                            request.triggersRequested(), prepareJob(key)));
        } catch (SubscriptionConfigurationException e) {
            log.warn("❌ Subscription {} to {}/{} rejected: {}", channel, request.serviceName(),
                    request.entityName(), e.getMessage());
            fanOutTransport.reject(channel, e.getMessage());
            return;
        } catch (TransientSourceException | DataAccessException e) {
            log.warn("❌ Subscription {} to {}/{} failed, source unavailable: {}", channel,
                    request.serviceName(), request.entityName(), e.getMessage());
            fanOutTransport.reject(channel, e.getMessage());
            return;
        }

        PollingJob job = result.job();
        if (result.jobCreated()) {
            adaptiveScheduler.start(job);
        }
        adaptiveScheduler.applyRequestedInterval(job, result.requestedFloor());

        String method = request.triggersRequested() ? MessageTypes.METHOD_DATABASE_TRIGGERS : MessageTypes.METHOD_POLLING;
        fanOutTransport.confirm(channel, new SubscriptionConfirmed(channel.channelId(), method, job.getCurrentInterval()));
        log.info("✅ Channel {} subscribed to {} via {} ({} ms)", channel, job.getKey(), method, job.getCurrentInterval());
    }

    public void unsubscribe(ChannelRef channel) {
        release(channel);
        fanOutTransport.unsubscribed(channel);
    }

    /**
     * Unbinds every channel of a lost connection.
     */
    public void disconnect(String connectionId) {
        List<ChannelRef> channels = subscriptionRegistry.channelsOf(connectionId);
        channels.forEach(this::release);
        fanOutTransport.closed(connectionId);
        if (!channels.isEmpty()) {
            log.info("🔌 Connection {} lost, released {} channels", connectionId, channels.size());
        }
    }

    public List<PollingJob> activeJobs() {
        return subscriptionRegistry.activeJobs();
    }

    /**
     * Triggers an immediate poll of every job on the entity.
     *
     * @return number of jobs polled
     */
    public int pollNow(String serviceName, String entityName) {
        List<PollingJob> jobs = subscriptionRegistry.jobsFor(serviceName, entityName);
        jobs.forEach(adaptiveScheduler::pollNow);
        return jobs.size();
    }

    private void release(ChannelRef channel) {
        Optional<UnbindResult> unbound = subscriptionRegistry.unsubscribe(channel);
        unbound.ifPresent(result -> {
            if (result.jobRemoved()) {
                adaptiveScheduler.stop(result.job());
            } else {
                adaptiveScheduler.applyRequestedInterval(result.job(), result.requestedFloor());
            }
        });
    }

    /**
     * Resolves everything a new job needs up front, so the registry only has to construct it.
     */
    private Function<PollingJobKey, PollingJob> prepareJob(PollingJobKey key) {
        TableDescriptor table = entityCatalog.resolve(key.serviceName(), key.entityName());
        ListQuery listQuery = ListQuery.compile(key.toFilters(), table.columns(), properties.getPageSize());
        CleanupStrategy cleanupStrategy = changeDetector.strategyFor(table.cleanupStrategy());
        Instant cursor = cursorTracker.initialCursor(key);
        return k -> new PollingJob(k, table, listQuery, cleanupStrategy, cursor);
    }
}
