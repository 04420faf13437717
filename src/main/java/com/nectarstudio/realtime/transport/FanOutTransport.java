package com.nectarstudio.realtime.transport;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.model.domain.ChangeEvent;
import com.nectarstudio.realtime.model.domain.UpdateType;
import com.nectarstudio.realtime.model.dto.PollingError;
import com.nectarstudio.realtime.model.dto.SubscriptionConfirmed;
import com.nectarstudio.realtime.model.dto.SubscriptionError;
import com.nectarstudio.realtime.model.dto.TableUpdate;
import com.nectarstudio.realtime.polling.ChangeBatchListener;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.polling.PollingJobKey;
import com.nectarstudio.realtime.registry.ChannelRef;
import com.nectarstudio.realtime.registry.Subscription;
import com.nectarstudio.realtime.registry.SubscriptionRegistry;
import com.nectarstudio.realtime.service.PollingMetricsService;
import com.nectarstudio.realtime.service.TableSnapshotService;
import com.nectarstudio.realtime.service.TableSnapshotService.SnapshotPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Pushes updates to subscriber channels.
 * <p>
 * Every channel gets its own bounded {@link ChannelOutbox}; a slow or dead connection only
 * ever loses its own frames. A failed write closes the connection, and the close callback
 * unbinds all of its channels.
 */
@Slf4j
@Component
public class FanOutTransport implements ChangeBatchListener {

    private final SubscriptionRegistry subscriptionRegistry;
    private final TableSnapshotService tableSnapshotService;
    private final RealtimeMessageCodec codec;
    private final PollingMetricsService metricsService;
    private final Executor deliveryExecutor;
    private final RealtimeProperties properties;
    private final Clock clock;

    private final Map<String, ConnectionSession> sessions = new ConcurrentHashMap<>();

    public FanOutTransport(SubscriptionRegistry subscriptionRegistry,
                           TableSnapshotService tableSnapshotService,
                           RealtimeMessageCodec codec,
                           PollingMetricsService metricsService,
                           @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                           RealtimeProperties properties,
                           Clock clock) {
        this.subscriptionRegistry = subscriptionRegistry;
        this.tableSnapshotService = tableSnapshotService;
        this.codec = codec;
        this.metricsService = metricsService;
        this.deliveryExecutor = deliveryExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    public ConnectionSession open(DuplexChannel connection) {
        ConnectionSession session = new ConnectionSession(connection, clock.instant());
        sessions.put(connection.id(), session);
        log.info("🔌 Connection {} opened ({} active)", connection.id(), sessions.size());
        return session;
    }

    /**
     * Forgets a closed connection. Queued frames are discarded.
     */
    public void closed(String connectionId) {
        ConnectionSession session = sessions.remove(connectionId);
        if (session == null) {
            return;
        }
        session.outboxes().forEach((channelId, outbox) -> {
            outbox.close();
            session.setState(channelId, ChannelState.DISCONNECTED);
        });
        log.info("🔌 Connection {} closed ({} active)", connectionId, sessions.size());
    }

    public Optional<ConnectionSession> session(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int connectionCount() {
        return sessions.size();
    }

    public Optional<ChannelState> state(ChannelRef channel) {
        ConnectionSession session = sessions.get(channel.connectionId());
        return session != null ? session.state(channel.channelId()) : Optional.empty();
    }

    /**
     * Puts a channel into PENDING with a paused outbox, so updates routed before the
     * confirmation is sent queue up behind it.
     */
    public void beginSubscription(ChannelRef channel) {
        ConnectionSession session = sessions.get(channel.connectionId());
        if (session == null) {
            return;
        }
        ChannelOutbox outbox = new ChannelOutbox(channel, session.connection(), properties.getOutboxCapacity(),
                deliveryExecutor, this::onDropped);
        session.replaceOutbox(channel.channelId(), outbox).ifPresent(ChannelOutbox::close);
        session.setState(channel.channelId(), ChannelState.PENDING);
    }

    public void confirm(ChannelRef channel, SubscriptionConfirmed confirmed) {
        ConnectionSession session = sessions.get(channel.connectionId());
        if (session == null) {
            return;
        }
        session.outbox(channel.channelId()).ifPresent(outbox -> {
            outbox.offerFirst(new OutboundMessage(MessageTypes.SUBSCRIPTION_CONFIRMED,
                    codec.encode(MessageTypes.SUBSCRIPTION_CONFIRMED, confirmed), false));
            session.setState(channel.channelId(), ChannelState.SUBSCRIBED);
            outbox.open();
        });
    }

    /**
     * Sends {@code subscription_error} and moves the channel to FAILED. Nothing else is sent on it.
     */
    public void reject(ChannelRef channel, String error) {
        ConnectionSession session = sessions.get(channel.connectionId());
        if (session == null) {
            return;
        }
        ChannelOutbox outbox = session.removeOutbox(channel.channelId())
                .orElseGet(() -> new ChannelOutbox(channel, session.connection(), properties.getOutboxCapacity(),
                        deliveryExecutor, this::onDropped));
        outbox.clear();
        outbox.offerFirst(new OutboundMessage(MessageTypes.SUBSCRIPTION_ERROR,
                codec.encode(MessageTypes.SUBSCRIPTION_ERROR, new SubscriptionError(channel.channelId(), error)), false));
        session.setState(channel.channelId(), ChannelState.FAILED);
        outbox.open();
    }

    public void unsubscribed(ChannelRef channel) {
        ConnectionSession session = sessions.get(channel.connectionId());
        if (session == null) {
            return;
        }
        session.removeOutbox(channel.channelId()).ifPresent(ChannelOutbox::close);
        session.setState(channel.channelId(), ChannelState.UNSUBSCRIBED);
    }

    /**
     * Sends the job's current snapshot to every bound channel. When the job's cleanup is
     * table scoped the batch was consumed for the whole table, so every job on the table is
     * refreshed. Throws when a snapshot cannot be read, which keeps the cursor in place.
     */
    @Override
    public void onChangeBatch(PollingJobKey jobKey, List<ChangeEvent> events) {
        Optional<PollingJob> job = subscriptionRegistry.job(jobKey);
        if (job.isEmpty()) {
            log.debug("No channels left for {}, {} changes not delivered", jobKey, events.size());
            return;
        }
        List<PollingJob> targets = job.get().getCleanupStrategy().tableScoped()
                ? subscriptionRegistry.jobsFor(jobKey.serviceName(), jobKey.entityName())
                : List.of(job.get());

        int channels = 0;
        int delivered = 0;
        for (PollingJob target : targets) {
            Set<ChannelRef> bound = subscriptionRegistry.routeUpdate(target.getKey());
            if (bound.isEmpty()) {
                continue;
            }
            channels += bound.size();
            delivered += pushRefresh(target, bound, events.size());
        }
        if (channels == 0) {
            log.debug("No channels left for {}, {} changes not delivered", jobKey, events.size());
            return;
        }
        metricsService.recordEventsDetected(events.size());
        log.info("📤 {} changes on {} pushed to {}/{} channels across {} views",
                events.size(), jobKey, delivered, channels, targets.size());
    }

    /**
     * Re-reads the job's view and pushes it when its checksum moved. The first check only
     * records the checksum, clients already hold the snapshot they fetched on load.
     */
    @Override
    public boolean onQuietPoll(PollingJobKey jobKey) {
        Optional<PollingJob> job = subscriptionRegistry.job(jobKey);
        Set<ChannelRef> bound = subscriptionRegistry.routeUpdate(jobKey);
        if (job.isEmpty() || bound.isEmpty()) {
            return false;
        }
        SnapshotPage snapshot = tableSnapshotService.snapshot(job.get());
        String checksum = checksumOf(snapshot);
        String previous = job.get().getSnapshotChecksum();
        if (previous == null || previous.equals(checksum)) {
            job.get().setSnapshotChecksum(checksum);
            return false;
        }
        int delivered = pushRefresh(job.get(), bound, snapshot, checksum, 0);
        log.info("📤 View of {} changed in place, refresh pushed to {}/{} channels",
                jobKey, delivered, bound.size());
        return true;
    }

    private int pushRefresh(PollingJob job, Set<ChannelRef> channels, int changeCount) {
        SnapshotPage snapshot = tableSnapshotService.snapshot(job);
        return pushRefresh(job, channels, snapshot, checksumOf(snapshot), changeCount);
    }

    private int pushRefresh(PollingJob job, Set<ChannelRef> channels, SnapshotPage snapshot, String checksum,
                            int changeCount) {
        PollingJobKey key = job.getKey();
        TableUpdate update = new TableUpdate(null, key.serviceName(), key.entityName(),
                UpdateType.POLLING_REFRESH, snapshot.rows(), null, changeCount, snapshot.total(), clock.instant());
        job.setSnapshotChecksum(checksum);
        int delivered = 0;
        for (ChannelRef channel : channels) {
            if (deliver(channel, update)) {
                delivered++;
            }
        }
        return delivered;
    }

    private String checksumOf(SnapshotPage snapshot) {
        return codec.checksum(snapshot);
    }

    @Override
    public void onPollingError(PollingJobKey jobKey, String error) {
        for (ChannelRef channel : subscriptionRegistry.routeUpdate(jobKey)) {
            send(channel, MessageTypes.POLLING_ERROR, new PollingError(channel.channelId(), error), false);
        }
    }

    /**
     * Pushes a trigger-originated change to the channels of {@code jobKey} that asked for triggers.
     *
     * @return number of channels the update was queued for
     */
    public int deliverTrigger(PollingJobKey jobKey, TableUpdate update) {
        Collection<Subscription> subscriptions = subscriptionRegistry.subscriptionsOf(jobKey);
        int delivered = 0;
        for (Subscription subscription : subscriptions) {
            if (subscription.enableDatabaseTriggers() && deliver(subscription.channel(), update)) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliver(ChannelRef channel, TableUpdate update) {
        return send(channel, MessageTypes.TABLE_UPDATE, update.withChannelId(channel.channelId()), update.isRefresh());
    }

    private boolean send(ChannelRef channel, String event, Object payload, boolean refresh) {
        ConnectionSession session = sessions.get(channel.connectionId());
        if (session == null) {
            return false;
        }
        Optional<ChannelOutbox> outbox = session.outbox(channel.channelId());
        if (outbox.isEmpty()) {
            return false;
        }
        return outbox.get().offer(new OutboundMessage(event, codec.encode(event, payload), refresh));
    }

    private void onDropped(ChannelRef channel, OutboundMessage message) {
        metricsService.recordUpdateDropped();
        log.warn("⚠️ Dropped '{}' for {}, channel waits for a full refresh", message.event(), channel);
    }
}
