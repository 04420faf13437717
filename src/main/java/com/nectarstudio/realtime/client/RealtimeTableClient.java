package com.nectarstudio.realtime.client;

import com.nectarstudio.realtime.exception.MalformedMessageException;
import com.nectarstudio.realtime.exception.TransportException;
import com.nectarstudio.realtime.model.dto.RealtimeInfo;
import com.nectarstudio.realtime.model.dto.SnapshotResponse;
import com.nectarstudio.realtime.model.dto.SubscribeRequest;
import com.nectarstudio.realtime.model.dto.SubscriptionConfirmed;
import com.nectarstudio.realtime.model.dto.SubscriptionError;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.model.dto.TableUpdate;
import com.nectarstudio.realtime.model.dto.UnsubscribeRequest;
import com.nectarstudio.realtime.transport.ChannelState;
import com.nectarstudio.realtime.transport.DuplexChannel;
import com.nectarstudio.realtime.transport.MessageTypes;
import com.nectarstudio.realtime.transport.RealtimeMessage;
import com.nectarstudio.realtime.transport.RealtimeMessageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Keeps a local {@link ClientRecordSet} in sync with one server-side list view.
 * <p>
 * {@link #start()} loads the snapshot over HTTP and, when the server offers realtime updates,
 * subscribes on a {@link DuplexChannel}. {@link #refetch()} is the manual fallback and
 * {@link #close()} unsubscribes before closing the connection.
 */
@Slf4j
public class RealtimeTableClient implements AutoCloseable {

    private final RestTemplate restTemplate;
    private final DuplexChannelConnector connector;
    private final RealtimeMessageCodec codec;
    private final String baseUrl;
    private final String serviceName;
    private final String entityName;
    private final RealtimeClientOptions options;
    private final ClientRecordSet records = new ClientRecordSet();

    private volatile Consumer<TableUpdate> updateListener = update -> { };
    private volatile Consumer<String> errorListener = error -> { };

    private volatile DuplexChannel connection;
    private volatile String channelId;
    private volatile ChannelState state;
    private volatile String method;
    private volatile Long effectivePollingInterval;
    private volatile String lastError;

    public RealtimeTableClient(RestTemplate restTemplate, DuplexChannelConnector connector, RealtimeMessageCodec codec,
                               String baseUrl, String serviceName, String entityName, RealtimeClientOptions options) {
        this.restTemplate = restTemplate;
        this.connector = connector;
        this.codec = codec;
        this.baseUrl = baseUrl;
        this.serviceName = serviceName;
        this.entityName = entityName;
        this.options = options;
    }

    public RealtimeTableClient onUpdate(Consumer<TableUpdate> listener) {
        this.updateListener = listener;
        return this;
    }

    public RealtimeTableClient onError(Consumer<String> listener) {
        this.errorListener = listener;
        return this;
    }

    /**
     * Loads the snapshot and subscribes when realtime is enabled on both sides.
     *
     * @throws org.springframework.web.client.RestClientException when the snapshot request fails
     * @throws TransportException                                 when the realtime connection cannot be opened
     */
    public void start() {
        SnapshotResponse response = refetch();
        RealtimeInfo realtime = response.realtime();
        if (!options.isEnabled() || realtime == null || !realtime.enabled()) {
            log.info("Realtime disabled for {}/{}, using snapshot only", serviceName, entityName);
            return;
        }
        subscribe(realtime);
    }

    /**
     * Reloads the snapshot and replaces the local records with it.
     */
    public SnapshotResponse refetch() {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        options.requestHeaders().forEach(headers::set);
        SnapshotResponse response = restTemplate.exchange(snapshotUri(), HttpMethod.GET,
                new HttpEntity<>(headers), SnapshotResponse.class).getBody();
        if (response == null) {
            throw new IllegalStateException("Empty snapshot response for " + serviceName + "/" + entityName);
        }
        records.replaceAll(response.data());
        return response;
    }

    /**
     * Sends {@code unsubscribe_table} and closes the connection.
     */
    @Override
    public void close() {
        DuplexChannel current = connection;
        if (current == null) {
            return;
        }
        if (current.isOpen() && state != null && !state.isTerminal()) {
            try {
                current.send(codec.encode(MessageTypes.UNSUBSCRIBE_TABLE, new UnsubscribeRequest(channelId)));
            } catch (TransportException e) {
                log.debug("Unsubscribe of {} not sent: {}", channelId, e.getMessage());
            }
        }
        if (state == null || !state.isTerminal()) {
            state = ChannelState.UNSUBSCRIBED;
        }
        current.close();
        connection = null;
    }

    public List<Map<String, Object>> records() {
        return records.snapshot();
    }

    public ChannelState state() {
        return state;
    }

    public boolean isConnected() {
        DuplexChannel current = connection;
        return current != null && current.isOpen();
    }

    public String method() {
        return method;
    }

    public Long effectivePollingInterval() {
        return effectivePollingInterval;
    }

    public String lastError() {
        return lastError;
    }

    private void subscribe(RealtimeInfo realtime) {
        channelId = realtime.channelId();
        DuplexChannel opened = connector.connect(URI.create(realtime.socketUrl()), options.requestHeaders());
        connection = opened;
        state = ChannelState.PENDING;
        opened.onMessage(this::handleFrame);
        opened.onClose(() -> {
            if (state != null && !state.isTerminal()) {
                state = ChannelState.DISCONNECTED;
                log.info("🔌 Realtime connection for {} lost", channelId);
            }
        });
        TableFilters filters = options.getFilters() != null ? options.getFilters() : TableFilters.none();
        opened.send(codec.encode(MessageTypes.SUBSCRIBE_TABLE, new SubscribeRequest(serviceName, entityName, channelId,
                filters, options.getPollingInterval(), options.isEnableDatabaseTriggers())));
    }

    void handleFrame(String frame) {
        try {
            RealtimeMessage message = codec.decode(frame);
            switch (message.event()) {
                case MessageTypes.TABLE_UPDATE -> handleUpdate(codec.payload(message, TableUpdate.class));
                case MessageTypes.SUBSCRIPTION_CONFIRMED -> {
                    SubscriptionConfirmed confirmed = codec.payload(message, SubscriptionConfirmed.class);
                    if (isOwnChannel(confirmed.channelId())) {
                        method = confirmed.method();
                        effectivePollingInterval = confirmed.pollingInterval();
                        state = ChannelState.SUBSCRIBED;
                        log.info("✅ Subscribed {} via {} every {} ms", channelId, method, effectivePollingInterval);
                    }
                }
                case MessageTypes.SUBSCRIPTION_ERROR -> {
                    SubscriptionError error = codec.payload(message, SubscriptionError.class);
                    if (isOwnChannel(error.channelId())) {
                        state = ChannelState.FAILED;
                        lastError = error.error();
                        log.warn("❌ Subscription {} failed: {}", channelId, error.error());
                        errorListener.accept(error.error());
                    }
                }
                // transient, the server retries on its next tick
                case MessageTypes.POLLING_ERROR -> log.debug("Server polling error on {}: {}", channelId, message.data());
                default -> log.warn("⚠️ Unknown event '{}' ignored", message.event());
            }
        } catch (MalformedMessageException e) {
            log.warn("⚠️ Dropping malformed frame: {}", e.getMessage());
        }
    }

    private void handleUpdate(TableUpdate update) {
        if (!isOwnChannel(update.channelId())) {
            return;
        }
        records.apply(update);
        updateListener.accept(update);
    }

    private boolean isOwnChannel(String id) {
        return channelId != null && channelId.equals(id);
    }

    private URI snapshotUri() {
        TableFilters filters = options.getFilters() != null ? options.getFilters() : TableFilters.none();
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/api/v2/{serviceName}/_table/{entityName}")
                .queryParam("realtime", options.isEnabled());
        if (filters.page() != null) {
            builder.queryParam("page", filters.page());
        }
        if (filters.fields() != null) {
            builder.queryParam("fields", filters.fields());
        }
        if (filters.sort() != null) {
            builder.queryParam("sort", filters.sort());
        }
        if (filters.filter() != null) {
            builder.queryParam("filter", filters.filter());
        }
        return builder.encode().buildAndExpand(serviceName, entityName).toUri();
    }
}
