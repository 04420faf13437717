package com.nectarstudio.realtime.integration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nectarstudio.realtime.RealtimeSyncApplication;
import com.nectarstudio.realtime.client.RealtimeClientOptions;
import com.nectarstudio.realtime.client.RealtimeTableClient;
import com.nectarstudio.realtime.model.dto.SnapshotResponse;
import com.nectarstudio.realtime.model.dto.SubscribeRequest;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.model.dto.TriggerNotification;
import com.nectarstudio.realtime.polling.AdaptiveScheduler;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.repository.JobCursorRepository;
import com.nectarstudio.realtime.service.EntityCatalog;
import com.nectarstudio.realtime.service.SubscriptionService;
import com.nectarstudio.realtime.transport.ChannelState;
import com.nectarstudio.realtime.transport.InProcessDuplexChannel;
import com.nectarstudio.realtime.transport.MessageTypes;
import com.nectarstudio.realtime.transport.RealtimeMessage;
import com.nectarstudio.realtime.transport.RealtimeMessageCodec;
import com.nectarstudio.realtime.trigger.TriggerEventProcessor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = RealtimeSyncApplication.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("Realtime Sync Integration Tests")
class RealtimeSyncIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @LocalServerPort
    private int port;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private SubscriptionService subscriptionService;

    @Autowired
    private AdaptiveScheduler adaptiveScheduler;

    @Autowired
    private TriggerEventProcessor triggerEventProcessor;

    @Autowired
    private EntityCatalog entityCatalog;

    @Autowired
    private JobCursorRepository jobCursorRepository;

    @Autowired
    private RestTemplateBuilder restTemplateBuilder;

    @Autowired
    private ObjectMapper objectMapper;

    private final AtomicInteger connections = new AtomicInteger();
    private final List<RealtimeTableClient> clients = new ArrayList<>();
    private RestTemplate restTemplate;

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("DROP TABLE IF EXISTS orders");
        jdbcTemplate.execute("DROP TABLE IF EXISTS order_events");
        jdbcTemplate.execute("CREATE TABLE orders (id BIGINT PRIMARY KEY, customer VARCHAR(100), status VARCHAR(20), "
                + "amount DECIMAL(10,2), created_at TIMESTAMP, updated_at TIMESTAMP)");
        jdbcTemplate.execute("CREATE TABLE order_events (id BIGINT PRIMARY KEY, payload VARCHAR(200), "
                + "created_at TIMESTAMP, processed INT, processed_at TIMESTAMP)");
        jobCursorRepository.deleteAll();
        entityCatalog.evictAll();
        restTemplate = restTemplateBuilder.build();

        insertOrder(1, "ACME", "open", 10);
        insertOrder(2, "Globex", "paid", 25);
    }

    @AfterEach
    void tearDown() {
        clients.forEach(RealtimeTableClient::close);
        clients.clear();
    }

    private void insertOrder(long id, String customer, String status, int minutesAgo) {
        jdbcTemplate.update("INSERT INTO orders (id, customer, status, amount, created_at) VALUES (?, ?, ?, ?, ?)",
                id, customer, status, 99.5, utcNowMinus(minutesAgo));
    }

    private void insertEvent(long id, String payload) {
        jdbcTemplate.update("INSERT INTO order_events (id, payload, created_at) VALUES (?, ?, ?)",
                id, payload, utcNowMinus(1));
    }

    // the source clock runs on UTC (timezone offset 0)
    private static Timestamp utcNowMinus(int minutes) {
        return Timestamp.valueOf(LocalDateTime.now(ZoneOffset.UTC).minusMinutes(minutes));
    }

    private String baseUrl() {
        return "http://localhost:" + port;
    }

    /**
     * Client wired to the server through an in-process connection instead of a socket.
     */
    private RealtimeTableClient client(String entityName, RealtimeClientOptions options) {
        RealtimeTableClient client = new RealtimeTableClient(restTemplate, (uri, headers) -> {
            InProcessDuplexChannel[] pair = InProcessDuplexChannel.pair("it-" + connections.incrementAndGet());
            subscriptionService.accept(pair[0]);
            return pair[1];
        }, RealtimeMessageCodec.standalone(), baseUrl(), "shop", entityName, options);
        clients.add(client);
        return client;
    }

    private PollingJob onlyJob() {
        List<PollingJob> jobs = subscriptionService.activeJobs();
        assertThat(jobs).hasSize(1);
        return jobs.get(0);
    }

    private static List<Long> ids(List<Map<String, Object>> records) {
        return records.stream().map(r -> ((Number) r.get("id")).longValue()).toList();
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + TIMEOUT);
            }
            Thread.sleep(20);
        }
    }

    @Nested
    @DisplayName("Snapshot Endpoint Tests")
    class SnapshotEndpointTests {

        @Test
        @DisplayName("Should return rows, total and realtime info")
        void shouldReturnSnapshot() {
            SnapshotResponse response = restTemplate.getForObject(
                    baseUrl() + "/api/v2/shop/_table/orders?realtime=true&sort=id desc", SnapshotResponse.class);

            assertThat(response).isNotNull();
            assertThat(ids(response.data())).containsExactly(2L, 1L);
            assertThat(response.total()).isEqualTo(2L);
            assertThat(response.realtime().enabled()).isTrue();
            assertThat(response.realtime().channelId()).isEqualTo("shop_orders");
        }

        @Test
        @DisplayName("Should apply filters and omit realtime info unless asked")
        void shouldFilterSnapshot() {
            SnapshotResponse response = restTemplate.getForObject(
                    baseUrl() + "/api/v2/shop/_table/orders?filter={filter}&fields=id,status",
                    SnapshotResponse.class, "status = 'paid'");

            assertThat(response).isNotNull();
            assertThat(response.data()).singleElement()
                    .satisfies(row -> assertThat(row).containsOnlyKeys("id", "status"));
            assertThat(response.realtime()).isNull();
        }

        @Test
        @DisplayName("Should answer 400 for an entity the service does not expose")
        void shouldRejectUnknownEntity() {
            assertThatThrownBy(() -> restTemplate.getForObject(baseUrl() + "/api/v2/shop/_table/secrets",
                    SnapshotResponse.class))
                    .isInstanceOf(HttpClientErrorException.BadRequest.class);
        }
    }

    @Nested
    @DisplayName("Polling Flow Tests")
    class PollingFlowTests {

        @Test
        @DisplayName("Should push a refresh to a subscribed client after a new row appears")
        void shouldDeliverPolledChanges() throws InterruptedException {
            // Given
            RealtimeTableClient client = client("orders", new RealtimeClientOptions());
            client.start();
            waitUntil(() -> client.state() == ChannelState.SUBSCRIBED);
            assertThat(client.method()).isEqualTo("polling");
            assertThat(client.effectivePollingInterval()).isEqualTo(60000L);
            PollingJob job = onlyJob();

            // When
            insertOrder(3, "Initech", "open", 0);
            adaptiveScheduler.tick(job);

            // Then
            waitUntil(() -> client.records().size() == 3);
            assertThat(ids(client.records())).containsExactly(1L, 2L, 3L);
            assertThat(job.getTotalChanges()).isEqualTo(3);
            assertThat(jobCursorRepository.findById(job.getKey().canonical()))
                    .hasValueSatisfying(cursor -> assertThat(cursor.getCursorValue()).isEqualTo(job.getCursor()));
        }

        @Test
        @DisplayName("Should share one job between clients and stop it with the last one")
        void shouldShareAndReleaseJob() throws InterruptedException {
            // Given
            RealtimeTableClient first = client("orders", new RealtimeClientOptions());
            RealtimeTableClient second = client("orders", new RealtimeClientOptions());
            first.start();
            second.start();
            waitUntil(() -> first.state() == ChannelState.SUBSCRIBED && second.state() == ChannelState.SUBSCRIBED);
            PollingJob job = onlyJob();

            // When
            first.close();

            // Then
            assertThat(subscriptionService.activeJobs()).containsExactly(job);

            // When
            second.close();

            // Then
            assertThat(subscriptionService.activeJobs()).isEmpty();
            assertThat(job.isCancelled()).isTrue();
        }

        @Test
        @DisplayName("Should answer subscription_error for an unknown filter column")
        void shouldRejectInvalidSubscription() throws InterruptedException {
            // Given
            RealtimeMessageCodec codec = RealtimeMessageCodec.standalone();
            InProcessDuplexChannel[] pair = InProcessDuplexChannel.pair("it-raw");
            List<RealtimeMessage> received = new CopyOnWriteArrayList<>();
            pair[1].onMessage(frame -> received.add(codec.decode(frame)));
            subscriptionService.accept(pair[0]);

            // When
            pair[1].send(codec.encode(MessageTypes.SUBSCRIBE_TABLE, new SubscribeRequest("shop", "orders", "bad",
                    new TableFilters(null, null, null, "secret = 1"), null, null)));

            // Then
            waitUntil(() -> !received.isEmpty());
            assertThat(received.get(0).event()).isEqualTo(MessageTypes.SUBSCRIPTION_ERROR);
            assertThat(received.get(0).data().get("error").asText()).contains("secret");
            assertThat(subscriptionService.activeJobs()).isEmpty();
            pair[1].close();
        }

        @Test
        @DisplayName("Should mark CDC rows processed in batches")
        void shouldDrainProcessedMarkerTable() throws InterruptedException {
            // Given
            RealtimeTableClient client = client("order_events", new RealtimeClientOptions());
            client.start();
            waitUntil(() -> client.state() == ChannelState.SUBSCRIBED);
            PollingJob job = onlyJob();
            insertEvent(1, "a");
            insertEvent(2, "b");
            insertEvent(3, "c");

            // When
            adaptiveScheduler.tick(job);

            // Then
            assertThat(processedCount()).isEqualTo(2);

            // When
            adaptiveScheduler.tick(job);

            // Then
            assertThat(processedCount()).isEqualTo(3);
            waitUntil(() -> client.records().size() == 3);
        }

        @Test
        @DisplayName("Should refresh every filtered view of a CDC table from the poll that consumed the rows")
        void shouldRefreshAllViewsOfProcessedMarkerTable() throws InterruptedException {
            // Given
            RealtimeClientOptions onlyA = new RealtimeClientOptions();
            onlyA.setFilters(new TableFilters(null, null, null, "payload = 'a'"));
            RealtimeTableClient filtered = client("order_events", onlyA);
            RealtimeTableClient all = client("order_events", new RealtimeClientOptions());
            filtered.start();
            all.start();
            waitUntil(() -> filtered.state() == ChannelState.SUBSCRIBED && all.state() == ChannelState.SUBSCRIBED);
            List<PollingJob> jobs = subscriptionService.activeJobs();
            assertThat(jobs).hasSize(2);
            PollingJob filteredJob = jobs.stream().filter(j -> j.getKey().filter() != null).findFirst().orElseThrow();
            PollingJob allJob = jobs.stream().filter(j -> j.getKey().filter() == null).findFirst().orElseThrow();
            insertEvent(1, "a");

            // When
            adaptiveScheduler.tick(filteredJob);
            adaptiveScheduler.tick(allJob);

            // Then
            assertThat(processedCount()).isEqualTo(1);
            waitUntil(() -> all.records().size() == 1 && filtered.records().size() == 1);
            assertThat(ids(all.records())).containsExactly(1L);
            assertThat(ids(filtered.records())).containsExactly(1L);
        }

        @Test
        @DisplayName("Should push a refresh when a row is deleted without any new row")
        void shouldRefreshAfterDelete() throws InterruptedException {
            // Given
            RealtimeTableClient client = client("orders", new RealtimeClientOptions());
            client.start();
            waitUntil(() -> client.state() == ChannelState.SUBSCRIBED && client.records().size() == 2);
            PollingJob job = onlyJob();
            adaptiveScheduler.tick(job);
            assertThat(job.getTotalChanges()).isEqualTo(2);

            // When
            jdbcTemplate.update("DELETE FROM orders WHERE id = ?", 2L);
            adaptiveScheduler.tick(job);

            // Then
            waitUntil(() -> client.records().size() == 1);
            assertThat(ids(client.records())).containsExactly(1L);
            assertThat(job.getTotalChanges()).isEqualTo(2);
        }

        private Integer processedCount() {
            return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM order_events WHERE processed = 1", Integer.class);
        }
    }

    @Nested
    @DisplayName("Trigger Flow Tests")
    class TriggerFlowTests {

        @Test
        @DisplayName("Should apply a trigger insert on clients that enabled triggers")
        void shouldDeliverTriggerInsert() throws IOException, InterruptedException {
            // Given
            RealtimeClientOptions options = new RealtimeClientOptions();
            options.setEnableDatabaseTriggers(true);
            RealtimeTableClient client = client("orders", options);
            client.start();
            waitUntil(() -> client.state() == ChannelState.SUBSCRIBED);
            assertThat(client.method()).isEqualTo("database_triggers");
            TriggerNotification notification = objectMapper.readValue(
                    new ClassPathResource("triggers/order-insert.json").getInputStream(), TriggerNotification.class);

            // When
            int delivered = triggerEventProcessor.process(notification);

            // Then
            assertThat(delivered).isEqualTo(1);
            waitUntil(() -> client.records().size() == 3);
            assertThat(ids(client.records())).containsExactly(1L, 2L, 42L);
        }
    }
}
