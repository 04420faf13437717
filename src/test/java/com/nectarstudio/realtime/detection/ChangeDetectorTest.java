package com.nectarstudio.realtime.detection;

import com.nectarstudio.realtime.detection.cleanup.ProcessedMarkerCleanup;
import com.nectarstudio.realtime.detection.cleanup.TimeBasedCleanup;
import com.nectarstudio.realtime.helper.TestFixtures;
import com.nectarstudio.realtime.model.domain.ChangeEvent;
import com.nectarstudio.realtime.model.domain.ChangeOperation;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.source.RowPredicate;
import com.nectarstudio.realtime.source.TableRowSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.nectarstudio.realtime.helper.TestFixtures.ORDER_COLUMNS;
import static com.nectarstudio.realtime.helper.TestFixtures.T0;
import static com.nectarstudio.realtime.helper.TestFixtures.row;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeDetector Tests")
class ChangeDetectorTest {

    private static final Instant NOW = T0.plusSeconds(600);

    @Mock
    private TableRowSource tableRowSource;

    @Mock
    private CursorTracker cursorTracker;

    private ChangeDetector changeDetector;
    private TimeBasedCleanup timeBased;
    private ProcessedMarkerCleanup processedMarker;

    @BeforeEach
    void setUp() {
        timeBased = new TimeBasedCleanup();
        processedMarker = new ProcessedMarkerCleanup(tableRowSource);
        changeDetector = new ChangeDetector(tableRowSource, cursorTracker, Clock.fixed(NOW, ZoneOffset.UTC),
                List.of(timeBased, processedMarker));
    }

    private static Timestamp at(int hour, int minute) {
        return Timestamp.valueOf(LocalDateTime.of(2025, 3, 1, hour, minute));
    }

    private RowPredicate capturePredicate(String table) {
        ArgumentCaptor<RowPredicate> predicate = ArgumentCaptor.forClass(RowPredicate.class);
        verify(tableRowSource).queryRows(eq(table), predicate.capture(), anyString(), anyInt());
        return predicate.getValue();
    }

    @Nested
    @DisplayName("Detection Tests")
    class DetectionTests {

        @Test
        @DisplayName("Should report new rows as INSERTs ordered by the date column")
        void shouldDetectNewRows() {
            // Given
            PollingJob job = TestFixtures.ordersJob();
            when(tableRowSource.queryRows(eq("orders"), any(), eq("created_at ASC"), eq(100)))
                    .thenReturn(List.of(row(1, "created_at", at(12, 1)), row(2, "created_at", at(12, 3))));

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            assertThat(result.events()).extracting(ChangeEvent::operation)
                    .containsOnly(ChangeOperation.INSERT);
            assertThat(result.events()).extracting(ChangeEvent::detectedAt).containsOnly(NOW);
            assertThat(result.candidateCursor()).isEqualTo(Instant.parse("2025-03-01T12:03:00Z"));

            RowPredicate predicate = capturePredicate("orders");
            assertThat(predicate.sql()).isEqualTo("created_at > :cursor");
            assertThat(predicate.params()).containsEntry("cursor", at(12, 0));
        }

        @Test
        @DisplayName("Should report monitored rows as UPDATEs in updated-row mode")
        void shouldDetectUpdatedRows() {
            // Given
            TableDescriptor table = new TableDescriptor("shop", "orders", "orders", TriggerMode.UPDATED_ROW,
                    "updated_at", "id", 0, false, 100, CleanupStrategyType.TIME_BASED, 5000, 30000, 300000, ORDER_COLUMNS);
            PollingJob job = TestFixtures.job(table, TableFilters.none(), timeBased);
            when(tableRowSource.queryRows(eq("orders"), any(), eq("updated_at ASC"), eq(100)))
                    .thenReturn(List.of(row(5, "updated_at", at(12, 30))));

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            assertThat(result.events()).singleElement()
                    .extracting(ChangeEvent::operation).isEqualTo(ChangeOperation.UPDATE);
            assertThat(capturePredicate("orders").sql()).isEqualTo("updated_at > :cursor");
        }

        @Test
        @DisplayName("Should translate between the source clock and UTC")
        void shouldApplyTimezoneOffset() {
            // Given: source clock runs five hours behind UTC
            TableDescriptor table = new TableDescriptor("shop", "orders", "orders", TriggerMode.NEW_ROW,
                    "created_at", "id", -300, false, 100, CleanupStrategyType.TIME_BASED, 5000, 30000, 300000, ORDER_COLUMNS);
            PollingJob job = TestFixtures.job(table, TableFilters.none(), timeBased);
            when(tableRowSource.queryRows(eq("orders"), any(), anyString(), anyInt()))
                    .thenReturn(List.of(row(1, "created_at", at(7, 5))));

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            assertThat(capturePredicate("orders").params()).containsEntry("cursor", at(7, 0));
            assertThat(result.candidateCursor()).isEqualTo(Instant.parse("2025-03-01T12:05:00Z"));
            assertThat(result.events().get(0).sourceCursorValue()).isEqualTo(Instant.parse("2025-03-01T12:05:00Z"));
        }

        @Test
        @DisplayName("Should combine the cursor predicate with the job filter")
        void shouldApplyJobFilter() {
            // Given
            PollingJob job = TestFixtures.job(TestFixtures.ordersTable(),
                    new TableFilters(null, null, null, "status = 'open'"), timeBased);
            when(tableRowSource.queryRows(eq("orders"), any(), anyString(), anyInt())).thenReturn(List.of());

            // When
            changeDetector.detect(job);

            // Then
            RowPredicate predicate = capturePredicate("orders");
            assertThat(predicate.sql()).isEqualTo("(created_at > :cursor) AND (status = :f0)");
            assertThat(predicate.params()).containsEntry("f0", "open");
        }

        @Test
        @DisplayName("Should return an empty result when nothing changed")
        void shouldReturnEmptyResult() {
            // Given
            PollingJob job = TestFixtures.ordersJob();
            when(tableRowSource.queryRows(eq("orders"), any(), anyString(), anyInt())).thenReturn(List.of());

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.candidateCursor()).isNull();
        }

        @Test
        @DisplayName("Should select unprocessed rows regardless of the cursor in CDC mode")
        void shouldSelectUnprocessedRows() {
            // Given
            PollingJob job = TestFixtures.job(TestFixtures.cdcTable(5000), TableFilters.none(), processedMarker);
            when(tableRowSource.queryRows(eq("order_events"), any(), eq("created_at ASC"), eq(5000)))
                    .thenReturn(List.of(row(9, "created_at", at(9, 0))));

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            RowPredicate predicate = capturePredicate("order_events");
            assertThat(predicate.sql()).isEqualTo("processed IS NULL OR processed = 0");
            assertThat(predicate.params()).isEmpty();
            assertThat(result.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should ignore the view filter when the processed flag is shared by the table")
        void shouldSelectAcrossViewsInCdcMode() {
            // Given
            PollingJob job = TestFixtures.job(TestFixtures.cdcTable(5000),
                    new TableFilters(null, null, null, "payload = 'a'"), processedMarker);
            when(tableRowSource.queryRows(eq("order_events"), any(), eq("created_at ASC"), eq(5000)))
                    .thenReturn(List.of(row(1, "payload", "b", "created_at", at(9, 0))));

            // When
            DetectionResult result = changeDetector.detect(job);

            // Then
            RowPredicate predicate = capturePredicate("order_events");
            assertThat(predicate.sql()).isEqualTo("processed IS NULL OR processed = 0");
            assertThat(predicate.params()).doesNotContainKey("f0");
            assertThat(result.rows()).extracting("payload").containsExactly("b");
        }
    }

    @Nested
    @DisplayName("Commit Tests")
    class CommitTests {

        @Test
        @DisplayName("Should advance the cursor after a time-based batch")
        void shouldAdvanceCursor() {
            // Given
            PollingJob job = TestFixtures.ordersJob();
            Instant candidate = Instant.parse("2025-03-01T12:03:00Z");
            DetectionResult result = new DetectionResult(
                    List.of(new ChangeEvent(ChangeOperation.INSERT, row(1), candidate, NOW)), candidate);

            // When
            changeDetector.commit(job, result);

            // Then
            verify(cursorTracker).advance(job, candidate);
            verify(tableRowSource, never()).markProcessed(anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Should mark rows processed before advancing the cursor")
        void shouldMarkProcessedThenAdvance() {
            // Given
            PollingJob job = TestFixtures.job(TestFixtures.cdcTable(5000), TableFilters.none(), processedMarker);
            Instant candidate = Instant.parse("2025-03-01T09:00:00Z");
            DetectionResult result = new DetectionResult(List.of(
                    new ChangeEvent(ChangeOperation.INSERT, row(1), candidate, NOW),
                    new ChangeEvent(ChangeOperation.INSERT, row(2), candidate, NOW)), candidate);

            // When
            changeDetector.commit(job, result);

            // Then
            InOrder inOrder = inOrder(tableRowSource, cursorTracker);
            inOrder.verify(tableRowSource).markProcessed("order_events", "id", List.of(1, 2));
            inOrder.verify(cursorTracker).advance(job, candidate);
        }

        @Test
        @DisplayName("Should do nothing for an empty batch")
        void shouldIgnoreEmptyBatch() {
            // When
            changeDetector.commit(TestFixtures.ordersJob(), DetectionResult.empty());

            // Then
            verifyNoInteractions(cursorTracker, tableRowSource);
        }
    }

    @Test
    @DisplayName("Should fail for a cleanup strategy without implementation")
    void shouldRejectMissingStrategy() {
        ChangeDetector withoutMarker = new ChangeDetector(tableRowSource, cursorTracker, Clock.systemUTC(),
                List.of(timeBased));

        assertThatThrownBy(() -> withoutMarker.strategyFor(CleanupStrategyType.PROCESSED_MARKER))
                .isInstanceOf(IllegalStateException.class);
        assertThat(withoutMarker.strategyFor(CleanupStrategyType.TIME_BASED)).isSameAs(timeBased);
    }

    @Test
    @DisplayName("Rows should be passed through untouched")
    void shouldKeepRowPayload() {
        PollingJob job = TestFixtures.ordersJob();
        Map<String, Object> source = row(3, "customer", "ACME", "created_at", at(12, 10));
        when(tableRowSource.queryRows(eq("orders"), any(), anyString(), anyInt())).thenReturn(List.of(source));

        DetectionResult result = changeDetector.detect(job);

        assertThat(result.rows()).containsExactly(source);
    }
}
