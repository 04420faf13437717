package com.nectarstudio.realtime.service;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.config.RealtimeProperties.ServiceDefinition;
import com.nectarstudio.realtime.config.RealtimeProperties.TableDefinition;
import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.detection.TimestampColumnResolver;
import com.nectarstudio.realtime.exception.SubscriptionConfigurationException;
import com.nectarstudio.realtime.helper.TestFixtures;
import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;
import com.nectarstudio.realtime.source.ColumnInfo;
import com.nectarstudio.realtime.source.TableRowSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Types;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("EntityCatalog Tests")
class EntityCatalogTest {

    private static final List<ColumnInfo> ORDER_COLUMNS = List.of(
            new ColumnInfo("id", Types.BIGINT, "BIGINT"),
            new ColumnInfo("status", Types.VARCHAR, "VARCHAR"),
            new ColumnInfo("created_at", Types.TIMESTAMP, "TIMESTAMP"),
            new ColumnInfo("updated_at", Types.TIMESTAMP, "TIMESTAMP"));

    private static final List<ColumnInfo> EVENT_COLUMNS = List.of(
            new ColumnInfo("id", Types.BIGINT, "BIGINT"),
            new ColumnInfo("created_at", Types.TIMESTAMP, "TIMESTAMP"),
            new ColumnInfo("processed", Types.INTEGER, "INTEGER"));

    @Mock
    private TableRowSource tableRowSource;

    private RealtimeProperties properties;
    private ServiceDefinition shop;
    private EntityCatalog entityCatalog;

    @BeforeEach
    void setUp() {
        properties = TestFixtures.properties();
        shop = new ServiceDefinition();
        properties.getServices().put("shop", shop);
        entityCatalog = new EntityCatalog(properties, tableRowSource, new TimestampColumnResolver(properties));
    }

    @Nested
    @DisplayName("Resolution Tests")
    class ResolutionTests {

        @Test
        @DisplayName("Should auto-discover an unlisted table with defaults")
        void shouldAutoDiscover() {
            // Given
            when(tableRowSource.describeColumns("orders")).thenReturn(ORDER_COLUMNS);

            // When
            TableDescriptor table = entityCatalog.resolve("Shop", "orders");

            // Then
            assertThat(table.table()).isEqualTo("orders");
            assertThat(table.triggerMode()).isEqualTo(TriggerMode.NEW_ROW);
            assertThat(table.watermarkColumn()).isEqualTo("created_at");
            assertThat(table.batchSize()).isEqualTo(100);
            assertThat(table.baseInterval()).isEqualTo(30000);
            assertThat(table.columns()).contains("status");
        }

        @Test
        @DisplayName("Should apply a configured table definition")
        void shouldUseDefinition() {
            // Given
            TableDefinition definition = new TableDefinition();
            definition.setTable("orders");
            definition.setTriggerMode(TriggerMode.UPDATED_ROW);
            definition.setMonitorColumn("updated_at");
            definition.setTimezoneOffsetMinutes(-300);
            definition.setMinInterval(1000L);
            definition.setBaseInterval(2000L);
            shop.getTables().put("sales", definition);
            when(tableRowSource.describeColumns("orders")).thenReturn(ORDER_COLUMNS);

            // When
            TableDescriptor table = entityCatalog.resolve("shop", "sales");

            // Then
            assertThat(table.entityName()).isEqualTo("sales");
            assertThat(table.watermarkColumn()).isEqualTo("updated_at");
            assertThat(table.timezoneOffsetMinutes()).isEqualTo(-300);
            assertThat(table.minInterval()).isEqualTo(1000);
            assertThat(table.baseInterval()).isEqualTo(2000);
            assertThat(table.maxInterval()).isEqualTo(300000);
        }

        @Test
        @DisplayName("Should use the CDC batch size and processed-marker cleanup in CDC mode")
        void shouldResolveCdcTable() {
            // Given
            TableDefinition definition = new TableDefinition();
            definition.setCdcMode(true);
            definition.setCleanupStrategy(CleanupStrategyType.PROCESSED_MARKER);
            shop.getTables().put("order_events", definition);
            when(tableRowSource.describeColumns("order_events")).thenReturn(EVENT_COLUMNS);

            // When
            TableDescriptor table = entityCatalog.resolve("shop", "order_events");

            // Then
            assertThat(table.cdcMode()).isTrue();
            assertThat(table.batchSize()).isEqualTo(5000);
            assertThat(table.cleanupStrategy()).isEqualTo(CleanupStrategyType.PROCESSED_MARKER);
        }

        @Test
        @DisplayName("Should fall back to time-based cleanup outside CDC mode")
        void shouldDowngradeProcessedMarker() {
            TableDefinition definition = new TableDefinition();
            definition.setCleanupStrategy(CleanupStrategyType.PROCESSED_MARKER);
            shop.getTables().put("order_events", definition);
            when(tableRowSource.describeColumns("order_events")).thenReturn(EVENT_COLUMNS);

            assertThat(entityCatalog.resolve("shop", "order_events").cleanupStrategy())
                    .isEqualTo(CleanupStrategyType.TIME_BASED);
        }

        @Test
        @DisplayName("Should cache resolved tables until evicted")
        void shouldCache() {
            // Given
            when(tableRowSource.describeColumns("orders")).thenReturn(ORDER_COLUMNS);

            // When
            TableDescriptor first = entityCatalog.resolve("shop", "orders");
            TableDescriptor second = entityCatalog.resolve("SHOP", "Orders");
            entityCatalog.evictAll();
            entityCatalog.resolve("shop", "orders");

            // Then
            assertThat(second).isSameAs(first);
            verify(tableRowSource, times(2)).describeColumns("orders");
        }
    }

    @Nested
    @DisplayName("Rejection Tests")
    class RejectionTests {

        @Test
        @DisplayName("Should reject an unknown service")
        void shouldRejectUnknownService() {
            assertThatThrownBy(() -> entityCatalog.resolve("billing", "orders"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("billing");
            verifyNoInteractions(tableRowSource);
        }

        @Test
        @DisplayName("Should reject unlisted entities when auto-discovery is off")
        void shouldRejectUnlistedEntity() {
            shop.setAutoDiscover(false);

            assertThatThrownBy(() -> entityCatalog.resolve("shop", "orders"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("not exposed");
        }

        @Test
        @DisplayName("Should reject table names that are not plain identifiers")
        void shouldRejectInvalidTableName() {
            assertThatThrownBy(() -> entityCatalog.resolve("shop", "orders; drop table orders"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("Invalid table name");
            verify(tableRowSource, never()).describeColumns(anyString());
        }

        @Test
        @DisplayName("Should reject a missing table")
        void shouldRejectMissingTable() {
            when(tableRowSource.describeColumns("refunds")).thenReturn(List.of());

            assertThatThrownBy(() -> entityCatalog.resolve("shop", "refunds"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("Should reject processed-marker cleanup without a processed column")
        void shouldRequireProcessedColumn() {
            TableDefinition definition = new TableDefinition();
            definition.setCdcMode(true);
            definition.setCleanupStrategy(CleanupStrategyType.PROCESSED_MARKER);
            shop.getTables().put("orders", definition);
            when(tableRowSource.describeColumns("orders")).thenReturn(ORDER_COLUMNS);

            assertThatThrownBy(() -> entityCatalog.resolve("shop", "orders"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("processed");
        }

        @Test
        @DisplayName("Should reject inconsistent interval bounds")
        void shouldRejectBadIntervals() {
            TableDefinition definition = new TableDefinition();
            definition.setMinInterval(60000L);
            definition.setMaxInterval(1000L);
            shop.getTables().put("orders", definition);
            when(tableRowSource.describeColumns("orders")).thenReturn(ORDER_COLUMNS);

            assertThatThrownBy(() -> entityCatalog.resolve("shop", "orders"))
                    .isInstanceOf(SubscriptionConfigurationException.class)
                    .hasMessageContaining("Interval bounds");
        }
    }
}
