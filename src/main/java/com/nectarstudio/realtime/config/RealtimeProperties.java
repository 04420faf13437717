package com.nectarstudio.realtime.config;

import com.nectarstudio.realtime.model.domain.CleanupStrategyType;
import com.nectarstudio.realtime.model.domain.TriggerMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "app.realtime")
public class RealtimeProperties {

    private String socketPath = "/realtime";
    private String socketUrl = "ws://localhost:8080/realtime";

    private long defaultPollingInterval = 5000;
    private int pageSize = 100;
    private int outboxCapacity = 256;
    private int schedulerPoolSize = 8;
    private int deliveryPoolSize = 4;
    private int sendTimeLimitMs = 10000;
    private int sendBufferLimitBytes = 512 * 1024;
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    // Cursor start for a job that has never delivered anything
    private Duration initialLookback = Duration.ofMinutes(1);

    private Intervals intervals = new Intervals();
    private Policy policy = new Policy();
    private Batch batch = new Batch();

    private List<String> timestampColumnPatterns = new ArrayList<>(List.of(
            "dateAdded", "dateLstMod", "created_at", "created_date", "updated_at", "updated_date",
            "modified_at", "modified_date", "timestamp", "CreatedAt", "CreatedDate", "UpdatedAt",
            "UpdatedDate", "ModifiedDate", "DateCreated", "DateModified", "DateUpdated", "created",
            "create_time", "update_time", "modify_time", "insert_date", "change_date"));

    /** serviceName -> service definition */
    private Map<String, ServiceDefinition> services = new LinkedHashMap<>();

    @Data
    public static class Intervals {
        private long min = 5000;
        private long base = 30000;
        private long max = 300000;
    }

    @Data
    public static class Policy {
        private double shrinkFactor = 0.5;
        private double growthFactor = 1.5;
        private int emptyPollThreshold = 3;
        private boolean drainOnFullBatch = true;
    }

    @Data
    public static class Batch {
        private int standardSize = 100;
        private int cdcSize = 5000;
    }

    @Data
    public static class ServiceDefinition {
        // Entities not listed under tables are accepted when the table exists in the source
        private boolean autoDiscover = true;
        private Map<String, TableDefinition> tables = new LinkedHashMap<>();
    }

    @Data
    public static class TableDefinition {
        private String table;
        private TriggerMode triggerMode = TriggerMode.NEW_ROW;
        private String dateColumn;
        private String monitorColumn;
        private String keyColumn = "id";
        private int timezoneOffsetMinutes;
        private boolean cdcMode;
        private Integer batchSize;
        private CleanupStrategyType cleanupStrategy = CleanupStrategyType.TIME_BASED;
        private Long minInterval;
        private Long baseInterval;
        private Long maxInterval;
    }
}
