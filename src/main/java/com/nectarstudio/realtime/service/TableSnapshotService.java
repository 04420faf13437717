package com.nectarstudio.realtime.service;

import com.nectarstudio.realtime.config.RealtimeProperties;
import com.nectarstudio.realtime.detection.TableDescriptor;
import com.nectarstudio.realtime.model.dto.RealtimeInfo;
import com.nectarstudio.realtime.model.dto.SnapshotResponse;
import com.nectarstudio.realtime.model.dto.TableFilters;
import com.nectarstudio.realtime.polling.PollingJob;
import com.nectarstudio.realtime.source.ListQuery;
import com.nectarstudio.realtime.source.TableRowSource;
import com.nectarstudio.realtime.transport.MessageTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reads the current contents of a list view: for the initial HTTP fetch and for every
 * {@code polling_refresh} push.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableSnapshotService {

    public record SnapshotPage(List<Map<String, Object>> rows, long total) { }

    private final EntityCatalog entityCatalog;
    private final TableRowSource tableRowSource;
    private final RealtimeProperties properties;

    public SnapshotPage snapshot(PollingJob job) {
        return read(job.getTable(), job.getListQuery());
    }

    public SnapshotResponse fetch(String serviceName, String entityName, TableFilters filters, boolean includeRealtime) {
        TableDescriptor table = entityCatalog.resolve(serviceName, entityName);
        ListQuery query = ListQuery.compile(filters != null ? filters : TableFilters.none(), table.columns(),
                properties.getPageSize());
        SnapshotPage page = read(table, query);
        log.debug("📄 Snapshot {}/{}: {} of {} rows", serviceName, entityName, page.rows().size(), page.total());
        return new SnapshotResponse(page.rows(), page.total(),
                includeRealtime ? realtimeInfo(table.serviceName(), table.entityName()) : null);
    }

    public RealtimeInfo realtimeInfo(String serviceName, String entityName) {
        return new RealtimeInfo(true, properties.getSocketUrl(), serviceName + "_" + entityName,
                List.of(MessageTypes.METHOD_POLLING, MessageTypes.METHOD_DATABASE_TRIGGERS),
                MessageTypes.METHOD_POLLING);
    }

    private SnapshotPage read(TableDescriptor table, ListQuery query) {
        String orderBy = query.orderBy() != null ? query.orderBy() : defaultOrder(table);
        List<Map<String, Object>> rows = tableRowSource.queryPage(table.table(), query.fields(), query.where(),
                orderBy, query.offset(), query.limit());
        long total = tableRowSource.countRows(table.table(), query.where());
        return new SnapshotPage(rows, total);
    }

    // Stable paging needs some order; the key column when the table has one
    private static String defaultOrder(TableDescriptor table) {
        return table.columns().contains(table.keyColumn()) ? table.keyColumn() + " ASC" : null;
    }
}
