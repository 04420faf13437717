package com.nectarstudio.realtime.source;

import com.nectarstudio.realtime.exception.TransientSourceException;
import com.nectarstudio.realtime.util.SqlIdentifiers;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link TableRowSource} over Spring JDBC. Every call goes through a per-table circuit breaker
 * so a failing source fails fast instead of tying up scheduler threads.
 * Uses ANSI {@code OFFSET ... FETCH} paging, understood by H2, PostgreSQL, SQL Server and Oracle.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcTableRowSource implements TableRowSource {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Clock clock;

    @Override
    public List<Map<String, Object>> queryRows(String table, RowPredicate predicate, String orderBy, int limit) {
        String sql = "SELECT * FROM " + SqlIdentifiers.requireTable(table)
                + " WHERE " + predicate.sql()
                + orderClause(orderBy)
                + " OFFSET 0 ROWS FETCH NEXT " + Math.max(1, limit) + " ROWS ONLY";
        return protect(table, () -> {
            log.debug("Polling {}: {}", table, sql);
            return jdbcTemplate.queryForList(sql, new MapSqlParameterSource(predicate.params()));
        });
    }

    @Override
    public List<Map<String, Object>> queryPage(String table, List<String> fields, RowPredicate predicate,
                                               String orderBy, int offset, int limit) {
        String projection = fields == null || fields.isEmpty()
                ? "*"
                : String.join(", ", fields.stream().map(SqlIdentifiers::requireColumn).toList());
        String sql = "SELECT " + projection + " FROM " + SqlIdentifiers.requireTable(table)
                + " WHERE " + predicate.sql()
                + orderClause(orderBy)
                + " OFFSET " + Math.max(0, offset) + " ROWS FETCH NEXT " + Math.max(1, limit) + " ROWS ONLY";
        return protect(table, () -> jdbcTemplate.queryForList(sql, new MapSqlParameterSource(predicate.params())));
    }

    @Override
    public long countRows(String table, RowPredicate predicate) {
        String sql = "SELECT COUNT(*) FROM " + SqlIdentifiers.requireTable(table) + " WHERE " + predicate.sql();
        return protect(table, () -> {
            Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(predicate.params()), Long.class);
            return count != null ? count : 0L;
        });
    }

    @Override
    public int markProcessed(String table, String keyColumn, Collection<?> rowIds) {
        if (rowIds == null || rowIds.isEmpty()) {
            return 0;
        }
        String sql = "UPDATE " + SqlIdentifiers.requireTable(table)
                + " SET processed = 1, processed_at = :processedAt"
                + " WHERE " + SqlIdentifiers.requireColumn(keyColumn) + " IN (:ids)";
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("processedAt", Timestamp.from(clock.instant()))
                .addValue("ids", new ArrayList<>(rowIds));
        int updated = protect(table, () -> jdbcTemplate.update(sql, params));
        log.info("Marked {} rows as processed in {}", updated, table);
        return updated;
    }

    @Override
    public List<ColumnInfo> describeColumns(String table) {
        SqlIdentifiers.requireTable(table);
        String schema = SqlIdentifiers.schemaName(table);
        String name = SqlIdentifiers.simpleName(table);
        return protect(table, () -> jdbcTemplate.getJdbcTemplate().execute((ConnectionCallback<List<ColumnInfo>>) con -> {
            // Catalogs store identifiers in different cases; try as given, then upper, then lower
            Set<String> candidates = new LinkedHashSet<>(List.of(
                    name, name.toUpperCase(Locale.ROOT), name.toLowerCase(Locale.ROOT)));
            for (String candidate : candidates) {
                List<ColumnInfo> columns = readColumns(con, schema, candidate);
                if (!columns.isEmpty()) {
                    return columns;
                }
            }
            return List.of();
        }));
    }

    private List<ColumnInfo> readColumns(Connection con, String schema, String tableName) throws SQLException {
        DatabaseMetaData metaData = con.getMetaData();
        List<ColumnInfo> columns = new ArrayList<>();
        try (ResultSet rs = metaData.getColumns(con.getCatalog(), schema, tableName, null)) {
            while (rs.next()) {
                columns.add(new ColumnInfo(rs.getString("COLUMN_NAME"), rs.getInt("DATA_TYPE"), rs.getString("TYPE_NAME")));
            }
        }
        return columns;
    }

    private String orderClause(String orderBy) {
        return orderBy == null || orderBy.isBlank() ? "" : " ORDER BY " + orderBy;
    }

    private <T> T protect(String table, Supplier<T> query) {
        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker("source-" + table);
        try {
            return breaker.executeSupplier(query);
        } catch (CallNotPermittedException e) {
            throw new TransientSourceException("Source " + table + " is unavailable, circuit open", e);
        } catch (DataAccessException e) {
            throw new TransientSourceException("Query against " + table + " failed: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
