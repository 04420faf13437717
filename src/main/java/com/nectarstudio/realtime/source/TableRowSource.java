package com.nectarstudio.realtime.source;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Read/mark access to externally owned tables. This is the seam to the database
 * connectivity layer; implementations throw
 * {@link com.nectarstudio.realtime.exception.TransientSourceException} for failures
 * worth retrying on the next poll.
 */
public interface TableRowSource {

    /**
     * Rows matching {@code predicate}, ordered by {@code orderBy}, at most {@code limit}.
     */
    List<Map<String, Object>> queryRows(String table, RowPredicate predicate, String orderBy, int limit);

    /**
     * One page of a list view. {@code fields} empty means all columns.
     */
    List<Map<String, Object>> queryPage(String table, List<String> fields, RowPredicate predicate,
                                        String orderBy, int offset, int limit);

    long countRows(String table, RowPredicate predicate);

    /**
     * Flags rows as consumed so processed-marker polling skips them.
     *
     * @return number of rows updated
     */
    int markProcessed(String table, String keyColumn, Collection<?> rowIds);

    /**
     * Columns of the table, or an empty list when the table does not exist.
     */
    List<ColumnInfo> describeColumns(String table);
}
