package com.nectarstudio.realtime.client;

import com.nectarstudio.realtime.model.domain.ChangeOperation;
import com.nectarstudio.realtime.model.dto.TableUpdate;
import com.nectarstudio.realtime.util.RecordKeys;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client-side copy of a list view, kept in order and keyed by {@code id}.
 * <p>
 * A {@code polling_refresh} replaces everything. Trigger updates are applied incrementally:
 * INSERT appends unless the id is already present, UPDATE merges shallowly into the existing
 * record, DELETE removes it; UPDATE and DELETE of an unknown id do nothing. Anything
 * malformed is logged and dropped, never thrown.
 */
@Slf4j
public class ClientRecordSet {

    private final List<Map<String, Object>> records = new ArrayList<>();

    public synchronized void replaceAll(Collection<? extends Map<String, Object>> rows) {
        records.clear();
        if (rows != null) {
            rows.forEach(row -> records.add(new LinkedHashMap<>(row)));
        }
    }

    /**
     * @return true when the set changed
     */
    public boolean apply(TableUpdate update) {
        if (update == null || update.updateType() == null) {
            log.warn("⚠️ Dropping update without updateType: {}", update);
            return false;
        }
        return switch (update.updateType()) {
            case POLLING_REFRESH -> applyRefresh(update.data());
            case DATABASE_TRIGGER -> applyTrigger(update.operation(), update.data());
        };
    }

    public synchronized List<Map<String, Object>> snapshot() {
        List<Map<String, Object>> copy = new ArrayList<>(records.size());
        records.forEach(record -> copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record))));
        return Collections.unmodifiableList(copy);
    }

    public synchronized Optional<Map<String, Object>> find(Object id) {
        int index = indexOf(id);
        return index < 0 ? Optional.empty() : Optional.of(new LinkedHashMap<>(records.get(index)));
    }

    public synchronized int size() {
        return records.size();
    }

    private boolean applyRefresh(Object data) {
        if (!(data instanceof List<?> rows)) {
            log.warn("⚠️ Dropping polling_refresh whose data is not a list");
            return false;
        }
        List<Map<String, Object>> replacement = new ArrayList<>(rows.size());
        for (Object row : rows) {
            Optional<Map<String, Object>> record = asRecord(row);
            if (record.isEmpty()) {
                log.warn("⚠️ Dropping polling_refresh containing a non-object row");
                return false;
            }
            replacement.add(record.get());
        }
        replaceAll(replacement);
        return true;
    }

    private boolean applyTrigger(String operationName, Object data) {
        Optional<ChangeOperation> operation = ChangeOperation.parse(operationName);
        if (operation.isEmpty()) {
            log.warn("⚠️ Unknown trigger operation '{}', ignored", operationName);
            return false;
        }
        Optional<Map<String, Object>> record = asRecord(data);
        Object id = record.map(RecordKeys::idOf).orElse(null);
        if (id == null) {
            log.warn("⚠️ Dropping {} without a record id", operation.get());
            return false;
        }
        synchronized (this) {
            int index = indexOf(id);
            switch (operation.get()) {
                case INSERT -> {
                    if (index >= 0) {
                        return false;
                    }
                    records.add(record.get());
                    return true;
                }
                case UPDATE -> {
                    if (index < 0) {
                        return false;
                    }
                    Map<String, Object> merged = new LinkedHashMap<>(records.get(index));
                    merged.putAll(record.get());
                    records.set(index, merged);
                    return true;
                }
                case DELETE -> {
                    if (index < 0) {
                        return false;
                    }
                    records.remove(index);
                    return true;
                }
                default -> {
                    return false;
                }
            }
        }
    }

    private int indexOf(Object id) {
        for (int i = 0; i < records.size(); i++) {
            if (RecordKeys.sameId(RecordKeys.idOf(records.get(i)), id)) {
                return i;
            }
        }
        return -1;
    }

    @SuppressWarnings("unchecked")
    private static Optional<Map<String, Object>> asRecord(Object value) {
        if (value instanceof Map<?, ?> map) {
            return Optional.of(new LinkedHashMap<>((Map<String, Object>) map));
        }
        return Optional.empty();
    }
}
