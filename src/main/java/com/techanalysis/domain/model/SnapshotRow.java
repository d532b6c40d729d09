package com.techanalysis.domain.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Latest-row view of one instrument, shaped by a caller-supplied column list.
 *
 * <p>{@code columns} is {@code [dateColumn, codeColumn, field1, field2, ...]};
 * {@code values} holds one entry per field in that order.
 */
public record SnapshotRow<V extends Number>(List<String> columns, LocalDate date, String code, Map<String, V> values) {

    public SnapshotRow {
        columns = List.copyOf(columns);
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public V get(String field) {
        return values.get(field);
    }

    /** Date, code and field values keyed by the caller's column names, in column order. */
    public Map<String, Object> asColumnMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(columns.get(0), date);
        map.put(columns.get(1), code);
        for (Map.Entry<String, V> entry : values.entrySet()) {
            map.put(entry.getKey(), entry.getValue());
        }
        return map;
    }
}
