package com.techanalysis.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Column-oriented result of an indicator pipeline run.
 *
 * <p>Holds one value per bar for every exported field, in the order the fields were
 * derived. Rows stay aligned 1:1 with the (windowed) input bars; only {@link #tail(int)}
 * drops leading rows. Columns are never handed out directly, callers receive copies.
 */
public class DerivedFrame {

    @Getter
    private final String code;

    @Getter
    private final List<Bar> bars;

    private final Map<String, double[]> columns;

    public DerivedFrame(String code, List<Bar> bars, Map<String, double[]> columns) {
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            if (entry.getValue().length != bars.size()) {
                throw new IllegalArgumentException("Column " + entry.getKey() + " has " + entry.getValue().length
                        + " values for " + bars.size() + " bars");
            }
        }
        this.code = code;
        this.bars = List.copyOf(bars);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public List<String> fieldNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasField(String field) {
        return columns.containsKey(field);
    }

    /** Returns a copy of the named column. */
    public double[] column(String field) {
        return requireColumn(field).clone();
    }

    public double value(int row, String field) {
        return requireColumn(field)[row];
    }

    public DerivedRow row(int index) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            values.put(entry.getKey(), entry.getValue()[index]);
        }
        return new DerivedRow(bars.get(index), Collections.unmodifiableMap(values));
    }

    public DerivedRow lastRow() {
        return row(size() - 1);
    }

    /**
     * Keeps the last {@code rows} rows. Returns this frame when it is already short enough.
     */
    public DerivedFrame tail(int rows) {
        if (rows >= size()) {
            return this;
        }
        int from = size() - rows;
        Map<String, double[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, double[]> entry : columns.entrySet()) {
            double[] values = new double[rows];
            System.arraycopy(entry.getValue(), from, values, 0, rows);
            sliced.put(entry.getKey(), values);
        }
        return new DerivedFrame(code, bars.subList(from, size()), sliced);
    }

    /**
     * Flattens the frame into records keyed by {@code date}, {@code code} and every field,
     * the shape expected by column-store upserts.
     */
    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("date", bars.get(i).getDate());
            record.put("code", code);
            for (Map.Entry<String, double[]> entry : columns.entrySet()) {
                record.put(entry.getKey(), entry.getValue()[i]);
            }
            records.add(record);
        }
        return records;
    }

    private double[] requireColumn(String field) {
        double[] values = columns.get(field);
        if (values == null) {
            throw new IllegalArgumentException("Unknown indicator field: " + field);
        }
        return values;
    }
}
