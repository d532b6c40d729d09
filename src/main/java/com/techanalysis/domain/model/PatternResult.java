package com.techanalysis.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * Candlestick signal codes per bar, one column per pattern.
 *
 * <p>Codes are -100 (bearish), 0 (no signal) or 100 (bullish). A pattern whose
 * classifier failed has no column and reads as 0 everywhere.
 */
public class PatternResult {

    @Getter
    private final String code;

    @Getter
    private final List<Bar> bars;

    /** Patterns requested for the run, in request order. */
    @Getter
    private final List<String> patternNames;

    @Getter
    private final Set<String> failedPatterns;

    private final Map<String, int[]> columns;

    public PatternResult(
            String code,
            List<Bar> bars,
            List<String> patternNames,
            Map<String, int[]> columns,
            Set<String> failedPatterns) {
        this.code = code;
        this.bars = List.copyOf(bars);
        this.patternNames = List.copyOf(patternNames);
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));
        this.failedPatterns = Collections.unmodifiableSet(new LinkedHashSet<>(failedPatterns));
    }

    public int size() {
        return bars.size();
    }

    public boolean isEmpty() {
        return bars.isEmpty();
    }

    public boolean hasColumn(String pattern) {
        return columns.containsKey(pattern);
    }

    public int value(int row, String pattern) {
        int[] values = columns.get(pattern);
        return values == null ? 0 : values[row];
    }

    /** Pattern name to code for one row, covering every requested pattern. */
    public Map<String, Integer> row(int index) {
        Map<String, Integer> values = new LinkedHashMap<>();
        for (String pattern : patternNames) {
            values.put(pattern, value(index, pattern));
        }
        return Collections.unmodifiableMap(values);
    }

    public boolean hasSignal(int row) {
        for (String pattern : patternNames) {
            if (value(row, pattern) != 0) {
                return true;
            }
        }
        return false;
    }

    public PatternResult tail(int rows) {
        if (rows >= size()) {
            return this;
        }
        int from = size() - rows;
        Map<String, int[]> sliced = new LinkedHashMap<>();
        for (Map.Entry<String, int[]> entry : columns.entrySet()) {
            int[] values = new int[rows];
            System.arraycopy(entry.getValue(), from, values, 0, rows);
            sliced.put(entry.getKey(), values);
        }
        return new PatternResult(code, bars.subList(from, size()), patternNames, sliced, failedPatterns);
    }

    public List<Map<String, Object>> toRecords() {
        List<Map<String, Object>> records = new ArrayList<>(size());
        for (int i = 0; i < size(); i++) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("date", bars.get(i).getDate());
            record.put("code", code);
            record.putAll(row(i));
            records.add(record);
        }
        return records;
    }
}
