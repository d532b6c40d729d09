package com.techanalysis.domain.model;

import java.util.Map;

/**
 * One row of a {@link DerivedFrame}: the source bar plus its derived values in field order.
 */
public record DerivedRow(Bar bar, Map<String, Double> values) {

    public double get(String field) {
        Double value = values.get(field);
        if (value == null) {
            throw new IllegalArgumentException("Unknown indicator field: " + field);
        }
        return value;
    }
}
