package com.techanalysis.indicator;

/**
 * Per-field replacement rule applied the moment a derived column is written.
 *
 * <p>Division, ratio and difference based fields use {@link #NAN_AND_INFINITY};
 * plain smoothing and overlay fields use {@link #NAN_ONLY}. The split is kept
 * field by field because downstream consumers see exactly these values.
 */
public enum Sanitization {

    /** Values are stored untouched. */
    NONE {
        @Override
        boolean replaces(double value) {
            return false;
        }
    },

    /** NaN becomes 0.0; infinities are kept. */
    NAN_ONLY {
        @Override
        boolean replaces(double value) {
            return Double.isNaN(value);
        }
    },

    /** NaN and both infinities become 0.0. */
    NAN_AND_INFINITY {
        @Override
        boolean replaces(double value) {
            return !Double.isFinite(value);
        }
    };

    abstract boolean replaces(double value);

    /** Sanitizes {@code values} in place and returns the same array. */
    public double[] apply(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (replaces(values[i])) {
                values[i] = 0.0;
            }
        }
        return values;
    }

    public double apply(double value) {
        return replaces(value) ? 0.0 : value;
    }
}
