package com.techanalysis.indicator;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Element-wise helpers for the derivation steps that ta4j has no indicator for.
 * Every method returns a new array and leaves its arguments untouched.
 */
public final class SeriesMath {

    private SeriesMath() {}

    /** Shifts values {@code periods} rows later, filling the vacated head with {@code fill}. */
    public static double[] shift(double[] values, int periods, double fill) {
        double[] shifted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            shifted[i] = i < periods ? fill : values[i - periods];
        }
        return shifted;
    }

    /** First difference, with 0 in row 0. */
    public static double[] diff(double[] values) {
        double[] result = new double[values.length];
        for (int i = 1; i < values.length; i++) {
            result[i] = values[i] - values[i - 1];
        }
        return result;
    }

    /**
     * Trailing sum over {@code period} rows. The first {@code period - 1} rows are NaN, and
     * so is any window that contains a NaN.
     */
    public static double[] rollingSum(double[] values, int period) {
        double[] sums = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            if (i < period - 1) {
                sums[i] = Double.NaN;
                continue;
            }
            double sum = 0.0;
            for (int j = i - period + 1; j <= i; j++) {
                sum += values[j];
            }
            sums[i] = sum;
        }
        return sums;
    }

    public static double[] map(double[] values, DoubleUnaryOperator operator) {
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = operator.applyAsDouble(values[i]);
        }
        return result;
    }

    public static double[] combine(double[] left, double[] right, DoubleBinaryOperator operator) {
        if (left.length != right.length) {
            throw new IllegalArgumentException("Length mismatch: " + left.length + " vs " + right.length);
        }
        double[] result = new double[left.length];
        for (int i = 0; i < left.length; i++) {
            result[i] = operator.applyAsDouble(left[i], right[i]);
        }
        return result;
    }

    /** Weighted sum {@code (v + 2 v[-1] + 2 v[-2] + v[-3]) / 6}, missing history read as 0. */
    public static double[] symmetricWeighted(double[] values) {
        double[] lag1 = shift(values, 1, 0.0);
        double[] lag2 = shift(values, 2, 0.0);
        double[] lag3 = shift(values, 3, 0.0);
        double[] result = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            result[i] = (values[i] + 2 * lag1[i] + 2 * lag2[i] + lag3[i]) / 6.0;
        }
        return result;
    }
}
