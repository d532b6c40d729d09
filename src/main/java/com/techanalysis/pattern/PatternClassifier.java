package com.techanalysis.pattern;

/**
 * Classifies every bar of a price window as one candlestick pattern.
 *
 * <p>Returns one code per bar: 100 for a bullish occurrence, -100 for a bearish one,
 * 0 otherwise. Implementations must be stateless.
 */
@FunctionalInterface
public interface PatternClassifier {

    int[] classify(double[] open, double[] high, double[] low, double[] close);
}
