package com.techanalysis.indicator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ATR-band trend follower (supertrend).
 *
 * <p>Basic bands sit {@code multiplier * atr} above and below the bar midpoint. The final
 * upper band only moves down unless the previous close broke above it, the final lower
 * band only moves up unless the previous close broke below it, and the trend line stays
 * on the band it rode on the previous bar until the close crosses that band.
 *
 * <p>Row 0 seeds the trend line on the upper band when {@code close <= upper}, otherwise
 * on the lower band. If the previous trend line matches neither previous band (only
 * possible once a band is NaN) the row is seeded the same way.
 *
 * <p>The recurrence is always evaluated over the whole window it is given.
 */
public class TrendBandRecurrence {

    private static final Logger log = LoggerFactory.getLogger(TrendBandRecurrence.class);

    private final double multiplier;

    public TrendBandRecurrence(double multiplier) {
        this.multiplier = multiplier;
    }

    public TrendBandState compute(double[] high, double[] low, double[] close, double[] atr) {
        int size = close.length;
        TrendBandState state = new TrendBandState(size);
        double[] upper = state.upper();
        double[] lower = state.lower();
        double[] trend = state.trend();
        int reseeded = 0;

        for (int i = 0; i < size; i++) {
            double midpoint = (high[i] + low[i]) / 2.0;
            double basicUpper = midpoint + multiplier * atr[i];
            double basicLower = midpoint - multiplier * atr[i];

            if (i == 0) {
                upper[i] = basicUpper;
                lower[i] = basicLower;
                trend[i] = seed(close[i], upper[i], lower[i]);
                continue;
            }

            double previousClose = close[i - 1];
            upper[i] = basicUpper < upper[i - 1] || previousClose > upper[i - 1] ? basicUpper : upper[i - 1];
            lower[i] = basicLower > lower[i - 1] || previousClose < lower[i - 1] ? basicLower : lower[i - 1];

            if (trend[i - 1] == upper[i - 1]) {
                trend[i] = close[i] <= upper[i] ? upper[i] : lower[i];
            } else if (trend[i - 1] == lower[i - 1]) {
                trend[i] = close[i] > lower[i] ? lower[i] : upper[i];
            } else {
                trend[i] = seed(close[i], upper[i], lower[i]);
                reseeded++;
            }
        }

        if (reseeded > 0) {
            log.debug("Trend line re-seeded on {} of {} rows", reseeded, size);
        }
        return state;
    }

    private static double seed(double close, double upper, double lower) {
        return close <= upper ? upper : lower;
    }
}
