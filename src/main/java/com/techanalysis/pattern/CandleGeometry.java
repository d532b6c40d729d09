package com.techanalysis.pattern;

import com.techanalysis.indicator.BarSeriesFactory;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.candles.LowerShadowIndicator;
import org.ta4j.core.indicators.candles.RealBodyIndicator;
import org.ta4j.core.indicators.candles.UpperShadowIndicator;
import org.ta4j.core.num.Num;

/**
 * Body and shadow measurements of a price window, shared by the geometric classifiers.
 * Bodies and shadows are read from ta4j's candle indicators once per window.
 */
final class CandleGeometry {

    /** Bars used for the average body a candle is compared against. */
    static final int AVERAGE_PERIOD = 10;

    /** Leading bars that never carry a geometric signal: the average period plus the longest pattern. */
    static final int MIN_HISTORY = AVERAGE_PERIOD + 3;

    private final double[] open;
    private final double[] high;
    private final double[] low;
    private final double[] close;
    private final double[] body;
    private final double[] upperShadow;
    private final double[] lowerShadow;

    CandleGeometry(double[] open, double[] high, double[] low, double[] close) {
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        BarSeries series = BarSeriesFactory.fromPrices("geometry", open, high, low, close);
        double[] realBody = materialize(new RealBodyIndicator(series));
        this.body = new double[realBody.length];
        for (int i = 0; i < realBody.length; i++) {
            body[i] = Math.abs(realBody[i]);
        }
        this.upperShadow = materialize(new UpperShadowIndicator(series));
        this.lowerShadow = materialize(new LowerShadowIndicator(series));
    }

    private static double[] materialize(Indicator<Num> indicator) {
        int size = indicator.getBarSeries().getBarCount();
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            values[i] = indicator.getValue(i).doubleValue();
        }
        return values;
    }

    int size() {
        return close.length;
    }

    double open(int i) {
        return open[i];
    }

    double high(int i) {
        return high[i];
    }

    double low(int i) {
        return low[i];
    }

    double close(int i) {
        return close[i];
    }

    double body(int i) {
        return body[i];
    }

    double range(int i) {
        return high[i] - low[i];
    }

    double upperShadow(int i) {
        return upperShadow[i];
    }

    double lowerShadow(int i) {
        return lowerShadow[i];
    }

    double bodyTop(int i) {
        return Math.max(open[i], close[i]);
    }

    double bodyBottom(int i) {
        return Math.min(open[i], close[i]);
    }

    double bodyMidpoint(int i) {
        return (open[i] + close[i]) / 2;
    }

    boolean isWhite(int i) {
        return close[i] > open[i];
    }

    boolean isBlack(int i) {
        return close[i] < open[i];
    }

    /** Whether enough bars precede {@code i} to judge it. */
    boolean hasHistory(int i) {
        return i >= MIN_HISTORY;
    }

    /** Mean body of the {@link #AVERAGE_PERIOD} bars before {@code i}. */
    double averageBody(int i) {
        double sum = 0.0;
        for (int j = i - AVERAGE_PERIOD; j < i; j++) {
            sum += body(j);
        }
        return sum / AVERAGE_PERIOD;
    }

    boolean isLongBody(int i) {
        return body(i) > averageBody(i);
    }

    boolean isSmallBody(int i) {
        return body(i) < 0.5 * averageBody(i);
    }

    /** Prior-trend direction: the previous close against the mean close of the window before it. */
    boolean inDowntrend(int i) {
        return close[i - 1] < averageClose(i);
    }

    boolean inUptrend(int i) {
        return close[i - 1] > averageClose(i);
    }

    private double averageClose(int i) {
        double sum = 0.0;
        for (int j = i - AVERAGE_PERIOD; j < i; j++) {
            sum += close[j];
        }
        return sum / AVERAGE_PERIOD;
    }
}
