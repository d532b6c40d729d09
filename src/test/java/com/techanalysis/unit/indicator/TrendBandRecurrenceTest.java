package com.techanalysis.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;

import com.techanalysis.indicator.TrendBandRecurrence;
import com.techanalysis.indicator.TrendBandState;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TrendBandRecurrenceTest {

    private final TrendBandRecurrence recurrence = new TrendBandRecurrence(3.0);

    private static double[] repeat(double value, int count) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return values;
    }

    @Test
    @DisplayName("row 0 rides the upper band when the close is below it")
    void seedsOnUpperBand() {
        TrendBandState state = recurrence.compute(new double[] {11}, new double[] {9}, new double[] {10}, new double[] {1});

        assertThat(state.getUpperBand()).containsExactly(13.0);
        assertThat(state.getLowerBand()).containsExactly(7.0);
        assertThat(state.getTrendLine()).containsExactly(13.0);
    }

    @Test
    @DisplayName("row 0 rides the lower band when the close is above the upper band")
    void seedsOnLowerBand() {
        TrendBandState state = recurrence.compute(new double[] {11}, new double[] {9}, new double[] {14}, new double[] {1});

        assertThat(state.getTrendLine()).containsExactly(7.0);
    }

    @Test
    @DisplayName("upper band does not widen while price stays below it")
    void upperBandOnlyTightens() {
        double[] high = {11, 12, 11};
        double[] low = {9, 10, 9};
        double[] close = {10, 10, 10};
        double[] atr = {1, 1, 1};

        TrendBandState state = recurrence.compute(high, low, close, atr);

        // the raw upper band rises to 14 on row 1 but the final band holds at 13
        assertThat(state.getUpperBand()).containsExactly(13.0, 13.0, 13.0);
        // the raw lower band rises to 8 on row 1 and is taken
        assertThat(state.getLowerBand()).containsExactly(7.0, 8.0, 8.0);
        assertThat(state.getTrendLine()).containsExactly(13.0, 13.0, 13.0);
    }

    @Test
    @DisplayName("a close above the upper band flips the trend to the lower band")
    void flipsOnBreakout() {
        double[] high = repeat(11, 3);
        double[] low = repeat(9, 3);
        double[] close = {10, 14, 12};
        double[] atr = repeat(1, 3);

        TrendBandState state = recurrence.compute(high, low, close, atr);

        assertThat(state.getTrendLine()[1]).isEqualTo(7.0);
        // the upper band resets after the breakout
        assertThat(state.getUpperBand()[2]).isEqualTo(13.0);
        assertThat(state.getTrendLine()[2]).isEqualTo(7.0);
    }

    @Test
    @DisplayName("re-seeds when the previous trend line matches neither band")
    void reseedsAfterUndefinedBand() {
        double[] high = repeat(11, 4);
        double[] low = repeat(9, 4);
        double[] close = {10, 14, 5, 8};
        double[] atr = {1, 1, Double.NaN, 1};

        TrendBandState state = recurrence.compute(high, low, close, atr);

        assertThat(state.getTrendLine()[2]).isNaN();
        assertThat(state.getUpperBand()[3]).isNaN();
        assertThat(state.getLowerBand()[3]).isEqualTo(7.0);
        assertThat(state.getTrendLine()[3]).isEqualTo(7.0);
    }

    @Test
    @DisplayName("trend line is always one of the two bands on finite input")
    void trendLineOnBand() {
        int size = 200;
        double[] high = new double[size];
        double[] low = new double[size];
        double[] close = new double[size];
        double[] atr = new double[size];
        for (int i = 0; i < size; i++) {
            close[i] = 50 + 10 * Math.sin(i / 7.0) + 0.05 * i;
            high[i] = close[i] + 1 + (i % 3) * 0.5;
            low[i] = close[i] - 1 - (i % 5) * 0.3;
            atr[i] = 1.5 + (i % 4) * 0.2;
        }

        TrendBandState state = recurrence.compute(high, low, close, atr);

        double[] upper = state.getUpperBand();
        double[] lower = state.getLowerBand();
        double[] trend = state.getTrendLine();
        for (int i = 0; i < size; i++) {
            assertThat(trend[i]).isIn(upper[i], lower[i]);
        }
    }
}
