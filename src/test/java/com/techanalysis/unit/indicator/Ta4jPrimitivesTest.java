package com.techanalysis.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.indicator.BarSeriesFactory;
import com.techanalysis.indicator.Ta4jPrimitives;
import com.techanalysis.support.BarFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.indicators.volume.MoneyFlowIndexIndicator;

/**
 * Warm-up masking and undefined-value handling of the ta4j-backed primitives.
 */
class Ta4jPrimitivesTest {

    private final List<Bar> bars = BarFixtures.closes(10, 11, 12, 13, 14, 15, 16, 17, 18, 19);
    private final BarSeries series = BarSeriesFactory.fromBars("TEST", bars);

    @Nested
    @DisplayName("Moving averages")
    class MovingAverages {

        @Test
        @DisplayName("SMA is undefined for the first period - 1 rows")
        void smaWarmUp() {
            double[] sma = Ta4jPrimitives.sma(new ClosePriceIndicator(series), 5);

            for (int i = 0; i < 4; i++) {
                assertThat(sma[i]).isNaN();
            }
            assertThat(sma[4]).isCloseTo(12.0, within(1e-9));
            assertThat(sma[9]).isCloseTo(17.0, within(1e-9));
        }

        @Test
        @DisplayName("EMA shares the SMA look-back")
        void emaWarmUp() {
            double[] ema = Ta4jPrimitives.ema(new ClosePriceIndicator(series), 3);

            assertThat(ema[1]).isNaN();
            assertThat(ema[2]).isFinite();
        }

        @Test
        @DisplayName("a window longer than the series leaves every row undefined")
        void longWindow() {
            double[] sma = Ta4jPrimitives.sma(new ClosePriceIndicator(series), 200);

            assertThat(sma).hasSize(10);
            for (double value : sma) {
                assertThat(value).isNaN();
            }
        }
    }

    @Nested
    @DisplayName("Oscillators")
    class Oscillators {

        @Test
        @DisplayName("RSI needs period rows of history")
        void rsiWarmUp() {
            BarSeries trending = BarSeriesFactory.fromBars("TREND", BarFixtures.trending(30));

            double[] rsi = Ta4jPrimitives.rsi(new ClosePriceIndicator(trending), 6);

            assertThat(rsi[5]).isNaN();
            assertThat(rsi[6]).isBetween(0.0, 100.0);
        }

        @Test
        @DisplayName("Williams %R is undefined on a zero range")
        void williamsOnFlatBars() {
            BarSeries flat = BarSeriesFactory.fromBars("FLAT", BarFixtures.flat(20, 10, 100));

            double[] wr = Ta4jPrimitives.williamsR(flat, 6);

            for (double value : wr) {
                assertThat(Double.isInfinite(value)).isFalse();
            }
        }

        @Test
        @DisplayName("money flow index is 0 when nothing trades")
        void mfiWithoutFlow() {
            BarSeries flat = BarSeriesFactory.fromBars("FLAT", BarFixtures.flat(20, 10, 0));

            double[] mfi = Ta4jPrimitives.moneyFlowIndex(flat, 14);

            assertThat(mfi[13]).isNaN();
            assertThat(mfi[14]).isZero();
        }

        @Test
        @DisplayName("money flow index is 100 when prices only rise")
        void mfiRisingPrices() {
            double[] mfi = Ta4jPrimitives.moneyFlowIndex(series, 5);

            assertThat(mfi[5]).isCloseTo(100.0, within(1e-9));
        }

        @Test
        @DisplayName("money flow index keeps ta4j's value wherever ta4j defines one")
        void mfiMixedFlow() {
            BarSeries trending = BarSeriesFactory.fromBars("TREND", BarFixtures.trending(60));
            MoneyFlowIndexIndicator reference = new MoneyFlowIndexIndicator(trending, 14);

            double[] mfi = Ta4jPrimitives.moneyFlowIndex(trending, 14);

            assertThat(mfi[13]).isNaN();
            int compared = 0;
            for (int i = 14; i < 60; i++) {
                double expected = reference.getValue(i).doubleValue();
                assertThat(mfi[i]).as("row %d", i).isBetween(0.0, 100.0);
                if (Double.isFinite(expected)) {
                    assertThat(mfi[i]).as("row %d", i).isCloseTo(expected, within(1e-9));
                    compared++;
                }
            }
            assertThat(compared).isGreaterThan(20);
        }
    }

    @Test
    @DisplayName("Bollinger bands are centred on the SMA")
    void bollingerBands() {
        Ta4jPrimitives.Bands bands = Ta4jPrimitives.bollinger(new ClosePriceIndicator(series), 5, 2.0);

        assertThat(bands.middle()[3]).isNaN();
        assertThat(bands.middle()[9]).isCloseTo(17.0, within(1e-9));
        assertThat(bands.upper()[9] - bands.middle()[9])
                .isCloseTo(bands.middle()[9] - bands.lower()[9], within(1e-9));
        assertThat(bands.upper()[9]).isGreaterThan(bands.middle()[9]);
    }
}
