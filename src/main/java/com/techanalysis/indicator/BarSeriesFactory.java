package com.techanalysis.indicator;

import com.techanalysis.domain.model.Bar;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.num.DoubleNum;

/**
 * Builds short-lived ta4j series for a single computation.
 *
 * <p>Every run gets its own series, nothing is cached or shared between runs.
 * {@link DoubleNum} keeps the arithmetic in plain doubles.
 */
public final class BarSeriesFactory {

    private static final LocalDate SYNTHETIC_START = LocalDate.of(2000, 1, 1);

    private BarSeriesFactory() {}

    public static BarSeries fromBars(String name, List<Bar> bars) {
        BarSeries series = newSeries(name);
        for (Bar bar : bars) {
            series.addBar(
                    endTime(bar.getDate()),
                    bar.getOpen(),
                    bar.getHigh(),
                    bar.getLow(),
                    bar.getClose(),
                    bar.getVolume());
        }
        return series;
    }

    /**
     * Series over bare price arrays, as handed to candlestick classifiers. Bars get
     * consecutive synthetic dates and zero volume.
     */
    public static BarSeries fromPrices(String name, double[] open, double[] high, double[] low, double[] close) {
        BarSeries series = newSeries(name);
        for (int i = 0; i < close.length; i++) {
            series.addBar(endTime(SYNTHETIC_START.plusDays(i)), open[i], high[i], low[i], close[i], 0.0);
        }
        return series;
    }

    private static BarSeries newSeries(String name) {
        return new BaseBarSeriesBuilder()
                .withName(name)
                .withNumTypeOf(DoubleNum.class)
                .build();
    }

    private static ZonedDateTime endTime(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC);
    }
}
