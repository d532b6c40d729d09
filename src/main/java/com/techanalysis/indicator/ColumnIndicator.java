package com.techanalysis.indicator;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.AbstractIndicator;
import org.ta4j.core.num.NaN;
import org.ta4j.core.num.Num;

/**
 * Exposes a derived column to ta4j so library indicators can be stacked on fields the
 * pipeline computed itself. Non-finite entries are reported as {@link NaN#NaN}.
 */
final class ColumnIndicator extends AbstractIndicator<Num> {

    private final double[] values;

    ColumnIndicator(BarSeries series, double[] values) {
        super(series);
        this.values = values.clone();
    }

    @Override
    public Num getValue(int index) {
        double value = values[index];
        return Double.isFinite(value) ? getBarSeries().numOf(value) : NaN.NaN;
    }

    public int getUnstableBars() {
        return 0;
    }
}
