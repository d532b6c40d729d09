package com.techanalysis.indicator;

/**
 * Per-run output of {@link TrendBandRecurrence}: final upper band, final lower band and
 * the trend line that rides one of them. Owned by a single pipeline run.
 */
public final class TrendBandState {

    private final double[] upperBand;
    private final double[] lowerBand;
    private final double[] trendLine;

    TrendBandState(int size) {
        this.upperBand = new double[size];
        this.lowerBand = new double[size];
        this.trendLine = new double[size];
    }

    double[] upper() {
        return upperBand;
    }

    double[] lower() {
        return lowerBand;
    }

    double[] trend() {
        return trendLine;
    }

    public double[] getUpperBand() {
        return upperBand.clone();
    }

    public double[] getLowerBand() {
        return lowerBand.clone();
    }

    public double[] getTrendLine() {
        return trendLine.clone();
    }
}
