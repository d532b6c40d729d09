package com.techanalysis.indicator;

import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.ATRIndicator;
import org.ta4j.core.indicators.CCIIndicator;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.PPOIndicator;
import org.ta4j.core.indicators.ParabolicSarIndicator;
import org.ta4j.core.indicators.ROCIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;
import org.ta4j.core.indicators.TripleEMAIndicator;
import org.ta4j.core.indicators.WilliamsRIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsLowerIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsMiddleIndicator;
import org.ta4j.core.indicators.bollinger.BollingerBandsUpperIndicator;
import org.ta4j.core.indicators.helpers.HighestValueIndicator;
import org.ta4j.core.indicators.helpers.LowestValueIndicator;
import org.ta4j.core.indicators.helpers.TypicalPriceIndicator;
import org.ta4j.core.indicators.helpers.VolumeIndicator;
import org.ta4j.core.indicators.statistics.StandardDeviationIndicator;
import org.ta4j.core.indicators.volume.MoneyFlowIndexIndicator;
import org.ta4j.core.indicators.volume.OnBalanceVolumeIndicator;
import org.ta4j.core.num.Num;

/**
 * Numeric primitives backed by ta4j, materialized as one double per bar.
 *
 * <p>ta4j evaluates partial windows from the first bar on, whereas the indicator table is
 * defined on the classic look-back convention: a primitive has no value until enough
 * history exists. Each method therefore masks its leading look-back rows with NaN, and
 * any value ta4j reports as NaN or infinite is surfaced as NaN. The pipeline's
 * per-field sanitization then turns those rows into 0.
 */
public final class Ta4jPrimitives {

    private Ta4jPrimitives() {}

    public record MacdLines(double[] macd, double[] signal, double[] histogram) {}

    public record StochasticLines(double[] k, double[] d) {}

    public record Bands(double[] upper, double[] middle, double[] lower) {}

    public static double[] sma(Indicator<Num> source, int period) {
        return values(new SMAIndicator(source, period), period - 1);
    }

    public static double[] ema(Indicator<Num> source, int period) {
        return values(new EMAIndicator(source, period), period - 1);
    }

    public static double[] highest(Indicator<Num> source, int period) {
        return values(new HighestValueIndicator(source, period), period - 1);
    }

    public static double[] lowest(Indicator<Num> source, int period) {
        return values(new LowestValueIndicator(source, period), period - 1);
    }

    public static MacdLines macd(Indicator<Num> source, int fast, int slow, int signal) {
        MACDIndicator macd = new MACDIndicator(source, fast, slow);
        EMAIndicator signalLine = new EMAIndicator(macd, signal);
        int lookback = slow - 1 + signal - 1;
        double[] macdValues = values(macd, lookback);
        double[] signalValues = values(signalLine, lookback);
        return new MacdLines(macdValues, signalValues, SeriesMath.combine(macdValues, signalValues, (m, s) -> m - s));
    }

    /**
     * Stochastic %K/%D with exponential smoothing of both lines. A zero high-low range makes
     * the raw %K undefined; it is read as 0 before smoothing so one flat stretch does not
     * poison the recursive averages.
     */
    public static StochasticLines stochastic(BarSeries series, int fastK, int slowK, int slowD) {
        double[] rawK = Sanitization.NAN_AND_INFINITY.apply(raw(new StochasticOscillatorKIndicator(series, fastK)));
        EMAIndicator k = new EMAIndicator(new ColumnIndicator(series, rawK), slowK);
        EMAIndicator d = new EMAIndicator(k, slowD);
        int lookback = fastK - 1 + slowK - 1 + slowD - 1;
        return new StochasticLines(values(k, lookback), values(d, lookback));
    }

    public static Bands bollinger(Indicator<Num> source, int period, double multiplier) {
        BollingerBandsMiddleIndicator middle = new BollingerBandsMiddleIndicator(new SMAIndicator(source, period));
        StandardDeviationIndicator deviation = new StandardDeviationIndicator(source, period);
        Num k = source.getBarSeries().numOf(multiplier);
        return new Bands(
                values(new BollingerBandsUpperIndicator(middle, deviation, k), period - 1),
                values(middle, period - 1),
                values(new BollingerBandsLowerIndicator(middle, deviation, k), period - 1));
    }

    /** One-bar percentage rate of change of a triple-smoothed EMA. */
    public static double[] trix(Indicator<Num> source, int period) {
        EMAIndicator single = new EMAIndicator(source, period);
        EMAIndicator twice = new EMAIndicator(single, period);
        EMAIndicator thrice = new EMAIndicator(twice, period);
        return values(new ROCIndicator(thrice, 1), 3 * (period - 1) + 1);
    }

    public static double[] tema(Indicator<Num> source, int period) {
        return values(new TripleEMAIndicator(source, period), 3 * (period - 1));
    }

    public static double[] rsi(Indicator<Num> source, int period) {
        return values(new RSIIndicator(source, period), period);
    }

    public static double[] roc(Indicator<Num> source, int period) {
        return values(new ROCIndicator(source, period), period);
    }

    /** Percentage price oscillator on exponential averages. */
    public static double[] ppo(Indicator<Num> source, int fast, int slow) {
        return values(new PPOIndicator(source, fast, slow), slow - 1);
    }

    public static double[] atr(BarSeries series, int period) {
        return values(new ATRIndicator(series, period), period);
    }

    public static double[] williamsR(BarSeries series, int period) {
        return values(new WilliamsRIndicator(series, period), period - 1);
    }

    public static double[] cci(BarSeries series, int period) {
        return values(new CCIIndicator(series, period), period - 1);
    }

    public static double[] onBalanceVolume(BarSeries series) {
        return values(new OnBalanceVolumeIndicator(series), 0);
    }

    public static double[] parabolicSar(BarSeries series) {
        return values(new ParabolicSarIndicator(series), 1);
    }

    /**
     * Money flow index over typical price. ta4j divides by the negative money flow, so a
     * window without any falling bar comes back undefined: it reads 100 when the typical
     * price rose within the window and 0 when no money moved at all.
     */
    public static double[] moneyFlowIndex(BarSeries series, int period) {
        double[] mfi = values(new MoneyFlowIndexIndicator(series, period), period);
        double[] typical = raw(new TypicalPriceIndicator(series));
        double[] volume = raw(new VolumeIndicator(series));
        double[] risingBars = new double[typical.length];
        for (int i = 1; i < typical.length; i++) {
            risingBars[i] = typical[i] > typical[i - 1] && volume[i] > 0 ? 1.0 : 0.0;
        }
        double[] rising = SeriesMath.rollingSum(risingBars, period);
        for (int i = period; i < mfi.length; i++) {
            if (Double.isNaN(mfi[i])) {
                mfi[i] = rising[i] > 0 ? 100.0 : 0.0;
            }
        }
        return mfi;
    }

    static double[] values(Indicator<Num> indicator, int lookback) {
        double[] values = raw(indicator);
        for (int i = 0; i < values.length; i++) {
            if (i < lookback || !Double.isFinite(values[i])) {
                values[i] = Double.NaN;
            }
        }
        return values;
    }

    private static double[] raw(Indicator<Num> indicator) {
        int size = indicator.getBarSeries().getBarCount();
        double[] values = new double[size];
        for (int i = 0; i < size; i++) {
            Num value = indicator.getValue(i);
            values[i] = value == null || value.isNaN() ? Double.NaN : value.doubleValue();
        }
        return values;
    }
}
