package com.techanalysis.pattern;

import com.techanalysis.indicator.BarSeriesFactory;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.indicators.candles.BearishEngulfingIndicator;
import org.ta4j.core.indicators.candles.BearishHaramiIndicator;
import org.ta4j.core.indicators.candles.BullishEngulfingIndicator;
import org.ta4j.core.indicators.candles.BullishHaramiIndicator;
import org.ta4j.core.indicators.candles.DojiIndicator;
import org.ta4j.core.indicators.candles.ThreeBlackCrowsIndicator;
import org.ta4j.core.indicators.candles.ThreeWhiteSoldiersIndicator;

/**
 * Catalogue of candlestick classifiers, keyed by pattern name.
 *
 * <p>Engulfing, harami, doji, three white soldiers and three black crows come from
 * ta4j's candle indicators. ta4j has no hammer family, stars, piercing line or
 * marubozu; those are judged on ta4j's body and shadow measures against the average
 * body of the preceding {@value CandleGeometry#AVERAGE_PERIOD} bars, so the first
 * {@value CandleGeometry#MIN_HISTORY} bars of a window never carry a signal for them.
 */
public final class CandlestickPatterns {

    public static final int BULLISH = 100;
    public static final int BEARISH = -100;

    /** Bars averaged for the shadow a soldier or crow is measured against. */
    private static final int SOLDIER_SHADOW_PERIOD = 3;

    /** A soldier's upper (a crow's lower) shadow must stay below this share of that average. */
    private static final double SOLDIER_SHADOW_FACTOR = 0.3;

    private static final Map<String, PatternClassifier> ALL = createAll();

    private CandlestickPatterns() {}

    /** Every known classifier in catalogue order. */
    public static Map<String, PatternClassifier> all() {
        return ALL;
    }

    /**
     * Classifiers for the requested names, in request order. Unknown names are skipped;
     * they read as 0 like any pattern without a column.
     */
    public static Map<String, PatternClassifier> select(Collection<String> names) {
        Map<String, PatternClassifier> selected = new LinkedHashMap<>();
        for (String name : names) {
            PatternClassifier classifier = ALL.get(name);
            if (classifier != null) {
                selected.put(name, classifier);
            }
        }
        return Collections.unmodifiableMap(selected);
    }

    private static Map<String, PatternClassifier> createAll() {
        Map<String, PatternClassifier> patterns = new LinkedHashMap<>();
        patterns.put("engulfing", pairedSignal(BullishEngulfingIndicator::new, BearishEngulfingIndicator::new));
        patterns.put("harami", pairedSignal(BullishHaramiIndicator::new, BearishHaramiIndicator::new));
        patterns.put("doji", signal(BULLISH, series -> new DojiIndicator(series, CandleGeometry.AVERAGE_PERIOD, 0.1)));
        patterns.put("hammer", geometric(CandlestickPatterns::hammer));
        patterns.put("hanging_man", geometric(CandlestickPatterns::hangingMan));
        patterns.put("inverted_hammer", geometric(CandlestickPatterns::invertedHammer));
        patterns.put("shooting_star", geometric(CandlestickPatterns::shootingStar));
        patterns.put("marubozu", geometric(CandlestickPatterns::marubozu));
        patterns.put("piercing", geometric(CandlestickPatterns::piercing));
        patterns.put("dark_cloud_cover", geometric(CandlestickPatterns::darkCloudCover));
        patterns.put("morning_star", geometric(CandlestickPatterns::morningStar));
        patterns.put("evening_star", geometric(CandlestickPatterns::eveningStar));
        patterns.put("three_white_soldiers", signal(BULLISH, series ->
                new ThreeWhiteSoldiersIndicator(series, SOLDIER_SHADOW_PERIOD, series.numOf(SOLDIER_SHADOW_FACTOR))));
        patterns.put("three_black_crows", signal(BEARISH, series ->
                new ThreeBlackCrowsIndicator(series, SOLDIER_SHADOW_PERIOD, SOLDIER_SHADOW_FACTOR)));
        return Collections.unmodifiableMap(patterns);
    }

    @FunctionalInterface
    private interface BarRule {
        int at(CandleGeometry candles, int i);
    }

    private static PatternClassifier geometric(BarRule rule) {
        return (open, high, low, close) -> {
            CandleGeometry candles = new CandleGeometry(open, high, low, close);
            int[] codes = new int[candles.size()];
            for (int i = 0; i < codes.length; i++) {
                codes[i] = candles.hasHistory(i) ? rule.at(candles, i) : 0;
            }
            return codes;
        };
    }

    private static PatternClassifier pairedSignal(
            Function<BarSeries, Indicator<Boolean>> bullish, Function<BarSeries, Indicator<Boolean>> bearish) {
        return (open, high, low, close) -> {
            BarSeries series = BarSeriesFactory.fromPrices("candles", open, high, low, close);
            Indicator<Boolean> up = bullish.apply(series);
            Indicator<Boolean> down = bearish.apply(series);
            int[] codes = new int[close.length];
            for (int i = 0; i < codes.length; i++) {
                if (up.getValue(i)) {
                    codes[i] = BULLISH;
                } else if (down.getValue(i)) {
                    codes[i] = BEARISH;
                }
            }
            return codes;
        };
    }

    private static PatternClassifier signal(int code, Function<BarSeries, Indicator<Boolean>> factory) {
        return (open, high, low, close) -> {
            Indicator<Boolean> signal = factory.apply(BarSeriesFactory.fromPrices("candles", open, high, low, close));
            int[] codes = new int[close.length];
            for (int i = 0; i < codes.length; i++) {
                codes[i] = signal.getValue(i) ? code : 0;
            }
            return codes;
        };
    }

    private static boolean isHammerShape(CandleGeometry c, int i) {
        return c.range(i) > 0
                && c.isSmallBody(i)
                && c.lowerShadow(i) >= 2 * c.body(i)
                && c.upperShadow(i) <= 0.1 * c.range(i);
    }

    private static boolean isInvertedHammerShape(CandleGeometry c, int i) {
        return c.range(i) > 0
                && c.isSmallBody(i)
                && c.upperShadow(i) >= 2 * c.body(i)
                && c.lowerShadow(i) <= 0.1 * c.range(i);
    }

    static int hammer(CandleGeometry c, int i) {
        return isHammerShape(c, i) && c.inDowntrend(i) ? BULLISH : 0;
    }

    static int hangingMan(CandleGeometry c, int i) {
        return isHammerShape(c, i) && c.inUptrend(i) ? BEARISH : 0;
    }

    static int invertedHammer(CandleGeometry c, int i) {
        return isInvertedHammerShape(c, i) && c.inDowntrend(i) ? BULLISH : 0;
    }

    static int shootingStar(CandleGeometry c, int i) {
        return isInvertedHammerShape(c, i) && c.inUptrend(i) ? BEARISH : 0;
    }

    static int marubozu(CandleGeometry c, int i) {
        if (!c.isLongBody(i) || c.upperShadow(i) > 0.05 * c.range(i) || c.lowerShadow(i) > 0.05 * c.range(i)) {
            return 0;
        }
        return c.isWhite(i) ? BULLISH : c.isBlack(i) ? BEARISH : 0;
    }

    static int piercing(CandleGeometry c, int i) {
        int p = i - 1;
        boolean matches = c.isBlack(p)
                && c.isLongBody(p)
                && c.isWhite(i)
                && c.open(i) < c.low(p)
                && c.close(i) > c.bodyMidpoint(p)
                && c.close(i) < c.open(p);
        return matches ? BULLISH : 0;
    }

    static int darkCloudCover(CandleGeometry c, int i) {
        int p = i - 1;
        boolean matches = c.isWhite(p)
                && c.isLongBody(p)
                && c.isBlack(i)
                && c.open(i) > c.high(p)
                && c.close(i) < c.bodyMidpoint(p)
                && c.close(i) > c.open(p);
        return matches ? BEARISH : 0;
    }

    static int morningStar(CandleGeometry c, int i) {
        int first = i - 2;
        int star = i - 1;
        boolean matches = c.isBlack(first)
                && c.isLongBody(first)
                && c.isSmallBody(star)
                && c.bodyTop(star) < c.bodyBottom(first)
                && c.isWhite(i)
                && c.close(i) > c.bodyMidpoint(first);
        return matches ? BULLISH : 0;
    }

    static int eveningStar(CandleGeometry c, int i) {
        int first = i - 2;
        int star = i - 1;
        boolean matches = c.isWhite(first)
                && c.isLongBody(first)
                && c.isSmallBody(star)
                && c.bodyBottom(star) > c.bodyTop(first)
                && c.isBlack(i)
                && c.close(i) < c.bodyMidpoint(first);
        return matches ? BEARISH : 0;
    }
}
