package com.techanalysis.indicator;

import static com.techanalysis.indicator.Sanitization.NAN_AND_INFINITY;
import static com.techanalysis.indicator.Sanitization.NAN_ONLY;
import static com.techanalysis.indicator.Sanitization.NONE;

import java.util.List;

/**
 * The standard indicator table.
 *
 * <p>Steps are listed in derivation order; families that share an intermediate (the
 * average price, the previous close, ATR, the 10-bar close average) read it from the
 * scratch column of the step that produced it. Each output's sanitization is part of the
 * table and differs per field: fields obtained by division or differencing use
 * {@link Sanitization#NAN_AND_INFINITY}, most smoothed fields {@link Sanitization#NAN_ONLY}.
 */
public final class StandardIndicators {

    static final String OPEN = "open";
    static final String HIGH = "high";
    static final String LOW = "low";
    static final String CLOSE = "close";
    static final String VOLUME = "volume";
    static final String AMOUNT = "amount";
    static final String PERCENT_CHANGE = "p_change";

    private static final double SUPERTREND_MULTIPLIER = 3.0;

    private StandardIndicators() {}

    public static IndicatorPipeline pipeline() {
        return new IndicatorPipeline(steps());
    }

    public static List<DerivationStep> steps() {
        return List.of(
                macd(),
                kdj(),
                kdjj(),
                bollinger(),
                trix(),
                averagePrice(),
                cr(),
                rsi(),
                vr(),
                previousClose(),
                trueRange(),
                directionalMovement(),
                williamsR(),
                cci(),
                dma(),
                tema(),
                mfi(),
                vwma(),
                ppo(),
                stochRsi(),
                waveTrend(),
                supertrend(),
                roc(),
                obv(),
                sar(),
                psy(),
                brar(),
                emv(),
                bias(),
                dpo(),
                vhf(),
                rvi(),
                forceIndex(),
                ene(),
                volumeAverages(),
                priceAverages());
    }

    static DerivationStep macd() {
        return DerivationStep.builder("macd")
                .reads(CLOSE)
                .lookback(33)
                .field("macd", NAN_ONLY)
                .field("macds", NAN_ONLY)
                .field("macdh", NAN_ONLY)
                .derive(ctx -> {
                    Ta4jPrimitives.MacdLines lines = Ta4jPrimitives.macd(ctx.indicator(CLOSE), 12, 26, 9);
                    ctx.put("macd", lines.macd());
                    ctx.put("macds", lines.signal());
                    ctx.put("macdh", lines.histogram());
                })
                .build();
    }

    static DerivationStep kdj() {
        return DerivationStep.builder("kdj")
                .reads(HIGH, LOW, CLOSE)
                .lookback(16)
                .field("kdjk", NAN_ONLY)
                .field("kdjd", NAN_ONLY)
                .derive(ctx -> {
                    Ta4jPrimitives.StochasticLines lines = Ta4jPrimitives.stochastic(ctx.series(), 9, 5, 5);
                    ctx.put("kdjk", lines.k());
                    ctx.put("kdjd", lines.d());
                })
                .build();
    }

    static DerivationStep kdjj() {
        return DerivationStep.builder("kdjj")
                .reads("kdjk", "kdjd")
                .lookback(16)
                .field("kdjj", NONE)
                .derive(ctx -> ctx.put(
                        "kdjj", SeriesMath.combine(ctx.column("kdjk"), ctx.column("kdjd"), (k, d) -> 3 * k - 2 * d)))
                .build();
    }

    static DerivationStep bollinger() {
        return DerivationStep.builder("boll")
                .reads(CLOSE)
                .lookback(19)
                .field("boll_ub", NAN_ONLY)
                .field("boll", NAN_ONLY)
                .field("boll_lb", NAN_ONLY)
                .derive(ctx -> {
                    Ta4jPrimitives.Bands bands = Ta4jPrimitives.bollinger(ctx.indicator(CLOSE), 20, 2.0);
                    ctx.put("boll_ub", bands.upper());
                    ctx.put("boll", bands.middle());
                    ctx.put("boll_lb", bands.lower());
                })
                .build();
    }

    static DerivationStep trix() {
        return DerivationStep.builder("trix")
                .reads(CLOSE)
                .lookback(34 + 19)
                .field("trix", NAN_ONLY)
                .field("trix_20_sma", NAN_ONLY)
                .derive(ctx -> {
                    double[] trix = ctx.put("trix", Ta4jPrimitives.trix(ctx.indicator(CLOSE), 12));
                    ctx.put("trix_20_sma", Ta4jPrimitives.sma(ctx.indicatorOf(trix), 20));
                })
                .build();
    }

    /** Average traded price, NaN on bars without volume. */
    static DerivationStep averagePrice() {
        return DerivationStep.builder("m_price")
                .reads(AMOUNT, VOLUME)
                .scratch("m_price", NONE)
                .derive(ctx -> ctx.put(
                        "m_price",
                        SeriesMath.combine(
                                ctx.column(AMOUNT),
                                ctx.column(VOLUME),
                                (amount, volume) -> volume == 0.0 ? Double.NaN : amount / volume)))
                .build();
    }

    static DerivationStep cr() {
        return DerivationStep.builder("cr")
                .reads("m_price", HIGH, LOW)
                .lookback(25 + 19)
                .field("cr", NAN_AND_INFINITY)
                .field("cr-ma1", NAN_ONLY)
                .field("cr-ma2", NAN_ONLY)
                .field("cr-ma3", NAN_ONLY)
                .derive(ctx -> {
                    double[] previousMid = SeriesMath.shift(ctx.column("m_price"), 1, 0.0);
                    double[] high = ctx.column(HIGH);
                    double[] low = ctx.column(LOW);
                    double[] strength = SeriesMath.rollingSum(
                            SeriesMath.combine(high, previousMid, (h, m) -> h - Math.min(m, h)), 26);
                    double[] weakness = SeriesMath.rollingSum(
                            SeriesMath.combine(previousMid, low, (m, l) -> m - Math.min(m, l)), 26);
                    double[] cr = ctx.put("cr", SeriesMath.combine(strength, weakness, (s, w) -> 100 * s / w));
                    ctx.put("cr-ma1", Ta4jPrimitives.sma(ctx.indicatorOf(cr), 5));
                    ctx.put("cr-ma2", Ta4jPrimitives.sma(ctx.indicatorOf(cr), 10));
                    ctx.put("cr-ma3", Ta4jPrimitives.sma(ctx.indicatorOf(cr), 20));
                })
                .build();
    }

    static DerivationStep rsi() {
        return DerivationStep.builder("rsi")
                .reads(CLOSE)
                .lookback(24)
                .field("rsi", NAN_ONLY)
                .field("rsi_6", NAN_ONLY)
                .field("rsi_12", NAN_ONLY)
                .field("rsi_24", NAN_ONLY)
                .derive(ctx -> {
                    ctx.put("rsi", Ta4jPrimitives.rsi(ctx.indicator(CLOSE), 14));
                    ctx.put("rsi_6", Ta4jPrimitives.rsi(ctx.indicator(CLOSE), 6));
                    ctx.put("rsi_12", Ta4jPrimitives.rsi(ctx.indicator(CLOSE), 12));
                    ctx.put("rsi_24", Ta4jPrimitives.rsi(ctx.indicator(CLOSE), 24));
                })
                .build();
    }

    static DerivationStep vr() {
        return DerivationStep.builder("vr")
                .reads(VOLUME, PERCENT_CHANGE)
                .lookback(25 + 5)
                .field("vr", NAN_AND_INFINITY)
                .field("vr_6_sma", NAN_ONLY)
                .derive(ctx -> {
                    double[] volume = ctx.column(VOLUME);
                    double[] change = ctx.column(PERCENT_CHANGE);
                    double[] up = SeriesMath.rollingSum(SeriesMath.combine(change, volume, (c, v) -> c > 0 ? v : 0), 26);
                    double[] down = SeriesMath.rollingSum(SeriesMath.combine(change, volume, (c, v) -> c < 0 ? v : 0), 26);
                    double[] flat = SeriesMath.rollingSum(SeriesMath.combine(change, volume, (c, v) -> c == 0 ? v : 0), 26);
                    double[] vr = new double[ctx.size()];
                    for (int i = 0; i < vr.length; i++) {
                        vr[i] = 100 * (up[i] + flat[i] / 2) / (down[i] + flat[i] / 2);
                    }
                    vr = ctx.put("vr", vr);
                    ctx.put("vr_6_sma", Ta4jPrimitives.sma(ctx.indicatorOf(vr), 6));
                })
                .build();
    }

    static DerivationStep previousClose() {
        return DerivationStep.builder("prev_close")
                .reads(CLOSE)
                .scratch("prev_close", NONE)
                .derive(ctx -> ctx.put("prev_close", SeriesMath.shift(ctx.column(CLOSE), 1, 0.0)))
                .build();
    }

    static DerivationStep trueRange() {
        return DerivationStep.builder("tr")
                .reads(HIGH, LOW, CLOSE, "prev_close")
                .lookback(14)
                .field("tr", NAN_ONLY)
                .field("atr", NAN_ONLY)
                .derive(ctx -> {
                    double[] high = ctx.column(HIGH);
                    double[] low = ctx.column(LOW);
                    double[] previous = ctx.column("prev_close");
                    double[] tr = new double[ctx.size()];
                    for (int i = 0; i < tr.length; i++) {
                        tr[i] = Math.max(high[i] - low[i],
                                Math.max(Math.abs(high[i] - previous[i]), Math.abs(previous[i] - low[i])));
                    }
                    ctx.put("tr", tr);
                    ctx.put("atr", Ta4jPrimitives.atr(ctx.series(), 14));
                })
                .build();
    }

    static DerivationStep directionalMovement() {
        return DerivationStep.builder("dmi")
                .reads(HIGH, LOW, "atr")
                .lookback(13 + 5 + 5)
                .scratch("pdm", NAN_ONLY)
                .scratch("mdm", NAN_ONLY)
                .field("pdi", NAN_AND_INFINITY)
                .field("mdi", NAN_AND_INFINITY)
                .field("dx", NAN_AND_INFINITY)
                .field("adx", NAN_ONLY)
                .field("adxr", NAN_ONLY)
                .derive(ctx -> {
                    double[] upMove = SeriesMath.map(SeriesMath.diff(ctx.column(HIGH)), d -> (d + Math.abs(d)) / 2);
                    double[] downMove = SeriesMath.map(SeriesMath.diff(ctx.column(LOW)), d -> (-d + Math.abs(d)) / 2);
                    double[] plusMove = SeriesMath.combine(upMove, downMove, (up, down) -> up > down ? up : 0);
                    double[] minusMove = SeriesMath.combine(downMove, upMove, (down, up) -> down > up ? down : 0);
                    double[] atr = ctx.column("atr");

                    double[] pdm = ctx.put("pdm", Ta4jPrimitives.ema(ctx.indicatorOf(plusMove), 14));
                    double[] mdm = ctx.put("mdm", Ta4jPrimitives.ema(ctx.indicatorOf(minusMove), 14));
                    double[] pdi = ctx.put("pdi", SeriesMath.combine(pdm, atr, (dm, range) -> 100 * dm / range));
                    double[] mdi = ctx.put("mdi", SeriesMath.combine(mdm, atr, (dm, range) -> 100 * dm / range));
                    double[] dx = ctx.put(
                            "dx", SeriesMath.combine(pdi, mdi, (p, m) -> 100 * Math.abs(p - m) / (p + m)));
                    double[] adx = ctx.put("adx", Ta4jPrimitives.ema(ctx.indicatorOf(dx), 6));
                    ctx.put("adxr", Ta4jPrimitives.ema(ctx.indicatorOf(adx), 6));
                })
                .build();
    }

    static DerivationStep williamsR() {
        return DerivationStep.builder("wr")
                .reads(HIGH, LOW, CLOSE)
                .lookback(13)
                .field("wr_6", NAN_ONLY)
                .field("wr_10", NAN_ONLY)
                .field("wr_14", NAN_ONLY)
                .derive(ctx -> {
                    ctx.put("wr_6", Ta4jPrimitives.williamsR(ctx.series(), 6));
                    ctx.put("wr_10", Ta4jPrimitives.williamsR(ctx.series(), 10));
                    ctx.put("wr_14", Ta4jPrimitives.williamsR(ctx.series(), 14));
                })
                .build();
    }

    static DerivationStep cci() {
        return DerivationStep.builder("cci")
                .reads(HIGH, LOW, CLOSE)
                .lookback(83)
                .field("cci", NAN_ONLY)
                .field("cci_84", NAN_ONLY)
                .derive(ctx -> {
                    ctx.put("cci", Ta4jPrimitives.cci(ctx.series(), 14));
                    ctx.put("cci_84", Ta4jPrimitives.cci(ctx.series(), 84));
                })
                .build();
    }

    static DerivationStep dma() {
        return DerivationStep.builder("dma")
                .reads(CLOSE)
                .lookback(49 + 9)
                .scratch("ma10", NAN_ONLY)
                .scratch("ma50", NAN_ONLY)
                .field("dma", NONE)
                .field("dma_10_sma", NAN_ONLY)
                .derive(ctx -> {
                    double[] ma10 = ctx.put("ma10", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 10));
                    double[] ma50 = ctx.put("ma50", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 50));
                    double[] dma = ctx.put("dma", SeriesMath.combine(ma10, ma50, (fast, slow) -> fast - slow));
                    ctx.put("dma_10_sma", Ta4jPrimitives.sma(ctx.indicatorOf(dma), 10));
                })
                .build();
    }

    static DerivationStep tema() {
        return DerivationStep.builder("tema")
                .reads(CLOSE)
                .lookback(39)
                .field("tema", NAN_ONLY)
                .derive(ctx -> ctx.put("tema", Ta4jPrimitives.tema(ctx.indicator(CLOSE), 14)))
                .build();
    }

    static DerivationStep mfi() {
        return DerivationStep.builder("mfi")
                .reads(HIGH, LOW, CLOSE, VOLUME)
                .lookback(14 + 5)
                .field("mfi", NAN_ONLY)
                .field("mfisma", NAN_ONLY)
                .derive(ctx -> {
                    double[] mfi = ctx.put("mfi", Ta4jPrimitives.moneyFlowIndex(ctx.series(), 14));
                    ctx.put("mfisma", Ta4jPrimitives.sma(ctx.indicatorOf(mfi), 6));
                })
                .build();
    }

    static DerivationStep vwma() {
        return DerivationStep.builder("vwma")
                .reads(AMOUNT, VOLUME)
                .lookback(13 + 5)
                .field("vwma", NAN_AND_INFINITY)
                .field("mvwma", NAN_ONLY)
                .derive(ctx -> {
                    double[] turnover = SeriesMath.rollingSum(ctx.column(AMOUNT), 14);
                    double[] volume = SeriesMath.rollingSum(ctx.column(VOLUME), 14);
                    double[] vwma = ctx.put("vwma", SeriesMath.combine(turnover, volume, (a, v) -> a / v));
                    ctx.put("mvwma", Ta4jPrimitives.sma(ctx.indicatorOf(vwma), 6));
                })
                .build();
    }

    static DerivationStep ppo() {
        return DerivationStep.builder("ppo")
                .reads(CLOSE)
                .lookback(25 + 8)
                .field("ppo", NAN_ONLY)
                .field("ppos", NAN_ONLY)
                .field("ppoh", NONE)
                .derive(ctx -> {
                    double[] ppo = ctx.put("ppo", Ta4jPrimitives.ppo(ctx.indicator(CLOSE), 12, 26));
                    double[] signal = ctx.put("ppos", Ta4jPrimitives.ema(ctx.indicatorOf(ppo), 9));
                    ctx.put("ppoh", SeriesMath.combine(ppo, signal, (p, s) -> p - s));
                })
                .build();
    }

    static DerivationStep stochRsi() {
        return DerivationStep.builder("stochrsi")
                .reads("rsi")
                .lookback(14 + 13 + 2)
                .field("stochrsi_k", NAN_AND_INFINITY)
                .field("stochrsi_d", NAN_ONLY)
                .derive(ctx -> {
                    double[] rsi = ctx.column("rsi");
                    double[] low = Ta4jPrimitives.lowest(ctx.indicator("rsi"), 14);
                    double[] high = Ta4jPrimitives.highest(ctx.indicator("rsi"), 14);
                    double[] k = new double[ctx.size()];
                    for (int i = 0; i < k.length; i++) {
                        k[i] = 100 * (rsi[i] - low[i]) / (high[i] - low[i]);
                    }
                    k = ctx.put("stochrsi_k", k);
                    ctx.put("stochrsi_d", Ta4jPrimitives.sma(ctx.indicatorOf(k), 3));
                })
                .build();
    }

    static DerivationStep waveTrend() {
        return DerivationStep.builder("wt")
                .reads("m_price")
                .lookback(9 + 9 + 20 + 3)
                .scratch("esa", NAN_ONLY)
                .scratch("esa_d", NONE)
                .scratch("esa_ci", NAN_AND_INFINITY)
                .field("wt1", NAN_ONLY)
                .field("wt2", NAN_ONLY)
                .derive(ctx -> {
                    double[] rawPrice = ctx.column("m_price");
                    // The recursive averages never recover from a NaN input.
                    double[] price = NAN_AND_INFINITY.apply(rawPrice.clone());
                    double[] esa = ctx.put("esa", Ta4jPrimitives.ema(ctx.indicatorOf(price), 10));
                    double[] distance = SeriesMath.combine(price, esa, (p, e) -> Math.abs(p - e));
                    double[] esaD = ctx.put("esa_d", Ta4jPrimitives.ema(ctx.indicatorOf(distance), 10));
                    double[] channel = new double[ctx.size()];
                    for (int i = 0; i < channel.length; i++) {
                        channel[i] = (rawPrice[i] - esa[i]) / (0.015 * esaD[i]);
                    }
                    channel = ctx.put("esa_ci", channel);
                    double[] wt1 = ctx.put("wt1", Ta4jPrimitives.ema(ctx.indicatorOf(channel), 21));
                    ctx.put("wt2", Ta4jPrimitives.sma(ctx.indicatorOf(wt1), 4));
                })
                .build();
    }

    static DerivationStep supertrend() {
        return DerivationStep.builder("supertrend")
                .reads(HIGH, LOW, CLOSE, "atr")
                .lookback(14)
                .field("supertrend_ub", NONE)
                .field("supertrend_lb", NONE)
                .field("supertrend", NONE)
                .derive(ctx -> {
                    TrendBandState state = new TrendBandRecurrence(SUPERTREND_MULTIPLIER)
                            .compute(ctx.column(HIGH), ctx.column(LOW), ctx.column(CLOSE), ctx.column("atr"));
                    ctx.put("supertrend_ub", state.upper());
                    ctx.put("supertrend_lb", state.lower());
                    ctx.put("supertrend", state.trend());
                })
                .build();
    }

    static DerivationStep roc() {
        return DerivationStep.builder("roc")
                .reads(CLOSE)
                .lookback(12 + 8)
                .field("roc", NAN_ONLY)
                .field("rocma", NAN_ONLY)
                .field("rocema", NAN_ONLY)
                .derive(ctx -> {
                    double[] roc = ctx.put("roc", Ta4jPrimitives.roc(ctx.indicator(CLOSE), 12));
                    ctx.put("rocma", Ta4jPrimitives.sma(ctx.indicatorOf(roc), 6));
                    ctx.put("rocema", Ta4jPrimitives.ema(ctx.indicatorOf(roc), 9));
                })
                .build();
    }

    static DerivationStep obv() {
        return DerivationStep.builder("obv")
                .reads(CLOSE, VOLUME)
                .field("obv", NAN_ONLY)
                .derive(ctx -> ctx.put("obv", Ta4jPrimitives.onBalanceVolume(ctx.series())))
                .build();
    }

    static DerivationStep sar() {
        return DerivationStep.builder("sar")
                .reads(HIGH, LOW)
                .lookback(1)
                .field("sar", NAN_ONLY)
                .derive(ctx -> ctx.put("sar", Ta4jPrimitives.parabolicSar(ctx.series())))
                .build();
    }

    static DerivationStep psy() {
        return DerivationStep.builder("psy")
                .reads(CLOSE, "prev_close")
                .lookback(11 + 5)
                .field("psy", NAN_ONLY)
                .field("psyma", NAN_ONLY)
                .derive(ctx -> {
                    double[] rising = SeriesMath.combine(
                            ctx.column(CLOSE), ctx.column("prev_close"), (c, p) -> c > p ? 1.0 : 0.0);
                    double[] psy = ctx.put(
                            "psy", SeriesMath.map(SeriesMath.rollingSum(rising, 12), sum -> 100 * sum / 12.0));
                    ctx.put("psyma", Ta4jPrimitives.sma(ctx.indicatorOf(psy), 6));
                })
                .build();
    }

    static DerivationStep brar() {
        return DerivationStep.builder("brar")
                .reads(OPEN, HIGH, LOW, "prev_close")
                .lookback(25)
                .field("ar", NAN_AND_INFINITY)
                .field("br", NAN_AND_INFINITY)
                .derive(ctx -> {
                    double[] open = ctx.column(OPEN);
                    double[] high = ctx.column(HIGH);
                    double[] low = ctx.column(LOW);
                    double[] previous = ctx.column("prev_close");
                    double[] aboveOpen = SeriesMath.rollingSum(SeriesMath.combine(high, open, (h, o) -> h - o), 26);
                    double[] belowOpen = SeriesMath.rollingSum(SeriesMath.combine(open, low, (o, l) -> o - l), 26);
                    double[] abovePrevious =
                            SeriesMath.rollingSum(SeriesMath.combine(high, previous, (h, p) -> h - p), 26);
                    double[] belowPrevious =
                            SeriesMath.rollingSum(SeriesMath.combine(previous, low, (p, l) -> p - l), 26);
                    ctx.put("ar", SeriesMath.combine(aboveOpen, belowOpen, (up, down) -> 100 * up / down));
                    ctx.put("br", SeriesMath.combine(abovePrevious, belowPrevious, (up, down) -> 100 * up / down));
                })
                .build();
    }

    static DerivationStep emv() {
        return DerivationStep.builder("emv")
                .reads(HIGH, LOW, AMOUNT)
                .lookback(13 + 8)
                .field("emv", NAN_ONLY)
                .field("emva", NAN_ONLY)
                .derive(ctx -> {
                    double[] high = ctx.column(HIGH);
                    double[] low = ctx.column(LOW);
                    double[] amount = ctx.column(AMOUNT);
                    double[] previousHigh = SeriesMath.shift(high, 1, 0.0);
                    double[] previousLow = SeriesMath.shift(low, 1, 0.0);
                    double[] movement = new double[ctx.size()];
                    for (int i = 0; i < movement.length; i++) {
                        double midpointMove = (high[i] + low[i]) / 2 - (previousHigh[i] + previousLow[i]) / 2;
                        movement[i] = amount[i] == 0.0 ? Double.NaN : midpointMove * (high[i] - low[i]) / amount[i];
                    }
                    double[] emv = ctx.put("emv", SeriesMath.rollingSum(movement, 14));
                    ctx.put("emva", Ta4jPrimitives.sma(ctx.indicatorOf(emv), 9));
                })
                .build();
    }

    static DerivationStep bias() {
        return DerivationStep.builder("bias")
                .reads(CLOSE)
                .lookback(23)
                .scratch("ma6", NAN_ONLY)
                .scratch("ma12", NAN_ONLY)
                .scratch("ma24", NAN_ONLY)
                .field("bias", NAN_AND_INFINITY)
                .field("bias_12", NAN_AND_INFINITY)
                .field("bias_24", NAN_AND_INFINITY)
                .derive(ctx -> {
                    double[] close = ctx.column(CLOSE);
                    double[] ma6 = ctx.put("ma6", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 6));
                    double[] ma12 = ctx.put("ma12", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 12));
                    double[] ma24 = ctx.put("ma24", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 24));
                    ctx.put("bias", SeriesMath.combine(close, ma6, StandardIndicators::deviationPercent));
                    ctx.put("bias_12", SeriesMath.combine(close, ma12, StandardIndicators::deviationPercent));
                    ctx.put("bias_24", SeriesMath.combine(close, ma24, StandardIndicators::deviationPercent));
                })
                .build();
    }

    /** Detrended price against the previous bar's 11-bar average; row 0 carries the close. */
    static DerivationStep dpo() {
        return DerivationStep.builder("dpo")
                .reads(CLOSE)
                .lookback(10 + 1 + 5)
                .scratch("c_m_11", NONE)
                .field("dpo", NAN_ONLY)
                .field("madpo", NAN_ONLY)
                .derive(ctx -> {
                    double[] average = ctx.put("c_m_11", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 11));
                    double[] dpo = ctx.put(
                            "dpo",
                            SeriesMath.combine(ctx.column(CLOSE), SeriesMath.shift(average, 1, 0.0), (c, m) -> c - m));
                    ctx.put("madpo", Ta4jPrimitives.sma(ctx.indicatorOf(dpo), 6));
                })
                .build();
    }

    static DerivationStep vhf() {
        return DerivationStep.builder("vhf")
                .reads(CLOSE, "prev_close")
                .lookback(27)
                .scratch("hcp_lcp", NAN_ONLY)
                .field("vhf", NAN_ONLY)
                .derive(ctx -> {
                    double[] range = ctx.put(
                            "hcp_lcp",
                            SeriesMath.combine(
                                    Ta4jPrimitives.highest(ctx.indicator(CLOSE), 28),
                                    Ta4jPrimitives.lowest(ctx.indicator(CLOSE), 28),
                                    (h, l) -> h - l));
                    double[] travel = SeriesMath.rollingSum(
                            SeriesMath.combine(ctx.column(CLOSE), ctx.column("prev_close"), (c, p) -> Math.abs(c - p)),
                            28);
                    ctx.put("vhf", SeriesMath.combine(range, travel, (r, t) -> r / t));
                })
                .build();
    }

    static DerivationStep rvi() {
        return DerivationStep.builder("rvi")
                .reads(OPEN, HIGH, LOW, CLOSE)
                .lookback(3 + 9 + 3)
                .field("rvi", NAN_AND_INFINITY)
                .field("rvis", NONE)
                .derive(ctx -> {
                    double[] numerator = SeriesMath.symmetricWeighted(
                            SeriesMath.combine(ctx.column(CLOSE), ctx.column(OPEN), (c, o) -> c - o));
                    double[] denominator = SeriesMath.symmetricWeighted(
                            SeriesMath.combine(ctx.column(HIGH), ctx.column(LOW), (h, l) -> h - l));
                    double[] rvi = ctx.put(
                            "rvi",
                            SeriesMath.combine(
                                    Ta4jPrimitives.sma(ctx.indicatorOf(numerator), 10),
                                    Ta4jPrimitives.sma(ctx.indicatorOf(denominator), 10),
                                    (n, d) -> n / d));
                    ctx.put("rvis", SeriesMath.symmetricWeighted(rvi));
                })
                .build();
    }

    static DerivationStep forceIndex() {
        return DerivationStep.builder("fi")
                .reads(CLOSE, VOLUME)
                .lookback(12)
                .field("fi", NONE)
                .field("force_2", NAN_ONLY)
                .field("force_13", NAN_ONLY)
                .derive(ctx -> {
                    double[] fi = ctx.put(
                            "fi", SeriesMath.combine(SeriesMath.diff(ctx.column(CLOSE)), ctx.column(VOLUME), (d, v) -> d * v));
                    ctx.put("force_2", Ta4jPrimitives.ema(ctx.indicatorOf(fi), 2));
                    ctx.put("force_13", Ta4jPrimitives.ema(ctx.indicatorOf(fi), 13));
                })
                .build();
    }

    static DerivationStep ene() {
        return DerivationStep.builder("ene")
                .reads("ma10")
                .lookback(9)
                .field("ene_ue", NONE)
                .field("ene_le", NONE)
                .field("ene", NONE)
                .derive(ctx -> {
                    double[] ma10 = ctx.column("ma10");
                    double[] upper = ctx.put("ene_ue", SeriesMath.map(ma10, m -> (1 + 11 / 100.0) * m));
                    double[] lower = ctx.put("ene_le", SeriesMath.map(ma10, m -> (1 - 9 / 100.0) * m));
                    ctx.put("ene", SeriesMath.combine(upper, lower, (u, l) -> (u + l) / 2));
                })
                .build();
    }

    static DerivationStep volumeAverages() {
        return DerivationStep.builder("vol")
                .reads(VOLUME)
                .lookback(9)
                .field("vol_5", NAN_ONLY)
                .field("vol_10", NAN_ONLY)
                .derive(ctx -> {
                    ctx.put("vol_5", Ta4jPrimitives.sma(ctx.indicator(VOLUME), 5));
                    ctx.put("vol_10", Ta4jPrimitives.sma(ctx.indicator(VOLUME), 10));
                })
                .build();
    }

    static DerivationStep priceAverages() {
        return DerivationStep.builder("ma")
                .reads(CLOSE)
                .lookback(199)
                .field("ma20", NAN_ONLY)
                .field("ma200", NAN_ONLY)
                .derive(ctx -> {
                    ctx.put("ma20", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 20));
                    ctx.put("ma200", Ta4jPrimitives.sma(ctx.indicator(CLOSE), 200));
                })
                .build();
    }

    private static double deviationPercent(double value, double average) {
        return 100 * (value - average) / average;
    }
}
