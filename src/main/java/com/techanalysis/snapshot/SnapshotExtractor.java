package com.techanalysis.snapshot;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.DerivedFrame;
import com.techanalysis.domain.model.PatternResult;
import com.techanalysis.domain.model.SnapshotRow;
import com.techanalysis.domain.model.WindowSpec;
import com.techanalysis.exception.ValidationException;
import com.techanalysis.indicator.IndicatorPipeline;
import com.techanalysis.pattern.PatternClassificationEngine;
import com.techanalysis.window.WindowController;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces the indicator and pattern computations to the latest row for one instrument.
 *
 * <p>Both operations take a caller-defined column list {@code [dateColumn, codeColumn,
 * field...]} and never fail on thin or degenerate history:
 * <ul>
 *   <li>{@link #latestIndicatorRow} falls back to a row of zeros, stamped with the
 *       requested date and code, when fewer than two bars exist up to the as-of date or
 *       when the pipeline cannot produce a frame.</li>
 *   <li>{@link #latestPatternRow} returns empty when there is too little history or when
 *       none of the requested patterns fired on the latest bar.</li>
 * </ul>
 *
 * <p>A lookback shorter than the pipeline's longest look-back is accepted; the long-window
 * fields then read 0. It is logged once per distinct lookback value. A non-positive
 * lookback or calc window is treated like any other failed computation. Only a column
 * list without date and code columns is rejected.
 */
public class SnapshotExtractor {

    private static final Logger log = LoggerFactory.getLogger(SnapshotExtractor.class);

    private static final int MIN_BARS = 2;

    private final IndicatorPipeline pipeline;
    private final PatternClassificationEngine patternEngine;
    private final WindowController windowController;
    private final Set<Integer> reportedShortLookbacks = ConcurrentHashMap.newKeySet();

    public SnapshotExtractor(
            IndicatorPipeline pipeline, PatternClassificationEngine patternEngine, WindowController windowController) {
        this.pipeline = pipeline;
        this.patternEngine = patternEngine;
        this.windowController = windowController;
    }

    /**
     * Latest indicator values as of {@code asOfDate}, computed over at most {@code lookback}
     * bars. A null {@code asOfDate} means the latest available bar. Unknown fields and any
     * non-finite value read as 0.
     */
    public SnapshotRow<Double> latestIndicatorRow(
            String code, List<Bar> bars, LocalDate asOfDate, Integer lookback, List<String> columns) {
        List<String> fields = requestedFields(columns);
        LocalDate date = identityDate(bars, asOfDate);

        if (available(bars, asOfDate) < MIN_BARS) {
            log.debug("Not enough history for {} up to {}, returning zeros", code, date);
            return zeroIndicatorRow(columns, date, code, fields);
        }

        DerivedFrame frame;
        try {
            WindowSpec windowSpec = WindowSpec.snapshot(asOfDate, lookback);
            warnIfShort(lookback);
            List<Bar> window = windowController.slice(bars, windowSpec);
            frame = windowController.truncate(pipeline.run(code, window), windowSpec.getOutputWindow());
        } catch (RuntimeException e) {
            log.error("Indicator snapshot failed for {} as of {}: {}", code, date, e.getMessage(), e);
            return zeroIndicatorRow(columns, date, code, fields);
        }
        if (frame.isEmpty()) {
            log.error("Indicator snapshot for {} as of {} produced no rows", code, date);
            return zeroIndicatorRow(columns, date, code, fields);
        }

        int last = frame.size() - 1;
        Map<String, Double> values = new LinkedHashMap<>();
        for (String field : fields) {
            double value = frame.hasField(field) ? frame.value(last, field) : 0.0;
            values.put(field, Double.isFinite(value) ? value : 0.0);
        }
        return new SnapshotRow<>(columns, date, code, values);
    }

    /**
     * Latest pattern codes as of {@code asOfDate}, or empty when there is nothing to report.
     * Patterns the engine does not know read as 0.
     */
    public Optional<SnapshotRow<Integer>> latestPatternRow(
            String code, List<Bar> bars, LocalDate asOfDate, Integer calcWindow, List<String> columns) {
        List<String> patterns = requestedFields(columns);

        if (available(bars, asOfDate) < MIN_BARS) {
            return Optional.empty();
        }

        PatternResult result;
        try {
            result = patternEngine.computePatterns(code, bars, WindowSpec.snapshot(asOfDate, calcWindow));
        } catch (RuntimeException e) {
            log.error("Pattern snapshot failed for {} as of {}: {}", code, asOfDate, e.getMessage(), e);
            return Optional.empty();
        }
        if (result.isEmpty()) {
            return Optional.empty();
        }

        int last = result.size() - 1;
        Map<String, Integer> values = new LinkedHashMap<>();
        boolean signal = false;
        for (String pattern : patterns) {
            int value = result.value(last, pattern);
            values.put(pattern, value);
            signal |= value != 0;
        }
        if (!signal) {
            return Optional.empty();
        }
        return Optional.of(new SnapshotRow<>(columns, identityDate(bars, asOfDate), code, values));
    }

    private int available(List<Bar> bars, LocalDate asOfDate) {
        return asOfDate == null ? bars.size() : windowController.availableUpTo(bars, asOfDate);
    }

    private void warnIfShort(Integer lookback) {
        if (lookback != null && lookback < pipeline.maxLookback() && reportedShortLookbacks.add(lookback)) {
            log.warn("Snapshot lookback {} is shorter than the longest indicator look-back {}, "
                    + "long-window fields will read 0", lookback, pipeline.maxLookback());
        }
    }

    private static SnapshotRow<Double> zeroIndicatorRow(
            List<String> columns, LocalDate date, String code, List<String> fields) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (String field : fields) {
            values.put(field, 0.0);
        }
        return new SnapshotRow<>(columns, date, code, values);
    }

    private static List<String> requestedFields(List<String> columns) {
        if (columns == null || columns.size() < 2) {
            throw new ValidationException(
                    "Snapshot columns must start with a date and a code column", Map.of("columns", String.valueOf(columns)));
        }
        return columns.subList(2, columns.size());
    }

    private static LocalDate identityDate(List<Bar> bars, LocalDate asOfDate) {
        if (asOfDate != null || bars.isEmpty()) {
            return asOfDate;
        }
        return bars.get(bars.size() - 1).getDate();
    }
}
