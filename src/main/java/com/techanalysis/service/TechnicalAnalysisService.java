package com.techanalysis.service;

import com.techanalysis.config.AnalysisConfig;
import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.DerivedFrame;
import com.techanalysis.domain.model.PatternResult;
import com.techanalysis.domain.model.SnapshotRow;
import com.techanalysis.domain.model.WindowSpec;
import com.techanalysis.indicator.IndicatorPipeline;
import com.techanalysis.pattern.PatternClassificationEngine;
import com.techanalysis.snapshot.SnapshotExtractor;
import com.techanalysis.window.WindowController;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers that hold bar series in memory: batch indicator and pattern
 * computation, the latest-row snapshots, and their multi-instrument variants.
 *
 * <p>Overloads without a {@link WindowSpec} or lookback use the defaults from
 * {@link AnalysisConfig}; an explicit window is applied exactly as given.
 *
 * <p>The multi-instrument operations run one task per instrument on the
 * {@code analysisExecutor}. Runs share nothing, so an instrument that fails is logged
 * and left out of the result while the others complete normally.
 */
@Service
public class TechnicalAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(TechnicalAnalysisService.class);

    private final IndicatorPipeline indicatorPipeline;
    private final PatternClassificationEngine patternClassificationEngine;
    private final SnapshotExtractor snapshotExtractor;
    private final WindowController windowController;
    private final AnalysisConfig analysisConfig;
    private final Executor analysisExecutor;

    public TechnicalAnalysisService(
            IndicatorPipeline indicatorPipeline,
            PatternClassificationEngine patternClassificationEngine,
            SnapshotExtractor snapshotExtractor,
            WindowController windowController,
            AnalysisConfig analysisConfig,
            @Qualifier("analysisExecutor") Executor analysisExecutor) {
        this.indicatorPipeline = indicatorPipeline;
        this.patternClassificationEngine = patternClassificationEngine;
        this.snapshotExtractor = snapshotExtractor;
        this.windowController = windowController;
        this.analysisConfig = analysisConfig;
        this.analysisExecutor = analysisExecutor;
    }

    public DerivedFrame computeIndicators(String code, List<Bar> bars) {
        return computeIndicators(code, bars, defaultIndicatorWindow());
    }

    /**
     * Derives every indicator field: end-date filter, calc window, full pipeline run,
     * then output window.
     */
    public DerivedFrame computeIndicators(String code, List<Bar> bars, WindowSpec windowSpec) {
        List<Bar> window = windowController.slice(bars, windowSpec);
        DerivedFrame frame = indicatorPipeline.run(code, window);
        log.debug("Computed indicators for {} over {} of {} bars", code, window.size(), bars.size());
        return windowController.truncate(frame, windowSpec.getOutputWindow());
    }

    public PatternResult computePatterns(String code, List<Bar> bars) {
        return computePatterns(code, bars, defaultPatternWindow());
    }

    public PatternResult computePatterns(String code, List<Bar> bars, WindowSpec windowSpec) {
        return patternClassificationEngine.computePatterns(code, bars, windowSpec);
    }

    public SnapshotRow<Double> latestIndicatorRow(
            String code, List<Bar> bars, LocalDate asOfDate, List<String> columns) {
        return latestIndicatorRow(code, bars, asOfDate, analysisConfig.getSnapshotLookback(), columns);
    }

    public SnapshotRow<Double> latestIndicatorRow(
            String code, List<Bar> bars, LocalDate asOfDate, Integer lookback, List<String> columns) {
        return snapshotExtractor.latestIndicatorRow(code, bars, asOfDate, lookback, columns);
    }

    public Optional<SnapshotRow<Integer>> latestPatternRow(
            String code, List<Bar> bars, LocalDate asOfDate, List<String> columns) {
        return snapshotExtractor.latestPatternRow(
                code, bars, asOfDate, analysisConfig.getPatternCalcWindow(), columns);
    }

    /** Indicator frames per instrument, in the iteration order of {@code barsByCode}. */
    public Map<String, DerivedFrame> computeIndicatorsForAll(Map<String, List<Bar>> barsByCode, WindowSpec windowSpec) {
        return forEachInstrument(barsByCode, "indicators", (code, bars) -> computeIndicators(code, bars, windowSpec));
    }

    public Map<String, DerivedFrame> computeIndicatorsForAll(Map<String, List<Bar>> barsByCode) {
        return computeIndicatorsForAll(barsByCode, defaultIndicatorWindow());
    }

    /** Pattern results per instrument, in the iteration order of {@code barsByCode}. */
    public Map<String, PatternResult> computePatternsForAll(Map<String, List<Bar>> barsByCode, WindowSpec windowSpec) {
        return forEachInstrument(barsByCode, "patterns", (code, bars) -> computePatterns(code, bars, windowSpec));
    }

    public Map<String, PatternResult> computePatternsForAll(Map<String, List<Bar>> barsByCode) {
        return computePatternsForAll(barsByCode, defaultPatternWindow());
    }

    private <T> Map<String, T> forEachInstrument(
            Map<String, List<Bar>> barsByCode, String what, BiFunction<String, List<Bar>, T> task) {
        Map<String, CompletableFuture<T>> futures = new LinkedHashMap<>();
        barsByCode.forEach((code, bars) ->
                futures.put(code, CompletableFuture.supplyAsync(() -> task.apply(code, bars), analysisExecutor)));

        Map<String, T> results = new LinkedHashMap<>();
        futures.forEach((code, future) -> {
            try {
                results.put(code, future.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Computing {} failed for {}: {}", what, code, cause.getMessage(), cause);
            }
        });

        log.info("Computed {} for {} of {} instruments", what, results.size(), barsByCode.size());
        return results;
    }

    private WindowSpec defaultIndicatorWindow() {
        return WindowSpec.of(null, null, analysisConfig.getOutputWindow());
    }

    private WindowSpec defaultPatternWindow() {
        return WindowSpec.of(null, analysisConfig.getPatternCalcWindow(), analysisConfig.getOutputWindow());
    }
}
