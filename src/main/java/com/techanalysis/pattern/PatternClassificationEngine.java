package com.techanalysis.pattern;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.PatternResult;
import com.techanalysis.domain.model.WindowSpec;
import com.techanalysis.window.WindowController;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a set of named {@link PatternClassifier}s over a window of bars.
 *
 * <p>Classifiers are independent of each other. One that throws, or returns the wrong
 * number of codes, is recorded as failed and logged; its pattern simply has no column
 * in the result and reads as 0. Codes are passed through as returned.
 */
public class PatternClassificationEngine {

    private static final Logger log = LoggerFactory.getLogger(PatternClassificationEngine.class);

    private final Map<String, PatternClassifier> classifiers;
    private final WindowController windowController;

    public PatternClassificationEngine(Map<String, PatternClassifier> classifiers, WindowController windowController) {
        this.classifiers = Collections.unmodifiableMap(new LinkedHashMap<>(classifiers));
        this.windowController = windowController;
    }

    public List<String> patternNames() {
        return List.copyOf(classifiers.keySet());
    }

    /**
     * Slices {@code bars} with the window's end date and calc window, classifies every
     * remaining bar and keeps the last {@code outputWindow} rows.
     */
    public PatternResult computePatterns(String code, List<Bar> bars, WindowSpec windowSpec) {
        List<Bar> window = windowController.slice(bars, windowSpec);
        return windowController.truncate(classify(code, window), windowSpec.getOutputWindow());
    }

    /** Classifies every bar of {@code bars} as given. */
    public PatternResult classify(String code, List<Bar> bars) {
        int size = bars.size();
        double[] open = new double[size];
        double[] high = new double[size];
        double[] low = new double[size];
        double[] close = new double[size];
        for (int i = 0; i < size; i++) {
            Bar bar = bars.get(i);
            open[i] = bar.getOpen();
            high[i] = bar.getHigh();
            low[i] = bar.getLow();
            close[i] = bar.getClose();
        }

        Map<String, int[]> columns = new LinkedHashMap<>();
        Set<String> failed = new LinkedHashSet<>();
        for (Map.Entry<String, PatternClassifier> entry : classifiers.entrySet()) {
            String pattern = entry.getKey();
            try {
                // Each classifier gets its own copies so none can disturb the next.
                int[] codes = entry.getValue().classify(open.clone(), high.clone(), low.clone(), close.clone());
                if (codes == null || codes.length != size) {
                    log.warn("Pattern {} for {} returned {} codes for {} bars, ignoring it",
                            pattern, code, codes == null ? "no" : codes.length, size);
                    failed.add(pattern);
                    continue;
                }
                columns.put(pattern, codes);
            } catch (RuntimeException e) {
                log.warn("Pattern {} failed for {}: {}", pattern, code, e.getMessage());
                failed.add(pattern);
            }
        }

        if (!failed.isEmpty()) {
            log.debug("{} of {} patterns failed for {}: {}", failed.size(), classifiers.size(), code, failed);
        }
        return new PatternResult(code, bars, new ArrayList<>(classifiers.keySet()), columns, failed);
    }
}
