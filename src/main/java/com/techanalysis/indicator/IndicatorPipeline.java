package com.techanalysis.indicator;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.DerivedFrame;
import com.techanalysis.exception.PipelineDefinitionException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.ta4j.core.BarSeries;

/**
 * Ordered list of {@link DerivationStep}s that turns a window of bars into a
 * {@link DerivedFrame}.
 *
 * <p>The wiring is checked once, at construction: every field a step reads must be a
 * base field or be written by a strictly earlier step, and no field may be written by
 * two steps. A pipeline is immutable after that and can be shared across threads; all
 * mutable state (columns, ta4j series) lives in a single {@link #run} call.
 */
public class IndicatorPipeline {

    private static final Logger log = LoggerFactory.getLogger(IndicatorPipeline.class);

    public static final List<String> BASE_FIELDS =
            List.of("open", "high", "low", "close", "volume", "amount", "p_change");

    private final List<DerivationStep> steps;
    private final List<String> exportedFields;
    private final int maxLookback;

    public IndicatorPipeline(List<DerivationStep> steps) {
        this.steps = List.copyOf(steps);
        this.exportedFields = validate(this.steps);
        this.maxLookback = this.steps.stream()
                .mapToInt(DerivationStep::getLookback)
                .max()
                .orElse(0);
    }

    /**
     * Runs every step over {@code bars} and returns the exported fields, one row per bar.
     * An empty bar list produces an empty frame.
     */
    public DerivedFrame run(String code, List<Bar> bars) {
        int size = bars.size();
        Map<String, double[]> columns = baseColumns(bars);
        BarSeries series = BarSeriesFactory.fromBars(code, bars);

        for (DerivationStep step : steps) {
            DerivationContext context = new DerivationContext(step, columns, series, size);
            step.getDerivation().derive(context);
            context.verifyComplete();
        }

        Map<String, double[]> exported = new LinkedHashMap<>();
        for (String field : exportedFields) {
            exported.put(field, columns.get(field));
        }
        log.debug("Derived {} fields over {} bars for {}", exported.size(), size, code);
        return new DerivedFrame(code, bars, exported);
    }

    public int maxLookback() {
        return maxLookback;
    }

    /** Exported field names in derivation order. */
    public List<String> exportedFields() {
        return exportedFields;
    }

    public List<DerivationStep> getSteps() {
        return steps;
    }

    private static List<String> validate(List<DerivationStep> steps) {
        Set<String> available = new HashSet<>(BASE_FIELDS);
        Map<String, String> writers = new HashMap<>();
        List<String> exported = new ArrayList<>();

        for (DerivationStep step : steps) {
            for (String read : step.getReads()) {
                if (!available.contains(read)) {
                    throw new PipelineDefinitionException(
                            "Step " + step.getName() + " reads " + read + " before any step writes it",
                            Map.of("step", step.getName(), "field", read));
                }
            }
            for (DerivationStep.OutputField output : step.getWrites().values()) {
                String field = output.name();
                String previous = BASE_FIELDS.contains(field) ? "base fields" : writers.get(field);
                if (previous != null) {
                    throw new PipelineDefinitionException(
                            "Field " + field + " written by " + step.getName() + " is already written by " + previous,
                            Map.of("step", step.getName(), "field", field));
                }
                writers.put(field, step.getName());
                if (output.exported()) {
                    exported.add(field);
                }
            }
            // A step's own outputs become readable only to later steps.
            available.addAll(step.getWrites().keySet());
        }
        return Collections.unmodifiableList(exported);
    }

    private static Map<String, double[]> baseColumns(List<Bar> bars) {
        Map<String, double[]> columns = new HashMap<>();
        columns.put("open", extract(bars, Bar::getOpen));
        columns.put("high", extract(bars, Bar::getHigh));
        columns.put("low", extract(bars, Bar::getLow));
        columns.put("close", extract(bars, Bar::getClose));
        columns.put("volume", extract(bars, Bar::getVolume));
        columns.put("amount", extract(bars, Bar::getAmount));
        columns.put("p_change", extract(bars, Bar::getPercentChange));
        return columns;
    }

    private static double[] extract(List<Bar> bars, ToDoubleFunction<Bar> field) {
        double[] values = new double[bars.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = field.applyAsDouble(bars.get(i));
        }
        return values;
    }
}
