package com.techanalysis.indicator;

import com.techanalysis.exception.PipelineDefinitionException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.ta4j.core.BarSeries;
import org.ta4j.core.Indicator;
import org.ta4j.core.num.Num;

/**
 * The view a {@link DerivationStep} gets of a single pipeline run.
 *
 * <p>Reads are limited to the step's declared inputs and writes to its declared
 * outputs. {@link #put} sanitizes on the way in and returns the stored values, so a
 * step that derives a second output from its first one always sees sanitized data.
 */
public final class DerivationContext {

    private final DerivationStep step;
    private final Map<String, double[]> columns;
    private final BarSeries series;
    private final int size;
    private final Set<String> written = new HashSet<>();

    DerivationContext(DerivationStep step, Map<String, double[]> columns, BarSeries series, int size) {
        this.step = step;
        this.columns = columns;
        this.series = series;
        this.size = size;
    }

    public int size() {
        return size;
    }

    /** The run's ta4j series. Steps using it declare the price fields they depend on. */
    public BarSeries series() {
        return series;
    }

    /** Returns a copy of a declared input column. */
    public double[] column(String field) {
        if (!step.getReads().contains(field)) {
            throw new PipelineDefinitionException("Step " + step.getName() + " reads undeclared field " + field);
        }
        return columns.get(field).clone();
    }

    /** A declared input column as a ta4j indicator over the run's series. */
    public Indicator<Num> indicator(String field) {
        return new ColumnIndicator(series, column(field));
    }

    /** Wraps values the step computed itself, typically one of its own outputs. */
    public Indicator<Num> indicatorOf(double[] values) {
        checkLength(values, "indicator input");
        return new ColumnIndicator(series, values);
    }

    /**
     * Stores a declared output after applying its sanitization.
     *
     * @return a copy of the stored, sanitized values
     */
    public double[] put(String field, double[] values) {
        DerivationStep.OutputField output = step.getWrites().get(field);
        if (output == null) {
            throw new PipelineDefinitionException("Step " + step.getName() + " writes undeclared field " + field);
        }
        if (!written.add(field)) {
            throw new PipelineDefinitionException("Step " + step.getName() + " writes " + field + " twice");
        }
        checkLength(values, field);
        double[] stored = output.sanitization().apply(values.clone());
        columns.put(field, stored);
        return stored.clone();
    }

    void verifyComplete() {
        for (String field : step.getWrites().keySet()) {
            if (!written.contains(field)) {
                throw new PipelineDefinitionException("Step " + step.getName() + " did not write " + field);
            }
        }
    }

    private void checkLength(double[] values, String field) {
        if (values.length != size) {
            throw new PipelineDefinitionException("Step " + step.getName() + " produced " + values.length
                    + " values for " + field + ", expected " + size);
        }
    }
}
