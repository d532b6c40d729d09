package com.techanalysis.indicator;

import com.techanalysis.exception.PipelineDefinitionException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;

/**
 * One named unit of the indicator pipeline.
 *
 * <p>A step declares the fields it reads and the fields it writes, each written field
 * carrying its {@link Sanitization} and whether it is exported to the result frame or
 * kept as a scratch column for later steps. The pipeline checks these declarations
 * when it is built and again while the step runs.
 */
@Getter
public final class DerivationStep {

    private final String name;
    private final Set<String> reads;
    private final Map<String, OutputField> writes;

    /** Number of leading rows the step needs before its outputs are defined. */
    private final int lookback;

    private final Derivation derivation;

    private DerivationStep(Builder builder) {
        this.name = builder.name;
        this.reads = Collections.unmodifiableSet(new LinkedHashSet<>(builder.reads));
        this.writes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.writes));
        this.lookback = builder.lookback;
        this.derivation = builder.derivation;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /** Computes the step's outputs and hands them to the context. */
    @FunctionalInterface
    public interface Derivation {
        void derive(DerivationContext context);
    }

    /** A column written by a step. */
    public record OutputField(String name, Sanitization sanitization, boolean exported) {}

    public static final class Builder {

        private final String name;
        private final Set<String> reads = new LinkedHashSet<>();
        private final Map<String, OutputField> writes = new LinkedHashMap<>();
        private int lookback;
        private Derivation derivation;

        private Builder(String name) {
            this.name = name;
        }

        public Builder reads(String... fields) {
            reads.addAll(Arrays.asList(fields));
            return this;
        }

        /** Declares an exported field. */
        public Builder field(String field, Sanitization sanitization) {
            return output(new OutputField(field, sanitization, true));
        }

        /** Declares a scratch column, visible to later steps but not exported. */
        public Builder scratch(String field, Sanitization sanitization) {
            return output(new OutputField(field, sanitization, false));
        }

        public Builder lookback(int lookback) {
            this.lookback = lookback;
            return this;
        }

        public Builder derive(Derivation derivation) {
            this.derivation = derivation;
            return this;
        }

        public DerivationStep build() {
            if (derivation == null) {
                throw new PipelineDefinitionException("Step " + name + " has no derivation");
            }
            if (writes.isEmpty()) {
                throw new PipelineDefinitionException("Step " + name + " writes no fields");
            }
            return new DerivationStep(this);
        }

        private Builder output(OutputField field) {
            if (writes.putIfAbsent(field.name(), field) != null) {
                throw new PipelineDefinitionException("Step " + name + " declares " + field.name() + " twice");
            }
            return this;
        }
    }
}
