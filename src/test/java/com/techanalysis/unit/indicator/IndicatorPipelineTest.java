package com.techanalysis.unit.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.DerivedFrame;
import com.techanalysis.exception.ErrorCode;
import com.techanalysis.exception.PipelineDefinitionException;
import com.techanalysis.indicator.DerivationStep;
import com.techanalysis.indicator.IndicatorPipeline;
import com.techanalysis.indicator.Sanitization;
import com.techanalysis.indicator.SeriesMath;
import com.techanalysis.support.BarFixtures;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for IndicatorPipeline wiring checks, run-time contract enforcement and
 * write-time sanitization.
 */
class IndicatorPipelineTest {

    private final List<Bar> bars = BarFixtures.closes(0, 2, 4, 0);

    private static DerivationStep reciprocal(String name, String source, Sanitization sanitization) {
        return DerivationStep.builder(name)
                .reads(source)
                .field(name, sanitization)
                .derive(ctx -> ctx.put(name, SeriesMath.map(ctx.column(source), v -> 1 / v)))
                .build();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("rejects a read of a field no earlier step writes")
        void rejectsForwardReference() {
            DerivationStep consumer = reciprocal("inverse_ratio", "ratio", Sanitization.NONE);
            DerivationStep producer = reciprocal("ratio", "close", Sanitization.NONE);

            assertThatThrownBy(() -> new IndicatorPipeline(List.of(consumer, producer)))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("ratio")
                    .extracting(e -> ((PipelineDefinitionException) e).getErrorCode())
                    .isEqualTo(ErrorCode.PIPELINE_DEFINITION_ERROR);
        }

        @Test
        @DisplayName("accepts the same steps in dependency order")
        void acceptsDependencyOrder() {
            IndicatorPipeline pipeline = new IndicatorPipeline(List.of(
                    reciprocal("ratio", "close", Sanitization.NONE),
                    reciprocal("inverse_ratio", "ratio", Sanitization.NONE)));

            assertThat(pipeline.exportedFields()).containsExactly("ratio", "inverse_ratio");
        }

        @Test
        @DisplayName("rejects two steps writing the same field")
        void rejectsDuplicateWrite() {
            assertThatThrownBy(() -> new IndicatorPipeline(List.of(
                            reciprocal("ratio", "close", Sanitization.NONE),
                            reciprocal("ratio", "open", Sanitization.NONE))))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("already written");
        }

        @Test
        @DisplayName("rejects a step overwriting a base field")
        void rejectsBaseFieldWrite() {
            assertThatThrownBy(() -> new IndicatorPipeline(List.of(reciprocal("close", "open", Sanitization.NONE))))
                    .isInstanceOf(PipelineDefinitionException.class);
        }

        @Test
        @DisplayName("a step cannot read its own output")
        void rejectsSelfReference() {
            assertThatThrownBy(() -> new IndicatorPipeline(List.of(reciprocal("ratio", "ratio", Sanitization.NONE))))
                    .isInstanceOf(PipelineDefinitionException.class);
        }

        @Test
        @DisplayName("reports the longest declared look-back")
        void maxLookback() {
            DerivationStep shortStep = DerivationStep.builder("a")
                    .reads("close")
                    .lookback(5)
                    .field("a", Sanitization.NONE)
                    .derive(ctx -> ctx.put("a", ctx.column("close")))
                    .build();
            DerivationStep longStep = DerivationStep.builder("b")
                    .reads("close")
                    .lookback(30)
                    .field("b", Sanitization.NONE)
                    .derive(ctx -> ctx.put("b", ctx.column("close")))
                    .build();

            assertThat(new IndicatorPipeline(List.of(shortStep, longStep)).maxLookback()).isEqualTo(30);
        }
    }

    @Nested
    @DisplayName("Sanitization at write time")
    class WriteTimeSanitization {

        @Test
        @DisplayName("NaN-and-infinity policy replaces division by zero")
        void infinityReplaced() {
            DerivedFrame frame = new IndicatorPipeline(List.of(reciprocal("ratio", "close", Sanitization.NAN_AND_INFINITY)))
                    .run("TEST", bars);

            assertThat(frame.column("ratio")).containsExactly(0.0, 0.5, 0.25, 0.0);
        }

        @Test
        @DisplayName("NaN-only policy keeps infinity")
        void infinityKept() {
            DerivedFrame frame = new IndicatorPipeline(List.of(reciprocal("ratio", "close", Sanitization.NAN_ONLY)))
                    .run("TEST", bars);

            assertThat(frame.value(0, "ratio")).isInfinite();
        }

        @Test
        @DisplayName("later fields read the sanitized value")
        void laterFieldsSeeSanitizedValues() {
            IndicatorPipeline pipeline = new IndicatorPipeline(List.of(
                    reciprocal("ratio", "close", Sanitization.NAN_AND_INFINITY),
                    reciprocal("inverse_ratio", "ratio", Sanitization.NONE)));

            DerivedFrame frame = pipeline.run("TEST", bars);

            // 1 / 0.0 again, not 1 / Infinity
            assertThat(frame.value(0, "inverse_ratio")).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(frame.value(1, "inverse_ratio")).isEqualTo(2.0);
        }

        @Test
        @DisplayName("second output of a step sees the first one sanitized")
        void sameStepSeesSanitizedValue() {
            DerivationStep step = DerivationStep.builder("pair")
                    .reads("close")
                    .field("ratio", Sanitization.NAN_AND_INFINITY)
                    .field("doubled", Sanitization.NONE)
                    .derive(ctx -> {
                        double[] ratio = ctx.put("ratio", SeriesMath.map(ctx.column("close"), v -> 1 / v));
                        ctx.put("doubled", SeriesMath.map(ratio, v -> 2 * v));
                    })
                    .build();

            DerivedFrame frame = new IndicatorPipeline(List.of(step)).run("TEST", bars);

            assertThat(frame.column("doubled")).containsExactly(0.0, 1.0, 0.5, 0.0);
        }

        @Test
        @DisplayName("scratch columns are readable but not exported")
        void scratchNotExported() {
            DerivationStep scratch = DerivationStep.builder("half")
                    .reads("close")
                    .scratch("half", Sanitization.NONE)
                    .derive(ctx -> ctx.put("half", SeriesMath.map(ctx.column("close"), v -> v / 2)))
                    .build();
            DerivationStep exported = DerivationStep.builder("quarter")
                    .reads("half")
                    .field("quarter", Sanitization.NONE)
                    .derive(ctx -> ctx.put("quarter", SeriesMath.map(ctx.column("half"), v -> v / 2)))
                    .build();

            DerivedFrame frame = new IndicatorPipeline(List.of(scratch, exported)).run("TEST", bars);

            assertThat(frame.fieldNames()).containsExactly("quarter");
            assertThat(frame.column("quarter")).containsExactly(0.0, 0.5, 1.0, 0.0);
        }
    }

    @Nested
    @DisplayName("Run-time contract")
    class RunTimeContract {

        @Test
        @DisplayName("reading an undeclared field fails")
        void undeclaredRead() {
            DerivationStep step = DerivationStep.builder("sneaky")
                    .reads("close")
                    .field("sneaky", Sanitization.NONE)
                    .derive(ctx -> ctx.put("sneaky", ctx.column("volume")))
                    .build();
            IndicatorPipeline pipeline = new IndicatorPipeline(List.of(step));

            assertThatThrownBy(() -> pipeline.run("TEST", bars))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("undeclared field volume");
        }

        @Test
        @DisplayName("skipping a declared output fails")
        void missingOutput() {
            DerivationStep step = DerivationStep.builder("lazy")
                    .reads("close")
                    .field("first", Sanitization.NONE)
                    .field("second", Sanitization.NONE)
                    .derive(ctx -> ctx.put("first", ctx.column("close")))
                    .build();
            IndicatorPipeline pipeline = new IndicatorPipeline(List.of(step));

            assertThatThrownBy(() -> pipeline.run("TEST", bars))
                    .isInstanceOf(PipelineDefinitionException.class)
                    .hasMessageContaining("did not write second");
        }

        @Test
        @DisplayName("an output of the wrong length fails")
        void wrongLength() {
            DerivationStep step = DerivationStep.builder("short")
                    .reads("close")
                    .field("short", Sanitization.NONE)
                    .derive(ctx -> ctx.put("short", new double[1]))
                    .build();
            IndicatorPipeline pipeline = new IndicatorPipeline(List.of(step));

            assertThatThrownBy(() -> pipeline.run("TEST", bars)).isInstanceOf(PipelineDefinitionException.class);
        }

        @Test
        @DisplayName("declaring the same output twice in one step fails")
        void duplicateOutputInStep() {
            assertThatThrownBy(() -> DerivationStep.builder("twice")
                            .field("x", Sanitization.NONE)
                            .field("x", Sanitization.NAN_ONLY))
                    .isInstanceOf(PipelineDefinitionException.class);
        }

        @Test
        @DisplayName("empty input gives an empty frame with the full schema")
        void emptyInput() {
            DerivedFrame frame = new IndicatorPipeline(List.of(reciprocal("ratio", "close", Sanitization.NAN_ONLY)))
                    .run("TEST", List.of());

            assertThat(frame.isEmpty()).isTrue();
            assertThat(frame.fieldNames()).containsExactly("ratio");
        }
    }
}
