package com.techanalysis.unit.snapshot;

import static com.techanalysis.support.BarFixtures.bar;
import static com.techanalysis.support.BarFixtures.day;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.techanalysis.domain.model.Bar;
import com.techanalysis.domain.model.SnapshotRow;
import com.techanalysis.exception.ValidationException;
import com.techanalysis.indicator.IndicatorPipeline;
import com.techanalysis.indicator.StandardIndicators;
import com.techanalysis.pattern.CandlestickPatterns;
import com.techanalysis.pattern.PatternClassificationEngine;
import com.techanalysis.snapshot.SnapshotExtractor;
import com.techanalysis.support.BarFixtures;
import com.techanalysis.window.WindowController;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for SnapshotExtractor: latest-row extraction and its fallbacks.
 */
class SnapshotExtractorTest {

    private static final List<String> INDICATOR_COLUMNS = List.of("date", "code", "ma20", "rsi_6", "no_such_field");
    private static final List<String> PATTERN_COLUMNS = List.of("date", "code", "engulfing", "harami");

    private final WindowController windowController = new WindowController();
    private final PatternClassificationEngine patternEngine =
            new PatternClassificationEngine(CandlestickPatterns.all(), windowController);
    private final SnapshotExtractor extractor =
            new SnapshotExtractor(StandardIndicators.pipeline(), patternEngine, windowController);

    @Nested
    @DisplayName("Indicator row")
    class IndicatorRow {

        @Test
        @DisplayName("a single bar yields zeros stamped with the requested date and code")
        void tooLittleHistory() {
            SnapshotRow<Double> row = extractor.latestIndicatorRow(
                    "AAA", BarFixtures.trending(1), day(5), 90, INDICATOR_COLUMNS);

            assertThat(row.date()).isEqualTo(day(5));
            assertThat(row.code()).isEqualTo("AAA");
            assertThat(row.values()).containsOnlyKeys("ma20", "rsi_6", "no_such_field");
            assertThat(row.values().values()).containsOnly(0.0);
        }

        @Test
        @DisplayName("bars after the as-of date do not count towards the minimum history")
        void historyCountedUpToAsOf() {
            SnapshotRow<Double> row = extractor.latestIndicatorRow(
                    "AAA", BarFixtures.trending(60), day(0), 90, INDICATOR_COLUMNS);

            assertThat(row.values().values()).containsOnly(0.0);
        }

        @Test
        @DisplayName("reads the as-of bar computed over the trailing lookback")
        void asOfRow() {
            List<Bar> bars = BarFixtures.trending(60);

            SnapshotRow<Double> row = extractor.latestIndicatorRow("AAA", bars, day(40), 30, INDICATOR_COLUMNS);

            double sum = 0.0;
            for (int i = 21; i <= 40; i++) {
                sum += bars.get(i).getClose();
            }
            assertThat(row.date()).isEqualTo(day(40));
            assertThat(row.get("ma20")).isCloseTo(sum / 20, within(1e-9));
            assertThat(row.get("rsi_6")).isBetween(0.0, 100.0);
            assertThat(row.get("no_such_field")).isZero();
        }

        @Test
        @DisplayName("without an as-of date the last bar supplies the date")
        void latestBar() {
            SnapshotRow<Double> row =
                    extractor.latestIndicatorRow("AAA", BarFixtures.trending(30), null, 90, INDICATOR_COLUMNS);

            assertThat(row.date()).isEqualTo(day(29));
            assertThat(row.get("ma20")).isNotZero();
        }

        @Test
        @DisplayName("a lookback shorter than a field's warm-up leaves that field at 0")
        void shortLookback() {
            SnapshotRow<Double> row = extractor.latestIndicatorRow(
                    "AAA", BarFixtures.trending(60), null, 10, INDICATOR_COLUMNS);

            assertThat(row.get("ma20")).isZero();
            assertThat(row.get("rsi_6")).isNotZero();
        }

        @Test
        @DisplayName("a pipeline failure falls back to zeros")
        void pipelineFailure() {
            IndicatorPipeline failing = mock(IndicatorPipeline.class);
            when(failing.run(any(), anyList())).thenThrow(new IllegalStateException("boom"));
            SnapshotExtractor failingExtractor = new SnapshotExtractor(failing, patternEngine, windowController);

            SnapshotRow<Double> row = failingExtractor.latestIndicatorRow(
                    "AAA", BarFixtures.trending(30), day(20), 90, INDICATOR_COLUMNS);

            assertThat(row.date()).isEqualTo(day(20));
            assertThat(row.values().values()).containsOnly(0.0);
        }

        @Test
        @DisplayName("a non-positive lookback falls back to zeros")
        void nonPositiveLookback() {
            SnapshotRow<Double> row = extractor.latestIndicatorRow(
                    "AAA", BarFixtures.trending(30), day(20), 0, INDICATOR_COLUMNS);

            assertThat(row.date()).isEqualTo(day(20));
            assertThat(row.code()).isEqualTo("AAA");
            assertThat(row.values().values()).containsOnly(0.0);
        }

        @Test
        @DisplayName("columns must name a date and a code column")
        void columnsValidated() {
            assertThatThrownBy(() -> extractor.latestIndicatorRow(
                            "AAA", BarFixtures.trending(30), null, 90, List.of("date")))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Pattern row")
    class PatternRow {

        private List<Bar> engulfingAtEnd() {
            List<Bar> bars = new ArrayList<>(BarFixtures.closes(10, 10, 10));
            bars.add(bar(3, 11, 11.2, 9.8, 10, 1_000));
            bars.add(bar(4, 9.5, 11.8, 9.3, 11.5, 1_000));
            return bars;
        }

        @Test
        @DisplayName("reports the codes when the latest bar carries a signal")
        void signal() {
            Optional<SnapshotRow<Integer>> row =
                    extractor.latestPatternRow("AAA", engulfingAtEnd(), null, null, PATTERN_COLUMNS);

            assertThat(row).isPresent();
            assertThat(row.get().date()).isEqualTo(day(4));
            assertThat(row.get().get("engulfing")).isEqualTo(100);
            assertThat(row.get().get("harami")).isZero();
        }

        @Test
        @DisplayName("is empty when nothing fired on the latest bar")
        void noSignal() {
            Optional<SnapshotRow<Integer>> row =
                    extractor.latestPatternRow("AAA", engulfingAtEnd(), day(3), null, PATTERN_COLUMNS);

            assertThat(row).isEmpty();
        }

        @Test
        @DisplayName("is empty with fewer than two bars")
        void tooLittleHistory() {
            assertThat(extractor.latestPatternRow("AAA", BarFixtures.trending(1), null, null, PATTERN_COLUMNS))
                    .isEmpty();
        }

        @Test
        @DisplayName("is empty for a non-positive calc window")
        void nonPositiveCalcWindow() {
            assertThat(extractor.latestPatternRow("AAA", engulfingAtEnd(), null, -1, PATTERN_COLUMNS)).isEmpty();
        }

        @Test
        @DisplayName("unknown patterns read as 0")
        void unknownPattern() {
            Optional<SnapshotRow<Integer>> row = extractor.latestPatternRow(
                    "AAA", engulfingAtEnd(), null, null, List.of("date", "code", "engulfing", "unicorn"));

            assertThat(row).isPresent();
            assertThat(row.get().get("unicorn")).isZero();
        }
    }
}
