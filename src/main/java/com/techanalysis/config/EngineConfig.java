package com.techanalysis.config;

import com.techanalysis.indicator.IndicatorPipeline;
import com.techanalysis.indicator.StandardIndicators;
import com.techanalysis.pattern.CandlestickPatterns;
import com.techanalysis.pattern.PatternClassificationEngine;
import com.techanalysis.pattern.PatternClassifier;
import com.techanalysis.snapshot.SnapshotExtractor;
import com.techanalysis.window.WindowController;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the stateless engine components. All of them are immutable and shared by
 * every request thread.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public WindowController windowController() {
        return new WindowController();
    }

    @Bean
    public IndicatorPipeline indicatorPipeline() {
        IndicatorPipeline pipeline = StandardIndicators.pipeline();
        log.info(
                "Indicator pipeline ready: {} steps, {} exported fields, longest look-back {}",
                pipeline.getSteps().size(),
                pipeline.exportedFields().size(),
                pipeline.maxLookback());
        return pipeline;
    }

    @Bean
    public PatternClassificationEngine patternClassificationEngine(
            AnalysisConfig analysisConfig, WindowController windowController) {
        Map<String, PatternClassifier> classifiers = analysisConfig.getPatterns().isEmpty()
                ? CandlestickPatterns.all()
                : CandlestickPatterns.select(analysisConfig.getPatterns());
        if (classifiers.size() < analysisConfig.getPatterns().size()) {
            log.warn("Unknown pattern names in configuration will read as 0: {}", analysisConfig.getPatterns());
        }
        log.info("Pattern engine ready with {} classifiers", classifiers.size());
        return new PatternClassificationEngine(classifiers, windowController);
    }

    @Bean
    public SnapshotExtractor snapshotExtractor(
            IndicatorPipeline indicatorPipeline,
            PatternClassificationEngine patternClassificationEngine,
            WindowController windowController) {
        return new SnapshotExtractor(indicatorPipeline, patternClassificationEngine, windowController);
    }
}
