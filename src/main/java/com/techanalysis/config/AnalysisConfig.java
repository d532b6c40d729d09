package com.techanalysis.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Default windows and pattern selection for the analysis engine.
 *
 * <p>Binds to the {@code analysis.*} prefix in application.yml. The windows apply only
 * where a caller does not pass its own; see {@code TechnicalAnalysisService}.
 */
@Configuration
@ConfigurationProperties(prefix = "analysis")
@Getter
@Setter
public class AnalysisConfig {

    /** Rows kept from a batch computation. */
    private int outputWindow = 120;

    /** Bars used to compute a single-row indicator snapshot. */
    private int snapshotLookback = 90;

    /** Bars used to classify patterns; unset means all available bars. */
    private Integer patternCalcWindow;

    /** Pattern names to classify. Empty selects the whole catalogue. */
    private List<String> patterns = new ArrayList<>();
}
