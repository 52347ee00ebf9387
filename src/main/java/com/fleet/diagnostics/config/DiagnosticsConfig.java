package com.fleet.diagnostics.config;

import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.Severity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Every tunable of the diagnostic pipeline, bound from {@code diagnostics.*}.
 * Unknown keys fail binding and every required key is {@code @NotNull}, so a
 * misspelt or forgotten setting stops the application at startup.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "diagnostics", ignoreUnknownFields = false)
public class DiagnosticsConfig {

    // Sensor columns in scope, in output order. Also the anomaly model's feature order.
    @NotEmpty
    private List<String> sensors = new ArrayList<>();

    @Valid
    @NotNull
    private Baseline baseline = new Baseline();

    @Valid
    @NotNull
    private Indicators indicators = new Indicators();

    @Valid
    @NotNull
    private Rules rules = new Rules();

    @Valid
    @NotNull
    private Anomaly anomaly = new Anomaly();

    @Valid
    @NotNull
    private Ranking ranking = new Ranking();

    @Valid
    @NotNull
    private Execution execution = new Execution();

    @Valid
    @NotNull
    private Demo demo = new Demo();

    @Data
    public static class Baseline {
        // K: number of leading cycles forming the early-life window
        @Min(2)
        private Integer windowCycles;

        // f0: leading fraction of recorded life, used instead of K
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private Double windowFraction;

        // K_min: fewer usable cycles than this invalidates the baseline
        @NotNull
        @Min(2)
        private Integer minCycles;

        // Floor for std0 and for the rolling spread
        @NotNull
        @Positive
        private Double epsilon;

        @AssertTrue(message = "exactly one of window-cycles or window-fraction must be set")
        public boolean isExactlyOneWindowConfigured() {
            return (windowCycles == null) != (windowFraction == null);
        }
    }

    @Data
    public static class Indicators {
        // W: trailing cycles for the mean shift and variance ratio
        @NotNull
        @Min(2)
        private Integer window;

        // T: trailing cycles for the trend slope
        @NotNull
        @Min(2)
        private Integer trendWindow;
    }

    @Data
    public static class Rules {
        // D: consecutive exceeding cycles before an alert is raised
        @NotNull
        @Min(1)
        private Integer debounce;

        @Valid
        @NotNull
        private IndicatorRule meanShift = new IndicatorRule();

        @Valid
        @NotNull
        private IndicatorRule varianceIncrease = new IndicatorRule();

        @Valid
        @NotNull
        private IndicatorRule trend = new IndicatorRule();

        public IndicatorRule forKind(IndicatorKind kind) {
            switch (kind) {
                case MEAN_SHIFT:
                    return meanShift;
                case VARIANCE_INCREASE:
                    return varianceIncrease;
                case TREND:
                    return trend;
                default:
                    throw new IllegalArgumentException("Unsupported indicator kind: " + kind);
            }
        }
    }

    @Data
    public static class IndicatorRule {
        @NotNull
        @Positive
        private Double threshold;

        @NotNull
        private Boolean enabled;

        // Ordered (multiple of threshold, severity) breakpoints
        @Valid
        @NotEmpty
        private List<SeverityTier> severityTiers = new ArrayList<>();
    }

    @Data
    public static class SeverityTier {
        @NotNull
        @Positive
        private Double multiple;

        @NotNull
        private Severity severity;

        public static SeverityTier of(double multiple, Severity severity) {
            SeverityTier tier = new SeverityTier();
            tier.setMultiple(multiple);
            tier.setSeverity(severity);
            return tier;
        }
    }

    @Data
    public static class Anomaly {
        // rho: expected share of healthy training points scored anomalous
        @NotNull
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "0.5", inclusive = false)
        private Double contamination;

        @NotNull
        @Min(1)
        private Integer minFitSamples;

        @NotNull
        @Min(1)
        private Integer numTrees;

        @NotNull
        @Min(2)
        private Integer sampleSize;

        @NotNull
        private Long seed;
    }

    @Data
    public static class Ranking {
        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double earlyFraction;

        @NotNull
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private Double lateFraction;

        @NotNull
        @Min(2)
        private Integer minPointsPerWindow;

        @NotNull
        @Min(2)
        private Integer minPointsForSlope;
    }

    @Data
    public static class Execution {
        @NotNull
        @Min(1)
        private Integer parallelism;
    }

    @Data
    public static class Demo {
        @NotNull
        @Min(1)
        private Integer units;

        @NotNull
        private Long seed;
    }
}
