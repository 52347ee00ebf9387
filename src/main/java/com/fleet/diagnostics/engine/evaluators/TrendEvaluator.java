package com.fleet.diagnostics.engine.evaluators;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.engine.IndicatorRuleEvaluator;
import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Detects drift: over the trend window the fitted line moves by at least the
 * threshold, in baseline sigmas, in either direction.
 */
@Component
public class TrendEvaluator implements IndicatorRuleEvaluator {

    @Override
    public IndicatorKind getSupportedKind() {
        return IndicatorKind.TREND;
    }

    @Override
    public RuleResult evaluate(IndicatorRecord record, DiagnosticsConfig.IndicatorRule rule) {
        Double z = record.getTrendSlopeZ();
        double threshold = rule.getThreshold();
        if (z == null) {
            return RuleResult.builder()
                    .kind(IndicatorKind.TREND)
                    .exceeded(false)
                    .magnitude(0.0)
                    .threshold(threshold)
                    .reason("Trend undefined: trend window not yet filled")
                    .build();
        }

        double magnitude = Math.abs(z);
        boolean exceeded = magnitude >= threshold;
        String reason = exceeded
                ? String.format("Trend: %s drift of %.2f baseline sigmas over the trend window (threshold=%.2f).",
                        z > 0 ? "upward" : "downward", magnitude, threshold)
                : "No significant drift over the trend window";

        return RuleResult.builder()
                .kind(IndicatorKind.TREND)
                .exceeded(exceeded)
                .value(z)
                .magnitude(magnitude)
                .threshold(threshold)
                .reason(reason)
                .build();
    }
}
