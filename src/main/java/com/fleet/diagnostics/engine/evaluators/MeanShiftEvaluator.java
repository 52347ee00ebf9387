package com.fleet.diagnostics.engine.evaluators;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.engine.IndicatorRuleEvaluator;
import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Detects a sustained level change: the rolling mean has moved away from the
 * baseline mean by at least the threshold, in baseline sigmas, either way.
 *
 * Example: mean0 = 642.0, std0 = 0.5, threshold 3. A rolling mean of 643.6
 * gives z = 3.2 and exceeds; 640.6 gives z = -2.8 and does not.
 */
@Component
public class MeanShiftEvaluator implements IndicatorRuleEvaluator {

    @Override
    public IndicatorKind getSupportedKind() {
        return IndicatorKind.MEAN_SHIFT;
    }

    @Override
    public RuleResult evaluate(IndicatorRecord record, DiagnosticsConfig.IndicatorRule rule) {
        Double z = record.getMeanShiftZ();
        double threshold = rule.getThreshold();
        if (z == null) {
            return notExceeded(z, threshold, "Mean shift undefined: rolling window not yet filled");
        }

        double magnitude = Math.abs(z);
        if (magnitude < threshold) {
            return notExceeded(z, threshold, "Rolling mean within normal range of baseline");
        }

        String reason = String.format(
                "Mean shift: rolling mean is %.2f baseline sigmas %s mean0 (threshold=%.2f).",
                magnitude, z > 0 ? "above" : "below", threshold);

        return RuleResult.builder()
                .kind(IndicatorKind.MEAN_SHIFT)
                .exceeded(true)
                .value(z)
                .magnitude(magnitude)
                .threshold(threshold)
                .reason(reason)
                .build();
    }

    private RuleResult notExceeded(Double z, double threshold, String reason) {
        return RuleResult.builder()
                .kind(IndicatorKind.MEAN_SHIFT)
                .exceeded(false)
                .value(z)
                .magnitude(z == null ? 0.0 : Math.abs(z))
                .threshold(threshold)
                .reason(reason)
                .build();
    }
}
