package com.fleet.diagnostics.engine.evaluators;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.engine.IndicatorRuleEvaluator;
import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.RuleResult;
import org.springframework.stereotype.Component;

/**
 * Detects growing instability: the rolling variance has reached the
 * threshold multiple of the baseline variance. Only increases count; a
 * quieter-than-baseline signal is not an alert.
 */
@Component
public class VarianceIncreaseEvaluator implements IndicatorRuleEvaluator {

    @Override
    public IndicatorKind getSupportedKind() {
        return IndicatorKind.VARIANCE_INCREASE;
    }

    @Override
    public RuleResult evaluate(IndicatorRecord record, DiagnosticsConfig.IndicatorRule rule) {
        Double ratio = record.getVarianceRatio();
        double threshold = rule.getThreshold();
        if (ratio == null) {
            return notExceeded(null, threshold, "Variance ratio undefined: rolling window not yet filled");
        }
        if (ratio < threshold) {
            return notExceeded(ratio, threshold, "Rolling variance within normal range of baseline");
        }

        String reason = String.format(
                "Variance increase: rolling variance is %.2fx the baseline variance (threshold=%.2fx).",
                ratio, threshold);

        return RuleResult.builder()
                .kind(IndicatorKind.VARIANCE_INCREASE)
                .exceeded(true)
                .value(ratio)
                .magnitude(ratio)
                .threshold(threshold)
                .reason(reason)
                .build();
    }

    private RuleResult notExceeded(Double ratio, double threshold, String reason) {
        return RuleResult.builder()
                .kind(IndicatorKind.VARIANCE_INCREASE)
                .exceeded(false)
                .value(ratio)
                .magnitude(ratio == null ? 0.0 : ratio)
                .threshold(threshold)
                .reason(reason)
                .build();
    }
}
