package com.fleet.diagnostics.engine;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.RuleResult;

/**
 * Tests one indicator kind of a record against its threshold.
 * Each implementation handles a single IndicatorKind; debouncing is the
 * RuleEngine's job, so evaluators look at one cycle only.
 */
public interface IndicatorRuleEvaluator {

    /**
     * The indicator kind this evaluator handles.
     */
    IndicatorKind getSupportedKind();

    /**
     * @param record the indicators of one sensor at one cycle
     * @param rule   threshold and severity settings for this kind
     * @return whether the indicator reached its threshold, with the magnitude compared
     */
    RuleResult evaluate(IndicatorRecord record, DiagnosticsConfig.IndicatorRule rule);
}
