package com.fleet.diagnostics.engine;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.config.MetricsConfig;
import com.fleet.diagnostics.model.Alert;
import com.fleet.diagnostics.model.IndicatorKind;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.RuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns indicator records into debounced alerts.
 * Uses the Strategy pattern: each IndicatorKind is tested by a registered
 * IndicatorRuleEvaluator, and the engine keeps, per (unit, sensor, kind), a
 * count of consecutive exceeding cycles. An alert is raised on every cycle
 * whose count has reached the debounce length D; any cycle below threshold
 * (or with the indicator undefined) resets the count.
 *
 * Counters live only for the duration of one call, so the engine is
 * stateless and safe to share between worker threads.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final DiagnosticsConfig config;
    private final MetricsConfig metricsConfig;
    private final Map<IndicatorKind, IndicatorRuleEvaluator> evaluatorMap;
    private final Map<IndicatorKind, SeverityTable> severityTables;

    public RuleEngine(List<IndicatorRuleEvaluator> evaluators, DiagnosticsConfig config, MetricsConfig metricsConfig) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.evaluatorMap = new EnumMap<>(IndicatorKind.class);
        this.severityTables = new EnumMap<>(IndicatorKind.class);

        for (IndicatorRuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedKind(), evaluator);
            log.info("Registered indicator evaluator: {} -> {}",
                    evaluator.getSupportedKind(), evaluator.getClass().getSimpleName());
        }
        for (IndicatorKind kind : IndicatorKind.values()) {
            severityTables.put(kind, SeverityTable.from(config.getRules().forKind(kind).getSeverityTiers()));
        }
    }

    /**
     * Evaluate all enabled rules over a stream of records.
     *
     * @param records indicator records in cycle order; may span several (unit, sensor) pairs
     * @return alerts ordered by unit, sensor, cycle and kind
     */
    public List<Alert> evaluate(List<IndicatorRecord> records) {
        Map<String, List<IndicatorRecord>> streams = new LinkedHashMap<>();
        for (IndicatorRecord record : records) {
            streams.computeIfAbsent(record.getUnitId() + '\u0000' + record.getSensorId(), k -> new ArrayList<>())
                    .add(record);
        }

        List<Alert> alerts = new ArrayList<>();
        for (List<IndicatorRecord> stream : streams.values()) {
            List<Alert> streamAlerts = new ArrayList<>();
            for (IndicatorKind kind : IndicatorKind.values()) {
                streamAlerts.addAll(evaluateKind(kind, stream));
            }
            streamAlerts.sort(Comparator.comparingInt(Alert::getCycle)
                    .thenComparing(Alert::getKind));
            alerts.addAll(streamAlerts);
        }
        return alerts;
    }

    private List<Alert> evaluateKind(IndicatorKind kind, List<IndicatorRecord> stream) {
        DiagnosticsConfig.IndicatorRule rule = config.getRules().forKind(kind);
        if (!rule.getEnabled()) {
            return List.of();
        }
        IndicatorRuleEvaluator evaluator = evaluatorMap.get(kind);
        if (evaluator == null) {
            log.warn("No evaluator registered for indicator kind: {}", kind);
            return List.of();
        }

        int debounce = config.getRules().getDebounce();
        SeverityTable severityTable = severityTables.get(kind);
        List<Alert> alerts = new ArrayList<>();
        int consecutive = 0;

        for (IndicatorRecord record : stream) {
            RuleResult result = evaluator.evaluate(record, rule);
            if (!result.isExceeded()) {
                consecutive = 0;
                continue;
            }

            consecutive++;
            if (consecutive < debounce) {
                continue;
            }

            Alert alert = Alert.builder()
                    .unitId(record.getUnitId())
                    .sensorId(record.getSensorId())
                    .cycle(record.getCycle())
                    .kind(kind)
                    .severity(severityTable.lookup(result.getMagnitude(), result.getThreshold()))
                    .value(result.getValue())
                    .threshold(result.getThreshold())
                    .consecutiveCycles(consecutive)
                    .reason(result.getReason())
                    .build();
            alerts.add(alert);
            metricsConfig.recordAlert(alert);

            if (consecutive == debounce) {
                log.debug("Alert raised: {} on unit {} sensor {} at cycle {} ({} severity) - {}",
                        kind, alert.getUnitId(), alert.getSensorId(), alert.getCycle(),
                        alert.getSeverity(), alert.getReason());
            }
        }
        return alerts;
    }
}
