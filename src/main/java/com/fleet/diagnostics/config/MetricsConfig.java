package com.fleet.diagnostics.config;

import com.fleet.diagnostics.model.Alert;
import com.fleet.diagnostics.model.ConfidenceTier;
import com.fleet.diagnostics.model.IssueCause;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAlert(Alert alert) {
        Counter.builder("diagnostics.alerts.raised")
                .tag("kind", alert.getKind().name())
                .tag("severity", alert.getSeverity().name())
                .register(registry)
                .increment();
    }

    public void recordIssue(IssueCause cause) {
        Counter.builder("diagnostics.issues")
                .tag("cause", cause.name())
                .register(registry)
                .increment();
    }

    public void recordTier(ConfidenceTier tier) {
        Counter.builder("diagnostics.tiers")
                .tag("tier", tier.name())
                .register(registry)
                .increment();
    }

    public void recordModelFit(String outcome, int trainingSamples) {
        Counter.builder("diagnostics.anomaly.fit")
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        DistributionSummary.builder("diagnostics.anomaly.fit.samples")
                .tag("outcome", outcome)
                .register(registry)
                .record(trainingSamples);
    }
}
