package com.fleet.diagnostics.service;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.config.MetricsConfig;
import com.fleet.diagnostics.engine.isolationforest.AnomalyModel;
import com.fleet.diagnostics.engine.isolationforest.AnomalyModelTrainer;
import com.fleet.diagnostics.engine.isolationforest.FeatureExtractor;
import com.fleet.diagnostics.engine.isolationforest.FeatureSet;
import com.fleet.diagnostics.engine.isolationforest.IsolationForest;
import com.fleet.diagnostics.exception.FeatureMismatchException;
import com.fleet.diagnostics.model.AnomalyModelSummary;
import com.fleet.diagnostics.model.ConfidenceTier;
import com.fleet.diagnostics.model.DiagnosticIssue;
import com.fleet.diagnostics.model.DiagnosticRow;
import com.fleet.diagnostics.model.FleetDiagnosticReport;
import com.fleet.diagnostics.model.IssueCause;
import com.fleet.diagnostics.model.UnitSeries;
import com.fleet.diagnostics.seeder.SyntheticFleetGenerator;
import com.fleet.diagnostics.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FleetDiagnosticsServiceTest {

    private static final String[] SENSORS = {"s1", "s2", "s3"};

    private DiagnosticsConfig config;
    private SimpleMeterRegistry registry;
    private FleetDiagnosticsService service;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.createFleetConfig(SENSORS);
        registry = new SimpleMeterRegistry();
        service = TestDataFactory.createDiagnosticsService(config, new MetricsConfig(registry));
    }

    private static List<UnitSeries> healthyFleet(long seed) {
        return new SyntheticFleetGenerator(List.of(SENSORS), seed).fleet(30, 200, 300, 0.0, 0.0);
    }

    @Test
    void diagnose_healthyFleet_flagsAboutContaminationShareAndNoAlerts() {
        List<UnitSeries> fleet = healthyFleet(21);

        FleetDiagnosticReport report = service.diagnose(fleet);

        int totalCycles = fleet.stream().mapToInt(UnitSeries::size).sum();
        assertThat(report.getRows()).hasSize(totalCycles);
        assertThat(report.getIssues()).isEmpty();
        assertThat(report.getAnomalyModel().getStatus()).isEqualTo(AnomalyModelSummary.Status.FITTED);

        assertThat(report.getRows()).allSatisfy(row -> assertThat(row.getAlerts()).isEmpty());
        assertThat(report.getRows()).extracting(DiagnosticRow::getTier)
                .containsOnly(ConfidenceTier.NORMAL, ConfidenceTier.INVESTIGATE);

        assertThat(report.getAnomalyModel().getCalibrationSamples()).isPositive();

        // Cycles past the baseline window are out-of-sample for every unit's baseline
        int baselineCycles = config.getBaseline().getWindowCycles();
        List<DiagnosticRow> later = report.getRows().stream()
                .filter(row -> row.getCycle() > baselineCycles)
                .collect(Collectors.toList());
        assertThat(later).allSatisfy(row -> assertThat(row.getAnomaly()).isNotNull());
        double anomalyFraction = later.stream().filter(DiagnosticRow::getAnomaly).count() / (double) later.size();
        assertThat(anomalyFraction).isCloseTo(config.getAnomaly().getContamination(), within(0.02));
    }

    @Test
    void diagnose_rowsFollowUnitOrderThenCycle() {
        List<UnitSeries> fleet = healthyFleet(3).subList(0, 5);

        FleetDiagnosticReport report = service.diagnose(fleet);

        List<DiagnosticRow> firstUnit = report.getRows().subList(0, fleet.get(0).size());
        assertThat(firstUnit).allSatisfy(row -> assertThat(row.getUnitId()).isEqualTo(fleet.get(0).getUnitId()));
        assertThat(firstUnit).extracting(DiagnosticRow::getCycle).isSorted();
        assertThat(report.getRows().get(0).getAnomalyScore()).isNull();
        assertThat(report.getRows().get(0).getLifeFraction()).isNotNull();
    }

    @Test
    void diagnose_degradingUnit_reachesHighConfidence() {
        SyntheticFleetGenerator generator = new SyntheticFleetGenerator(List.of(SENSORS), 5);
        List<UnitSeries> fleet = new ArrayList<>(generator.fleet(30, 200, 300, 0.0, 0.0));
        fleet.add(generator.degradingUnit("UNIT-BAD", 300, 0.5, 10.0));

        FleetDiagnosticReport report = service.diagnose(fleet);

        List<DiagnosticRow> bad = report.getRows().stream()
                .filter(row -> row.getUnitId().equals("UNIT-BAD"))
                .collect(Collectors.toList());
        assertThat(bad).anySatisfy(row -> assertThat(row.getTier()).isEqualTo(ConfidenceTier.HIGH_CONFIDENCE));
        // Nothing drifts before onset, so nothing alerts in the first half of life
        assertThat(bad.stream().filter(row -> row.getCycle() <= 150))
                .allSatisfy(row -> assertThat(row.getAlerts()).isEmpty());
        DiagnosticRow last = bad.get(bad.size() - 1);
        assertThat(last.getAnomaly()).isTrue();
        assertThat(registry.find("diagnostics.alerts.raised").counters()).isNotEmpty();
    }

    @Test
    void diagnose_sameInput_givesByteIdenticalJson() {
        DiagnosticReportWriter writer = new DiagnosticReportWriter();

        String first = writer.toJson(service.diagnose(healthyFleet(8)));
        String second = writer.toJson(service.diagnose(healthyFleet(8)));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void diagnose_modelFitFails_keepsRuleOnlyTiers() {
        config.getAnomaly().setMinFitSamples(1_000_000);
        SyntheticFleetGenerator generator = new SyntheticFleetGenerator(List.of(SENSORS), 5);
        List<UnitSeries> fleet = new ArrayList<>(generator.fleet(5, 200, 300, 0.0, 0.0));
        fleet.add(generator.degradingUnit("UNIT-BAD", 300, 0.5, 10.0));

        FleetDiagnosticReport report = service.diagnose(fleet);

        assertThat(report.getAnomalyModel().getStatus()).isEqualTo(AnomalyModelSummary.Status.FAILED);
        assertThat(report.getAnomalyModel().getFailureReason()).contains("1000000");
        assertThat(report.getIssues()).extracting(DiagnosticIssue::getCause).contains(IssueCause.MODEL_FIT_FAILED);
        assertThat(report.getRows()).allSatisfy(row -> {
            assertThat(row.getAnomalyScore()).isNull();
            assertThat(row.getTier()).isIn(ConfidenceTier.NORMAL, ConfidenceTier.MONITOR);
        });
        assertThat(report.getRows()).anySatisfy(row -> assertThat(row.getTier()).isEqualTo(ConfidenceTier.MONITOR));
    }

    @Test
    void diagnose_shortUnit_skippedForBaselineAndExcludedFromModel() {
        List<UnitSeries> fleet = new ArrayList<>(healthyFleet(4));
        fleet.add(new SyntheticFleetGenerator(List.of(SENSORS), 9).healthyUnit("UNIT-SHORT", 8));

        FleetDiagnosticReport report = service.diagnose(fleet);

        List<DiagnosticIssue> shortIssues = report.getIssues().stream()
                .filter(issue -> "UNIT-SHORT".equals(issue.getUnitId()))
                .collect(Collectors.toList());
        assertThat(shortIssues).extracting(DiagnosticIssue::getCause).containsExactly(
                IssueCause.INSUFFICIENT_BASELINE_DATA,
                IssueCause.INSUFFICIENT_BASELINE_DATA,
                IssueCause.INSUFFICIENT_BASELINE_DATA,
                IssueCause.EXCLUDED_FROM_ANOMALY_MODEL);
        assertThat(shortIssues).extracting(DiagnosticIssue::getSensorId).containsExactly("s1", "s2", "s3", null);

        List<DiagnosticRow> shortRows = report.getRows().stream()
                .filter(row -> row.getUnitId().equals("UNIT-SHORT"))
                .collect(Collectors.toList());
        assertThat(shortRows).hasSize(8).allSatisfy(row -> {
            assertThat(row.getIndicators()).isEmpty();
            assertThat(row.getAnomalyScore()).isNull();
            assertThat(row.getTier()).isEqualTo(ConfidenceTier.NORMAL);
        });
        assertThat(report.getAnomalyModel().getStatus()).isEqualTo(AnomalyModelSummary.Status.FITTED);
    }

    @Test
    void diagnose_unknownLife_reportsIssueButKeepsIndicators() {
        List<UnitSeries> fleet = new ArrayList<>(healthyFleet(6));
        UnitSeries known = fleet.get(0);
        UnitSeries inService = UnitSeries.builder()
                .unitId("UNIT-LIVE")
                .cycles(known.cycles())
                .sensor("s1", known.values("s1"))
                .sensor("s2", known.values("s2"))
                .sensor("s3", known.values("s3"))
                .build();
        fleet.add(inService);

        FleetDiagnosticReport report = service.diagnose(fleet);

        assertThat(report.getIssues()).singleElement().satisfies(issue -> {
            assertThat(issue.getUnitId()).isEqualTo("UNIT-LIVE");
            assertThat(issue.getCause()).isEqualTo(IssueCause.UNKNOWN_LIFE_LENGTH);
        });
        DiagnosticRow lastLive = report.getRows().get(report.getRows().size() - 1);
        assertThat(lastLive.getUnitId()).isEqualTo("UNIT-LIVE");
        assertThat(lastLive.getLifeFraction()).isNull();
        assertThat(lastLive.getIndicators()).containsOnlyKeys("s1", "s2", "s3");
        assertThat(lastLive.getIndicators().get("s1").getLifeFraction()).isNull();
        assertThat(lastLive.getAnomalyScore()).isNotNull();
    }

    @Test
    void diagnose_suppliedModelOverOtherSensors_throwsBeforeScoring() {
        List<String> otherSensors = List.of("s1", "s2", "s9");
        AnomalyModel foreign = AnomalyModel.builder()
                .forest(IsolationForest.train(new double[][]{new double[9], new double[9]}, 5, 2, 1))
                .sensors(otherSensors)
                .featureNames(FeatureExtractor.featureNames(otherSensors))
                .threshold(0.6)
                .contamination(0.05)
                .trainingSamples(2)
                .featureMeans(new double[9])
                .build();

        assertThatThrownBy(() -> service.diagnose(healthyFleet(2).subList(0, 3), foreign))
                .isInstanceOf(FeatureMismatchException.class)
                .hasMessageContaining("s9");
    }

    @Test
    void diagnose_suppliedModel_scoresWithoutRefitting() {
        List<FeatureSet> featureSets = healthyFleet(2).stream()
                .map(service::analyzeUnit)
                .map(UnitAnalysis::getFeatureSet)
                .collect(Collectors.toList());
        AnomalyModel model = new AnomalyModelTrainer(config).fit(featureSets);

        FleetDiagnosticReport report = service.diagnose(healthyFleet(12).subList(0, 4), model);

        assertThat(report.getAnomalyModel().getStatus()).isEqualTo(AnomalyModelSummary.Status.SUPPLIED);
        assertThat(report.getAnomalyModel().getThreshold()).isEqualTo(model.getThreshold());
        assertThat(report.getAnomalyModel().getTrainingSamples()).isEqualTo(model.getTrainingSamples());
        assertThat(registry.find("diagnostics.anomaly.fit").counters()).isEmpty();
    }
}
