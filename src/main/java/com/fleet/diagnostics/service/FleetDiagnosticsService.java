package com.fleet.diagnostics.service;

import com.fleet.diagnostics.config.DiagnosticsConfig;
import com.fleet.diagnostics.config.MetricsConfig;
import com.fleet.diagnostics.engine.RuleEngine;
import com.fleet.diagnostics.engine.baseline.BaselineEstimator;
import com.fleet.diagnostics.engine.baseline.LifeNormalizer;
import com.fleet.diagnostics.engine.indicator.RollingIndicatorComputer;
import com.fleet.diagnostics.engine.isolationforest.AnomalyModel;
import com.fleet.diagnostics.engine.isolationforest.AnomalyModelTrainer;
import com.fleet.diagnostics.engine.isolationforest.AnomalyScorer;
import com.fleet.diagnostics.engine.isolationforest.FeatureExtractor;
import com.fleet.diagnostics.engine.isolationforest.FeatureSet;
import com.fleet.diagnostics.exception.InsufficientBaselineDataException;
import com.fleet.diagnostics.exception.ModelFitFailedException;
import com.fleet.diagnostics.exception.UnknownLifeLengthException;
import com.fleet.diagnostics.model.Alert;
import com.fleet.diagnostics.model.AnomalyModelSummary;
import com.fleet.diagnostics.model.AnomalyScore;
import com.fleet.diagnostics.model.Baseline;
import com.fleet.diagnostics.model.ConfidenceTier;
import com.fleet.diagnostics.model.DiagnosticIssue;
import com.fleet.diagnostics.model.DiagnosticRow;
import com.fleet.diagnostics.model.FleetDiagnosticReport;
import com.fleet.diagnostics.model.FusionResult;
import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.IssueCause;
import com.fleet.diagnostics.model.SensorDegradation;
import com.fleet.diagnostics.model.UnitSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Main orchestrator for a diagnostic run over a fleet.
 *
 * Flow:
 * 1. Per unit, in parallel: life fractions, baselines, indicators, rule
 *    alerts and feature vectors
 * 2. Barrier: fit the fleet anomaly model on the pooled early-life vectors
 *    (or take a model fitted elsewhere)
 * 3. Check every feature set against the model before any scoring
 * 4. Per unit, in parallel: anomaly scores and fusion into tiers
 * 5. Rank sensors by fleet-level degradation
 *
 * Per-unit and per-sensor failures are reported as issues and never stop the
 * run. A failed model fit drops the anomaly evidence only; rule alerts and
 * rule-only tiers are still produced.
 */
@Service
public class FleetDiagnosticsService {

    private static final Logger log = LoggerFactory.getLogger(FleetDiagnosticsService.class);

    private final DiagnosticsConfig config;
    private final BaselineEstimator baselineEstimator;
    private final LifeNormalizer lifeNormalizer;
    private final RollingIndicatorComputer indicatorComputer;
    private final RuleEngine ruleEngine;
    private final FeatureExtractor featureExtractor;
    private final AnomalyModelTrainer modelTrainer;
    private final AnomalyScorer anomalyScorer;
    private final FusionService fusionService;
    private final SensorDegradationRanker degradationRanker;
    private final MetricsConfig metricsConfig;

    public FleetDiagnosticsService(DiagnosticsConfig config,
                                   BaselineEstimator baselineEstimator,
                                   LifeNormalizer lifeNormalizer,
                                   RollingIndicatorComputer indicatorComputer,
                                   RuleEngine ruleEngine,
                                   FeatureExtractor featureExtractor,
                                   AnomalyModelTrainer modelTrainer,
                                   AnomalyScorer anomalyScorer,
                                   FusionService fusionService,
                                   SensorDegradationRanker degradationRanker,
                                   MetricsConfig metricsConfig) {
        this.config = config;
        this.baselineEstimator = baselineEstimator;
        this.lifeNormalizer = lifeNormalizer;
        this.indicatorComputer = indicatorComputer;
        this.ruleEngine = ruleEngine;
        this.featureExtractor = featureExtractor;
        this.modelTrainer = modelTrainer;
        this.anomalyScorer = anomalyScorer;
        this.fusionService = fusionService;
        this.degradationRanker = degradationRanker;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Run the full pipeline, fitting the anomaly model on this fleet.
     */
    public FleetDiagnosticReport diagnose(List<UnitSeries> fleet) {
        return run(fleet, null);
    }

    /**
     * Run the pipeline against a model fitted on an earlier run.
     *
     * @throws com.fleet.diagnostics.exception.FeatureMismatchException before any
     *         scoring when the model's sensors differ from the configured ones
     */
    public FleetDiagnosticReport diagnose(List<UnitSeries> fleet, AnomalyModel model) {
        return run(fleet, Objects.requireNonNull(model, "model"));
    }

    private FleetDiagnosticReport run(List<UnitSeries> fleet, AnomalyModel suppliedModel) {
        log.info("=== Starting fleet diagnostics: {} units, sensors {} ===", fleet.size(), config.getSensors());

        ExecutorService pool = newWorkerPool();
        try {
            List<UnitAnalysis> analyses = awaitAll(fleet.stream()
                    .map(unit -> CompletableFuture.supplyAsync(() -> analyzeUnit(unit), pool))
                    .collect(Collectors.toList()));

            List<DiagnosticIssue> issues = new ArrayList<>();
            analyses.forEach(analysis -> issues.addAll(analysis.getIssues()));

            List<FeatureSet> featureSets = analyses.stream()
                    .map(UnitAnalysis::getFeatureSet)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toList());

            AnomalyModel model;
            AnomalyModelSummary modelSummary;
            if (suppliedModel != null) {
                model = suppliedModel;
                modelSummary = summarize(model, AnomalyModelSummary.Status.SUPPLIED);
            } else {
                try {
                    model = modelTrainer.fit(featureSets);
                    modelSummary = summarize(model, AnomalyModelSummary.Status.FITTED);
                    metricsConfig.recordModelFit("fitted", model.getTrainingSamples());
                } catch (ModelFitFailedException e) {
                    log.warn("Anomaly model fit failed, continuing with rule-only tiers: {}", e.getMessage());
                    model = null;
                    modelSummary = AnomalyModelSummary.builder()
                            .status(AnomalyModelSummary.Status.FAILED)
                            .sensors(List.copyOf(config.getSensors()))
                            .trainingSamples(e.getAvailableSamples())
                            .contamination(config.getAnomaly().getContamination())
                            .failureReason(e.getMessage())
                            .build();
                    issues.add(issue(null, null, IssueCause.MODEL_FIT_FAILED, e.getMessage()));
                    metricsConfig.recordModelFit("failed", e.getAvailableSamples());
                }
            }

            if (model != null) {
                for (FeatureSet featureSet : featureSets) {
                    anomalyScorer.checkCompatible(model, featureSet);
                }
            }

            AnomalyModel sharedModel = model;
            List<List<DiagnosticRow>> unitRows = awaitAll(analyses.stream()
                    .map(analysis -> CompletableFuture.supplyAsync(() -> assembleRows(analysis, sharedModel), pool))
                    .collect(Collectors.toList()));

            List<DiagnosticRow> rows = unitRows.stream()
                    .flatMap(List::stream)
                    .collect(Collectors.toList());
            issues.forEach(issue -> metricsConfig.recordIssue(issue.getCause()));

            List<SensorDegradation> ranking = degradationRanker.rank(fleet);

            logSummary(rows, issues, ranking);

            return FleetDiagnosticReport.builder()
                    .rows(rows)
                    .issues(List.copyOf(issues))
                    .anomalyModel(modelSummary)
                    .degradationRanking(ranking)
                    .build();
        } finally {
            pool.shutdownNow();
        }
    }

    UnitAnalysis analyzeUnit(UnitSeries unit) {
        String unitId = unit.getUnitId();
        List<DiagnosticIssue> issues = new ArrayList<>();

        double[] lifeFractions = null;
        try {
            lifeFractions = lifeNormalizer.lifeFractions(unit);
        } catch (UnknownLifeLengthException e) {
            log.warn("{}. Life-normalized views omitted for this unit.", e.getMessage());
            issues.add(issue(unitId, null, IssueCause.UNKNOWN_LIFE_LENGTH, e.getMessage()));
        }

        Map<String, List<IndicatorRecord>> recordsBySensor = new LinkedHashMap<>();
        List<Alert> alerts = new ArrayList<>();
        for (String sensorId : config.getSensors()) {
            Baseline baseline;
            try {
                baseline = baselineEstimator.estimate(unit, sensorId);
            } catch (InsufficientBaselineDataException e) {
                log.warn("Skipping unit {} sensor {}: {}", unitId, sensorId, e.getMessage());
                issues.add(issue(unitId, sensorId, IssueCause.INSUFFICIENT_BASELINE_DATA, e.getMessage()));
                continue;
            }

            List<IndicatorRecord> records = indicatorComputer.compute(unit, sensorId, baseline, lifeFractions);
            recordsBySensor.put(sensorId, records);
            alerts.addAll(ruleEngine.evaluate(records));
        }

        FeatureSet featureSet = null;
        if (recordsBySensor.size() == config.getSensors().size()) {
            DiagnosticsConfig.Indicators windows = config.getIndicators();
            featureSet = featureExtractor.extract(unit, List.copyOf(config.getSensors()), recordsBySensor,
                    baselineEstimator.windowLength(unit.size()),
                    Math.max(windows.getWindow(), windows.getTrendWindow()));
        } else {
            String message = String.format("Unit %s has baselines for %d of %d sensors; anomaly scoring skipped",
                    unitId, recordsBySensor.size(), config.getSensors().size());
            log.warn(message);
            issues.add(issue(unitId, null, IssueCause.EXCLUDED_FROM_ANOMALY_MODEL, message));
        }

        log.debug("Analyzed unit {}: {} cycles, {} alerts, {} feature vectors",
                unitId, unit.size(), alerts.size(), featureSet == null ? 0 : featureSet.getVectors().size());

        return UnitAnalysis.builder()
                .unit(unit)
                .lifeFractions(lifeFractions)
                .recordsBySensor(recordsBySensor)
                .alerts(alerts)
                .featureSet(featureSet)
                .issues(issues)
                .build();
    }

    List<DiagnosticRow> assembleRows(UnitAnalysis analysis, AnomalyModel model) {
        UnitSeries unit = analysis.getUnit();

        Map<Integer, AnomalyScore> scoresByCycle = new HashMap<>();
        if (model != null && analysis.getFeatureSet() != null) {
            for (AnomalyScore score : anomalyScorer.score(model, analysis.getFeatureSet())) {
                scoresByCycle.put(score.getCycle(), score);
            }
        }

        Map<Integer, List<Alert>> alertsByCycle = analysis.getAlerts().stream()
                .collect(Collectors.groupingBy(Alert::getCycle));

        Map<String, Map<Integer, IndicatorRecord>> recordIndex = new LinkedHashMap<>();
        analysis.getRecordsBySensor().forEach((sensorId, records) -> {
            Map<Integer, IndicatorRecord> byCycle = new HashMap<>();
            records.forEach(record -> byCycle.put(record.getCycle(), record));
            recordIndex.put(sensorId, byCycle);
        });

        double[] lifeFractions = analysis.getLifeFractions();
        List<DiagnosticRow> rows = new ArrayList<>(unit.size());
        for (int i = 0; i < unit.size(); i++) {
            int cycle = unit.cycleAt(i);

            Map<String, IndicatorRecord> indicators = new LinkedHashMap<>();
            recordIndex.forEach((sensorId, byCycle) -> {
                IndicatorRecord record = byCycle.get(cycle);
                if (record != null) {
                    indicators.put(sensorId, record);
                }
            });

            AnomalyScore score = scoresByCycle.get(cycle);
            FusionResult fusion = fusionService.fuse(unit.getUnitId(), cycle,
                    alertsByCycle.getOrDefault(cycle, List.of()), score);
            metricsConfig.recordTier(fusion.getTier());

            rows.add(DiagnosticRow.builder()
                    .unitId(unit.getUnitId())
                    .cycle(cycle)
                    .lifeFraction(lifeFractions != null ? lifeFractions[i] : null)
                    .indicators(indicators)
                    .alerts(fusion.getAlerts())
                    .anomalyScore(score != null ? score.getScore() : null)
                    .anomaly(score != null ? score.isAnomaly() : null)
                    .anomalyContributors(score != null ? score.getTopContributors() : List.of())
                    .tier(fusion.getTier())
                    .build());
        }
        return rows;
    }

    private ExecutorService newWorkerPool() {
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getExecution().getParallelism(), r -> {
            Thread t = new Thread(r, "diagnostics-worker-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Wait for every task, then rethrow the first failure unwrapped.
     */
    private static <T> List<T> awaitAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            if (e.getCause() instanceof Error) {
                throw (Error) e.getCause();
            }
            throw e;
        }
        return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
    }

    private AnomalyModelSummary summarize(AnomalyModel model, AnomalyModelSummary.Status status) {
        return AnomalyModelSummary.builder()
                .status(status)
                .sensors(model.getSensors())
                .trainingSamples(model.getTrainingSamples())
                .calibrationSamples(model.getCalibrationSamples())
                .threshold(model.getThreshold())
                .contamination(model.getContamination())
                .build();
    }

    private static DiagnosticIssue issue(String unitId, String sensorId, IssueCause cause, String message) {
        return DiagnosticIssue.builder()
                .unitId(unitId)
                .sensorId(sensorId)
                .cause(cause)
                .message(message)
                .build();
    }

    private void logSummary(List<DiagnosticRow> rows, List<DiagnosticIssue> issues, List<SensorDegradation> ranking) {
        Map<ConfidenceTier, Long> tiers = new EnumMap<>(ConfidenceTier.class);
        rows.forEach(row -> tiers.merge(row.getTier(), 1L, Long::sum));

        log.info("=== Fleet diagnostics complete: {} rows, tiers {}, {} issues ===", rows.size(), tiers, issues.size());
        if (!ranking.isEmpty()) {
            SensorDegradation top = ranking.get(0);
            log.info("Most degraded sensor: {} (score={})", top.getSensorId(), String.format("%.3f", top.getScore()));
        }
    }
}
