package com.fleet.diagnostics.engine.isolationforest;

import com.fleet.diagnostics.model.IndicatorRecord;
import com.fleet.diagnostics.model.UnitSeries;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    private static IndicatorRecord record(String sensor, int cycle, Double mean, Double var, Double trend) {
        return IndicatorRecord.builder()
                .unitId("U1").sensorId(sensor).cycle(cycle)
                .meanShiftZ(mean).varianceRatio(var).trendSlopeZ(trend)
                .build();
    }

    private static UnitSeries unit(int cycles) {
        int[] axis = new int[cycles];
        for (int i = 0; i < cycles; i++) {
            axis[i] = i + 1;
        }
        return UnitSeries.builder().unitId("U1").cycles(axis).observedLife(cycles).build();
    }

    private static List<IndicatorRecord> flat(String sensor, int fromCycle, int toCycle) {
        List<IndicatorRecord> records = new ArrayList<>();
        for (int c = fromCycle; c <= toCycle; c++) {
            records.add(record(sensor, c, 0.0, 1.0, 0.0));
        }
        return records;
    }

    @Test
    void extract_ordersFeaturesBySensorThenIndicator() {
        Map<String, List<IndicatorRecord>> records = Map.of(
                "a", List.of(record("a", 10, 0.1, 1.1, 0.2)),
                "b", List.of(record("b", 10, -0.3, 0.9, 0.4)));

        FeatureSet set = extractor.extract(unit(12), List.of("b", "a"), records, 12, 5);

        assertThat(set.getUnitId()).isEqualTo("U1");
        assertThat(set.getSensors()).containsExactly("b", "a");
        assertThat(set.getVectors()).singleElement().satisfies(v -> {
            assertThat(v.getCycle()).isEqualTo(10);
            assertThat(v.getValues()).containsExactly(-0.3, 0.9, 0.4, 0.1, 1.1, 0.2);
            assertThat(v.getStage()).isEqualTo(FeatureVector.Stage.BASELINE);
        });
    }

    @Test
    void extract_skipsCyclesWithAnyUndefinedIndicator() {
        Map<String, List<IndicatorRecord>> records = Map.of(
                "a", List.of(record("a", 5, 0.0, 1.0, null), record("a", 10, 0.0, 1.0, 0.0), record("a", 11, 0.0, 1.0, 0.0)),
                "b", List.of(record("b", 5, 0.0, 1.0, null), record("b", 10, 0.0, 1.0, 0.0)));

        FeatureSet set = extractor.extract(unit(12), List.of("a", "b"), records, 10, 5);

        assertThat(set.getVectors()).extracting(FeatureVector::getCycle).containsExactly(10);
    }

    @Test
    void extract_calibrationStartsOnceIndicatorWindowsClearTheBaseline() {
        // Baseline is cycles 1..10; a 4-cycle window ending at cycle 14 first excludes it
        FeatureSet set = extractor.extract(unit(30), List.of("a"), Map.of("a", flat("a", 4, 30)), 10, 4);

        assertThat(set.getVectors()).filteredOn(v -> v.getStage() == FeatureVector.Stage.BASELINE)
                .extracting(FeatureVector::getCycle).containsExactly(4, 5, 6, 7, 8, 9, 10);
        assertThat(set.getVectors()).filteredOn(v -> v.getStage() == FeatureVector.Stage.CALIBRATION)
                .extracting(FeatureVector::getCycle).containsExactly(14, 15, 16, 17, 18, 19, 20, 21, 22, 23);
        assertThat(set.getVectors()).filteredOn(v -> v.getStage() == FeatureVector.Stage.MONITORED)
                .extracting(FeatureVector::getCycle).containsExactly(11, 12, 13, 24, 25, 26, 27, 28, 29, 30);
    }

    @Test
    void stageOf_boundariesFollowBaselineAndLookback() {
        assertThat(FeatureExtractor.stageOf(9, 10, 20)).isEqualTo(FeatureVector.Stage.BASELINE);
        assertThat(FeatureExtractor.stageOf(28, 10, 20)).isEqualTo(FeatureVector.Stage.MONITORED);
        assertThat(FeatureExtractor.stageOf(29, 10, 20)).isEqualTo(FeatureVector.Stage.CALIBRATION);
        assertThat(FeatureExtractor.stageOf(38, 10, 20)).isEqualTo(FeatureVector.Stage.CALIBRATION);
        assertThat(FeatureExtractor.stageOf(39, 10, 20)).isEqualTo(FeatureVector.Stage.MONITORED);
    }

    @Test
    void featureVector_copiesValuesInAndOut() {
        double[] values = {1.0, 2.0, 3.0};
        FeatureVector vector = new FeatureVector(7, values, FeatureVector.Stage.MONITORED);

        values[0] = 99.0;
        vector.getValues()[1] = 99.0;

        assertThat(vector.getValues()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void extract_missingSensor_throws() {
        assertThatThrownBy(() -> extractor.extract(unit(12), List.of("a", "z"),
                Map.of("a", List.of(record("a", 10, 0.0, 1.0, 0.0))), 10, 5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("z");
    }
}
