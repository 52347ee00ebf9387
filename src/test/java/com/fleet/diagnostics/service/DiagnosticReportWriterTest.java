package com.fleet.diagnostics.service;

import com.fleet.diagnostics.model.AnomalyModelSummary;
import com.fleet.diagnostics.model.ConfidenceTier;
import com.fleet.diagnostics.model.DiagnosticRow;
import com.fleet.diagnostics.model.FleetDiagnosticReport;
import com.fleet.diagnostics.model.IndicatorRecord;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticReportWriterTest {

    private final DiagnosticReportWriter writer = new DiagnosticReportWriter();

    private static FleetDiagnosticReport report(Map<String, IndicatorRecord> indicators) {
        DiagnosticRow row = DiagnosticRow.builder()
                .unitId("U1")
                .cycle(12)
                .lifeFraction(0.06)
                .indicators(indicators)
                .alerts(List.of())
                .anomalyContributors(List.of())
                .tier(ConfidenceTier.NORMAL)
                .build();
        return FleetDiagnosticReport.builder()
                .rows(List.of(row))
                .issues(List.of())
                .anomalyModel(AnomalyModelSummary.builder()
                        .status(AnomalyModelSummary.Status.FITTED)
                        .sensors(List.of("s2", "s1"))
                        .trainingSamples(120)
                        .threshold(0.61)
                        .contamination(0.05)
                        .build())
                .degradationRanking(List.of())
                .build();
    }

    private static IndicatorRecord record(String sensor) {
        return IndicatorRecord.builder().unitId("U1").sensorId(sensor).cycle(12)
                .meanShiftZ(0.1).varianceRatio(1.2).trendSlopeZ(-0.3).build();
    }

    @Test
    void toJson_mapInsertionOrderDoesNotChangeOutput() {
        Map<String, IndicatorRecord> forward = new LinkedHashMap<>();
        forward.put("s1", record("s1"));
        forward.put("s2", record("s2"));
        Map<String, IndicatorRecord> reverse = new LinkedHashMap<>();
        reverse.put("s2", record("s2"));
        reverse.put("s1", record("s1"));

        assertThat(writer.toJson(report(forward))).isEqualTo(writer.toJson(report(reverse)));
    }

    @Test
    void toJson_writesPropertiesAlphabetically() {
        String json = writer.toJson(report(Map.of("s1", record("s1"))));

        assertThat(json).startsWith("{\"anomalyModel\":");
        assertThat(json.indexOf("\"issues\"")).isLessThan(json.indexOf("\"rows\""));
        assertThat(json).contains("\"tier\":\"NORMAL\"");
        assertThat(json).doesNotContain("\"complete\"");
    }

    @Test
    void write_prettyPrintsToWriter() {
        StringWriter out = new StringWriter();

        writer.write(report(Map.of()), out);

        assertThat(out.toString()).contains("\"status\" : \"FITTED\"");
    }
}
