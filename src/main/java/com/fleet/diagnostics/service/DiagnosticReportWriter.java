package com.fleet.diagnostics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fleet.diagnostics.model.FleetDiagnosticReport;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Serialises a report to JSON. Properties and map keys are written in sorted
 * order, so the same report always produces the same bytes.
 */
@Component
public class DiagnosticReportWriter {

    private final ObjectMapper objectMapper;

    public DiagnosticReportWriter() {
        this.objectMapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .build();
    }

    public String toJson(FleetDiagnosticReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise diagnostic report", e);
        }
    }

    public void write(FleetDiagnosticReport report, Writer out) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write diagnostic report", e);
        }
    }
}
