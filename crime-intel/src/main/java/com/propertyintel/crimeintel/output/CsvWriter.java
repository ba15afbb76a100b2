package com.propertyintel.crimeintel.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.function.Function;

/**
 * Writes anomalies and linkages to CSV files, one file per run.
 *
 * Output path patterns:
 *   {outputDir}/anomalies_{runId}.csv
 *   {outputDir}/linkages_{runId}.csv
 *
 * Metrics, baselines and edge metadata are written as JSON strings so the
 * files load into ClickHouse with FORMAT CSVWithNames unchanged.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CsvWriter {

    static final String[] ANOMALY_HEADERS = {
            "anomaly_id", "anomaly_type", "severity", "description",
            "latitude", "longitude", "related_entities",
            "metrics", "baseline", "deviation", "confidence", "detected_at"
    };

    static final String[] LINKAGE_HEADERS = {
            "source_incident_id", "target_incident_id", "linkage_type",
            "confidence", "explanation", "metadata"
    };

    private final CrimeIntelProperties properties;
    private final ObjectMapper objectMapper;

    public Path writeAnomalies(List<AnomalyRecord> anomalies, String runId) {
        return write("anomalies_" + runId + ".csv", ANOMALY_HEADERS, anomalies, this::toRow);
    }

    public Path writeLinkages(List<LinkageEdge> linkages, String runId) {
        return write("linkages_" + runId + ".csv", LINKAGE_HEADERS, linkages, this::toRow);
    }

    private <T> Path write(String filename, String[] headers, List<T> rows, Function<T, String[]> toRow) {
        if (rows.isEmpty()) return null;

        Path outputDir = Paths.get(properties.getOutput().getCsv().getOutputDir());
        ensureDirectory(outputDir);
        Path outputPath = outputDir.resolve(filename);

        try (CSVWriter writer = new CSVWriter(
                Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8),
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END)) {

            if (properties.getOutput().getCsv().isIncludeHeader()) {
                writer.writeNext(headers);
            }
            for (T row : rows) {
                writer.writeNext(toRow.apply(row));
            }

            log.info("Written {} rows to CSV: {}", rows.size(), outputPath);
            return outputPath;

        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", outputPath, e.getMessage(), e);
            throw new UncheckedIOException("CSV write failed: " + outputPath, e);
        }
    }

    private String[] toRow(AnomalyRecord a) {
        return new String[]{
                str(a.getAnomalyId()),
                str(a.getAnomalyType().getValue()),
                str(a.getSeverity()),
                str(a.getDescription()),
                a.getLocation() != null ? str(a.getLocation().latitude()) : "",
                a.getLocation() != null ? str(a.getLocation().longitude()) : "",
                String.join("|", a.getRelatedEntities()),
                json(a.getMetrics()),
                a.getBaseline() != null ? json(a.getBaseline()) : "",
                str(a.getDeviation()),
                str(a.getConfidence()),
                str(a.getDetectedAt())
        };
    }

    private String[] toRow(LinkageEdge e) {
        return new String[]{
                str(e.getSourceIncidentId()),
                str(e.getTargetIncidentId()),
                str(e.getLinkageType().getValue()),
                str(e.getConfidence()),
                str(e.getExplanation()),
                json(e.getMetadata())
        };
    }

    private String json(Object value) {
        if (value == null) return "";
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise {} to JSON: {}", value, e.getMessage());
            return "";
        }
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory: " + dir, e);
        }
    }
}
