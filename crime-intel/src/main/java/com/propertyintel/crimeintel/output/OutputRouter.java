package com.propertyintel.crimeintel.output;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnalysisRun;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Routes output to the appropriate sink(s) based on configuration.
 * Supports CLICKHOUSE, CSV, or BOTH modes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final ClickHouseWriter clickHouseWriter;
    private final CsvWriter csvWriter;
    private final CrimeIntelProperties properties;

    public void writeAnomalies(List<AnomalyRecord> anomalies, String runId) {
        if (anomalies.isEmpty()) return;

        switch (properties.getOutput().getMode()) {
            case CLICKHOUSE -> clickHouseWriter.writeAnomalies(anomalies, runId);
            case CSV -> csvWriter.writeAnomalies(anomalies, runId);
            case BOTH -> {
                clickHouseWriter.writeAnomalies(anomalies, runId);
                csvWriter.writeAnomalies(anomalies, runId);
            }
        }
    }

    public void writeLinkages(List<LinkageEdge> linkages, String runId) {
        if (linkages.isEmpty()) return;

        switch (properties.getOutput().getMode()) {
            case CLICKHOUSE -> clickHouseWriter.writeLinkages(linkages, runId);
            case CSV -> csvWriter.writeLinkages(linkages, runId);
            case BOTH -> {
                clickHouseWriter.writeLinkages(linkages, runId);
                csvWriter.writeLinkages(linkages, runId);
            }
        }
    }

    public void writeAnalysisRun(AnalysisRun run) {
        try {
            if (properties.getOutput().getMode() != CrimeIntelProperties.Output.OutputMode.CSV) {
                clickHouseWriter.writeAnalysisRun(run);
            }
        } catch (Exception e) {
            log.warn("Failed to write analysis run metadata: {}", e.getMessage());
        }
    }
}
