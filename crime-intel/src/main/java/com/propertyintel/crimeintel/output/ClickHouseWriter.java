package com.propertyintel.crimeintel.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.crimeintel.model.AnalysisRun;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS crime_intel");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS crime_intel.anomalies
            (
                run_id              String,
                anomaly_id          String,
                anomaly_type        LowCardinality(String),
                severity            Float64,
                description         String,
                latitude            Nullable(Float64),
                longitude           Nullable(Float64),
                related_entities    Array(String),
                metrics             String,
                baseline            Nullable(String),
                deviation           Float64,
                confidence          Float64,
                detected_at         DateTime
            )
            ENGINE = MergeTree()
            PARTITION BY toYYYYMM(detected_at)
            ORDER BY (anomaly_type, detected_at)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS crime_intel.linkages
            (
                run_id              String,
                source_incident_id  String,
                target_incident_id  String,
                linkage_type        LowCardinality(String),
                confidence          Float64,
                explanation         String,
                metadata            String,
                linked_at           DateTime
            )
            ENGINE = ReplacingMergeTree()
            ORDER BY (source_incident_id, target_incident_id, linkage_type)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS crime_intel.analysis_runs
            (
                run_id              String,
                kind                LowCardinality(String),
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                input_count         Int32,
                output_count        Int32,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, kind)
        """);

        log.info("ClickHouse schema ready.");
    }

    public void writeAnomalies(List<AnomalyRecord> anomalies, String runId) {
        writeInBatches("""
            INSERT INTO crime_intel.anomalies
            (run_id, anomaly_id, anomaly_type, severity, description, latitude, longitude,
             related_entities, metrics, baseline, deviation, confidence, detected_at)
            VALUES
            """, anomalies, a -> anomalyRow(a, runId));
    }

    public void writeLinkages(List<LinkageEdge> linkages, String runId) {
        String linkedAt = sqlStr(DATE_TIME.format(LocalDateTime.now(ZoneOffset.UTC)));
        writeInBatches("""
            INSERT INTO crime_intel.linkages
            (run_id, source_incident_id, target_incident_id, linkage_type, confidence,
             explanation, metadata, linked_at)
            VALUES
            """, linkages, e -> linkageRow(e, runId, linkedAt));
    }

    public void writeAnalysisRun(AnalysisRun run) {
        try {
            String sql = String.format(Locale.ROOT, """
                INSERT INTO crime_intel.analysis_runs
                (run_id, kind, started_at, completed_at, status, input_count, output_count, error_message)
                VALUES (%s,%s,%s,%s,%s,%d,%d,%s)
                """,
                    sqlStr(run.getRunId()),
                    sqlStr(run.getKind()),
                    sqlDateTime(run.getStartedAt()),
                    sqlDateTime(run.getCompletedAt()),
                    sqlStr(run.getStatus()),
                    run.getInputCount(),
                    run.getOutputCount(),
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write analysis run: {}", e.getMessage());
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * One INSERT ... VALUES statement per batch; the ClickHouse JDBC driver
     * handles this more reliably than PreparedStatement batches.
     */
    private <T> void writeInBatches(String insert, List<T> rows, Function<T, String> toValueRow) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<T> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                jdbcTemplate.execute(insert + batch.stream().map(toValueRow).collect(Collectors.joining(",\n")));
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }
        log.info("Successfully wrote {} rows", total);
    }

    private String anomalyRow(AnomalyRecord a, String runId) {
        return String.format(Locale.ROOT, "(%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s)",
                sqlStr(runId),
                sqlStr(a.getAnomalyId()),
                sqlStr(a.getAnomalyType().getValue()),
                a.getSeverity(),
                sqlStr(a.getDescription()),
                a.getLocation() != null ? a.getLocation().latitude() : "NULL",
                a.getLocation() != null ? a.getLocation().longitude() : "NULL",
                sqlArray(a.getRelatedEntities()),
                sqlStr(json(a.getMetrics())),
                a.getBaseline() != null ? sqlStr(json(a.getBaseline())) : "NULL",
                a.getDeviation(),
                a.getConfidence(),
                sqlDateTime(a.getDetectedAt())
        );
    }

    private String linkageRow(LinkageEdge e, String runId, String linkedAt) {
        return String.format(Locale.ROOT, "(%s,%s,%s,%s,%s,%s,%s,%s)",
                sqlStr(runId),
                sqlStr(e.getSourceIncidentId()),
                sqlStr(e.getTargetIncidentId()),
                sqlStr(e.getLinkageType().getValue()),
                e.getConfidence(),
                sqlStr(e.getExplanation()),
                sqlStr(json(e.getMetadata())),
                linkedAt
        );
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialise {} to JSON: {}", value, e.getMessage());
            return "{}";
        }
    }

    private String sqlArray(List<String> values) {
        if (values == null || values.isEmpty()) return "[]";
        return values.stream().map(this::sqlStr).collect(Collectors.joining(",", "[", "]"));
    }

    private String sqlDateTime(LocalDateTime val) {
        return val == null ? "NULL" : sqlStr(DATE_TIME.format(val));
    }

    private String sqlDateTime(Instant val) {
        return val == null ? "NULL" : sqlDateTime(LocalDateTime.ofInstant(val, ZoneOffset.UTC));
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
