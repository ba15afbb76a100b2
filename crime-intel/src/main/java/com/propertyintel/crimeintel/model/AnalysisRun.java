package com.propertyintel.crimeintel.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each detection, linkage or baseline run for observability.
 * Stored in the analysis_runs table in ClickHouse.
 */
@Data
@Builder
public class AnalysisRun {

    private String runId;           // UUID
    private RunKind kind;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int inputCount;         // events or seed incident ids
    private int outputCount;        // anomalies or surviving edges
    private String errorMessage;    // null on success

    public enum RunKind {
        DETECTION, LINKAGE, BASELINE
    }
}
