package com.propertyintel.crimeintel.service;

import com.propertyintel.crimeintel.model.AnalysisRun;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.LinkageResult;
import com.propertyintel.crimeintel.output.OutputRouter;
import com.propertyintel.crimeintel.service.anomaly.AnomalyDetector;
import com.propertyintel.crimeintel.service.event.EventRecordParser;
import com.propertyintel.crimeintel.service.linkage.IncidentLinker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for callers: runs detection, linkage and history ingestion,
 * records each as an {@link AnalysisRun} and routes results to the
 * configured sinks.
 *
 * Sink failures mark the run FAILED but never take the computed result
 * away from the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CrimeAnalysisService {

    private final EventRecordParser parser;
    private final AnomalyDetector detector;
    private final IncidentLinker linker;
    private final OutputRouter outputRouter;

    public List<AnomalyRecord> detectAnomalies(List<Map<String, Object>> rawEvents) {
        AnalysisRun run = start(AnalysisRun.RunKind.DETECTION, rawEvents == null ? 0 : rawEvents.size());
        List<AnomalyRecord> anomalies = List.of();

        try {
            anomalies = detector.detect(parser.parseAll(rawEvents == null ? List.of() : rawEvents));
            run.setOutputCount(anomalies.size());
            outputRouter.writeAnomalies(anomalies, run.getRunId());
            run.setStatus("SUCCESS");
        } catch (Exception e) {
            fail(run, e);
        } finally {
            finish(run);
        }
        return anomalies;
    }

    public LinkageResult linkIncidents(Collection<String> incidentIds) {
        AnalysisRun run = start(AnalysisRun.RunKind.LINKAGE, incidentIds == null ? 0 : incidentIds.size());
        LinkageResult result = null;

        try {
            result = linker.link(incidentIds);
            run.setOutputCount(result.getLinkages().size());
            outputRouter.writeLinkages(result.getLinkages(), run.getRunId());
            run.setStatus("SUCCESS");
        } catch (Exception e) {
            fail(run, e);
        } finally {
            finish(run);
        }
        return result != null ? result : LinkageResult.empty("Linkage failed: " + run.getErrorMessage());
    }

    /**
     * Feed historical events into the baseline history.
     *
     * @return number of events parsed
     */
    public int ingestHistory(List<Map<String, Object>> rawEvents) {
        AnalysisRun run = start(AnalysisRun.RunKind.BASELINE, rawEvents == null ? 0 : rawEvents.size());
        int parsed = 0;

        try {
            List<EventRecord> events = parser.parseAll(rawEvents == null ? List.of() : rawEvents);
            detector.updateBaseline(events);
            parsed = events.size();
            run.setOutputCount(parsed);
            run.setStatus("SUCCESS");
        } catch (Exception e) {
            fail(run, e);
        } finally {
            finish(run);
        }
        return parsed;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private AnalysisRun start(AnalysisRun.RunKind kind, int inputCount) {
        return AnalysisRun.builder()
                .runId(UUID.randomUUID().toString())
                .kind(kind)
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .inputCount(inputCount)
                .build();
    }

    private void fail(AnalysisRun run, Exception e) {
        log.error("{} run {} failed: {}", run.getKind(), run.getRunId(), e.getMessage(), e);
        run.setStatus("FAILED");
        run.setErrorMessage(e.getMessage());
    }

    private void finish(AnalysisRun run) {
        run.setCompletedAt(LocalDateTime.now());
        outputRouter.writeAnalysisRun(run);
    }
}
