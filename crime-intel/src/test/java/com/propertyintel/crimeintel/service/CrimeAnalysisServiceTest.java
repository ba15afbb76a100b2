package com.propertyintel.crimeintel.service;

import com.propertyintel.crimeintel.model.AnalysisRun;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageResult;
import com.propertyintel.crimeintel.model.LinkageType;
import com.propertyintel.crimeintel.output.OutputRouter;
import com.propertyintel.crimeintel.service.anomaly.AnomalyDetector;
import com.propertyintel.crimeintel.service.event.EventRecordParser;
import com.propertyintel.crimeintel.service.linkage.IncidentLinker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CrimeAnalysisServiceTest {

    @Mock
    private EventRecordParser parser;

    @Mock
    private AnomalyDetector detector;

    @Mock
    private IncidentLinker linker;

    @Mock
    private OutputRouter outputRouter;

    private CrimeAnalysisService service;

    @BeforeEach
    void setUp() {
        service = new CrimeAnalysisService(parser, detector, linker, outputRouter);
    }

    private AnalysisRun capturedRun() {
        ArgumentCaptor<AnalysisRun> run = ArgumentCaptor.forClass(AnalysisRun.class);
        verify(outputRouter).writeAnalysisRun(run.capture());
        return run.getValue();
    }

    @Test
    void detectionRunRecordsCountsAndRoutesAnomalies() {
        List<Map<String, Object>> raw = List.of(Map.of("event_type", "gunfire"), Map.of("event_type", "gunfire"));
        List<EventRecord> events = List.of(EventRecord.builder().eventType("gunfire").build());
        List<AnomalyRecord> anomalies = List.of(AnomalyRecord.builder()
                .anomalyId("a-1").anomalyType(AnomalyType.GUNFIRE_DENSITY).build());
        when(parser.parseAll(raw)).thenReturn(events);
        when(detector.detect(events)).thenReturn(anomalies);

        List<AnomalyRecord> result = service.detectAnomalies(raw);

        assertThat(result).isSameAs(anomalies);
        AnalysisRun run = capturedRun();
        assertThat(run.getKind()).isEqualTo(AnalysisRun.RunKind.DETECTION);
        assertThat(run.getStatus()).isEqualTo("SUCCESS");
        assertThat(run.getInputCount()).isEqualTo(2);
        assertThat(run.getOutputCount()).isEqualTo(1);
        assertThat(run.getCompletedAt()).isNotNull();
        verify(outputRouter).writeAnomalies(anomalies, run.getRunId());
    }

    @Test
    void sinkFailureMarksRunFailedButKeepsAnomalies() {
        List<AnomalyRecord> anomalies = List.of(AnomalyRecord.builder()
                .anomalyId("a-1").anomalyType(AnomalyType.REPEAT_CALLER).build());
        when(parser.parseAll(anyList())).thenReturn(List.of());
        when(detector.detect(anyList())).thenReturn(anomalies);
        doThrow(new IllegalStateException("clickhouse down")).when(outputRouter).writeAnomalies(anyList(), anyString());

        List<AnomalyRecord> result = service.detectAnomalies(List.of());

        assertThat(result).isSameAs(anomalies);
        AnalysisRun run = capturedRun();
        assertThat(run.getStatus()).isEqualTo("FAILED");
        assertThat(run.getErrorMessage()).isEqualTo("clickhouse down");
    }

    @Test
    void linkageRunRoutesSurvivingEdges() {
        LinkageEdge edge = LinkageEdge.builder()
                .sourceIncidentId("INC-1").targetIncidentId("INC-2")
                .linkageType(LinkageType.TEMPORAL).confidence(0.45).build();
        LinkageResult linked = LinkageResult.builder()
                .linkedIncidents(List.of())
                .linkages(List.of(edge))
                .confidenceScores(Map.of("INC-1", 0.45, "INC-2", 0.45))
                .explanations(List.of("temporal: INC-1 -> INC-2"))
                .build();
        when(linker.link(List.of("INC-1"))).thenReturn(linked);

        LinkageResult result = service.linkIncidents(List.of("INC-1"));

        assertThat(result).isSameAs(linked);
        AnalysisRun run = capturedRun();
        assertThat(run.getKind()).isEqualTo(AnalysisRun.RunKind.LINKAGE);
        assertThat(run.getOutputCount()).isEqualTo(1);
        verify(outputRouter).writeLinkages(List.of(edge), run.getRunId());
    }

    @Test
    void linkerFailureYieldsEmptyResultWithNote() {
        when(linker.link(List.of("INC-1"))).thenThrow(new IllegalStateException("boom"));

        LinkageResult result = service.linkIncidents(List.of("INC-1"));

        assertThat(result.getLinkages()).isEmpty();
        assertThat(result.getExplanations()).containsExactly("Linkage failed: boom");
        assertThat(capturedRun().getStatus()).isEqualTo("FAILED");
    }

    @Test
    void historyIngestFeedsBaselines() {
        List<EventRecord> events = List.of(
                EventRecord.builder().eventType("cad_call").build(),
                EventRecord.builder().eventType("cad_call").build());
        when(parser.parseAll(anyList())).thenReturn(events);

        int parsed = service.ingestHistory(List.of(Map.of(), Map.of(), Map.of()));

        assertThat(parsed).isEqualTo(2);
        verify(detector).updateBaseline(events);
        AnalysisRun run = capturedRun();
        assertThat(run.getKind()).isEqualTo(AnalysisRun.RunKind.BASELINE);
        assertThat(run.getInputCount()).isEqualTo(3);
    }
}
