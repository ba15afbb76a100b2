package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.service.baseline.BaselineTracker;
import com.propertyintel.crimeintel.service.baseline.EventHistory;
import com.propertyintel.crimeintel.service.event.EventRecordParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs every registered {@link DetectionStrategy} over an event batch.
 *
 * Strategies run in parallel on the analysis executor and their results are
 * concatenated in registration order. A strategy that throws is logged and
 * contributes nothing; detection itself never fails.
 */
@Service
@Slf4j
public class AnomalyDetector {

    private static final DateTimeFormatter HOUR_BUCKET = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");

    private final List<DetectionStrategy> strategies;
    private final BaselineTracker baselines;
    private final EventHistory history;
    private final EventRecordParser parser;
    private final Executor executor;

    public AnomalyDetector(List<DetectionStrategy> strategies,
                           BaselineTracker baselines,
                           EventHistory history,
                           EventRecordParser parser,
                           @Qualifier("analysisExecutor") Executor executor) {
        this.strategies = List.copyOf(strategies);
        this.baselines = baselines;
        this.history = history;
        this.parser = parser;
        this.executor = executor;
    }

    /**
     * Detect anomalies in an already-parsed batch.
     *
     * @return anomalies from every strategy; empty for an empty batch
     */
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        if (events == null || events.isEmpty()) return List.of();

        log.info("Detecting anomalies in {} events across {} strategies", events.size(), strategies.size());

        List<CompletableFuture<List<AnomalyRecord>>> futures = new ArrayList<>(strategies.size());
        for (DetectionStrategy strategy : strategies) {
            futures.add(submit(strategy, events));
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (CompletableFuture<List<AnomalyRecord>> future : futures) {
            anomalies.addAll(future.join());
        }

        log.info("Anomaly detection complete: {} anomalies from {} events", anomalies.size(), events.size());
        return anomalies;
    }

    /**
     * Parse loosely-keyed maps, then detect.
     */
    public List<AnomalyRecord> detectRaw(List<Map<String, Object>> rawEvents) {
        return detect(parser.parseAll(rawEvents));
    }

    /**
     * Add events to the bounded history and recompute the per-type hourly
     * count baselines ({@code <type>_hourly}).
     */
    public void updateBaseline(List<EventRecord> events) {
        if (events == null || events.isEmpty()) return;
        int retained = history.append(events);
        log.info("Baseline update: {} of {} events retained in history", retained, events.size());
        recalculateBaselines();
    }

    /**
     * Recompute every per-type hourly baseline from the current history.
     */
    public void recalculateBaselines() {
        Map<String, List<EventRecord>> snapshot = history.snapshot();
        for (Map.Entry<String, List<EventRecord>> entry : snapshot.entrySet()) {
            Map<String, Integer> countsByHour = new LinkedHashMap<>();
            for (EventRecord event : entry.getValue()) {
                countsByHour.merge(HOUR_BUCKET.format(event.getTimestamp()), 1, Integer::sum);
            }
            if (countsByHour.isEmpty()) continue;

            List<Double> samples = countsByHour.values().stream().map(Integer::doubleValue).toList();
            baselines.update(entry.getKey() + "_hourly", samples);
        }
        log.debug("Recalculated hourly baselines for {} event types", snapshot.size());
    }

    /** Install every strategy's cold-start priors. */
    public void seedPriors() {
        strategies.forEach(DetectionStrategy::seedPriors);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private CompletableFuture<List<AnomalyRecord>> submit(DetectionStrategy strategy, List<EventRecord> events) {
        try {
            return CompletableFuture.supplyAsync(() -> runSafely(strategy, events), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Executor saturated, running {} inline", strategy.getType());
            return CompletableFuture.completedFuture(runSafely(strategy, events));
        }
    }

    private List<AnomalyRecord> runSafely(DetectionStrategy strategy, List<EventRecord> events) {
        try {
            List<AnomalyRecord> found = strategy.detect(events);
            log.debug("{} produced {} anomalies", strategy.getType(), found.size());
            return found;
        } catch (Exception e) {
            log.error("{} strategy failed: {}", strategy.getType(), e.getMessage(), e);
            return List.of();
        }
    }
}
