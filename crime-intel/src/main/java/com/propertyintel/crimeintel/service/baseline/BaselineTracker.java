package com.propertyintel.crimeintel.service.baseline;

import com.propertyintel.crimeintel.model.BaselineMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide store of named baselines.
 *
 * Updates replace a whole metric at a time and are serialised through a
 * single write lock; readers see either the old or the new metric.
 */
@Component
@Slf4j
public class BaselineTracker {

    private final Map<String, BaselineMetric> metrics = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Replace the baseline for {@code metricName} with one computed over
     * exactly these samples. Does nothing for an empty list.
     */
    public void update(String metricName, List<Double> samples) {
        if (samples == null || samples.isEmpty()) return;

        BaselineMetric metric = BaselineMetric.fromSamples(metricName, samples);
        lock.writeLock().lock();
        try {
            metrics.put(metricName, metric);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Baseline {} updated: mean={}, stdDev={}, n={}",
                metricName, metric.getMean(), metric.getStdDev(), metric.getSampleCount());
    }

    /**
     * Install a prior for a metric that has no baseline yet. An existing
     * baseline, seeded or computed, is left alone.
     *
     * @return the baseline now stored under that name
     */
    public BaselineMetric seed(String metricName, double mean, double stdDev) {
        lock.writeLock().lock();
        try {
            return metrics.computeIfAbsent(metricName, name -> BaselineMetric.builder()
                    .name(name)
                    .mean(mean)
                    .stdDev(stdDev > 0 ? stdDev : 1.0)
                    .min(mean)
                    .max(mean)
                    .sampleCount(0)
                    .lastUpdated(Instant.now())
                    .build());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Z-score of {@code value} against the named baseline; 0.0 when there is
     * no baseline.
     */
    public double zScore(String metricName, double value) {
        return get(metricName).map(m -> m.zScore(value)).orElse(0.0);
    }

    public Optional<BaselineMetric> get(String metricName) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(metrics.get(metricName));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, BaselineMetric> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(metrics);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void reset() {
        lock.writeLock().lock();
        try {
            metrics.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("All baselines cleared");
    }
}
