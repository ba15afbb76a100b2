package com.propertyintel.crimeintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Summary statistics for one named metric.
 *
 * Instances are immutable: a baseline update builds a fresh metric from the
 * full sample list and replaces the previous one.
 */
@Value
@Builder(toBuilder = true)
public class BaselineMetric {

    String name;
    double mean;

    /** Never 0 when built from samples; a flat sample set gives 1.0 */
    double stdDev;

    double min;
    double max;
    int sampleCount;
    Instant lastUpdated;

    /**
     * Recompute every statistic over the given samples (sample variance, n-1).
     */
    public static BaselineMetric fromSamples(String name, List<Double> samples) {
        int n = samples.size();
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : samples) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / n;

        double stdDev = 1.0;
        if (n > 1) {
            double squares = 0;
            for (double v : samples) {
                squares += (v - mean) * (v - mean);
            }
            double variance = squares / (n - 1);
            if (variance > 0) {
                stdDev = Math.sqrt(variance);
            }
        }

        return BaselineMetric.builder()
                .name(name)
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .sampleCount(n)
                .lastUpdated(Instant.now())
                .build();
    }

    public double zScore(double value) {
        if (stdDev == 0) return 0.0;
        return (value - mean) / stdDev;
    }
}
