package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;

import java.util.List;

/**
 * One self-contained way of finding anomalies in an event batch.
 * Implementations are stateless apart from the shared baseline store and
 * emit anomalies in the order they scan the batch.
 */
public interface DetectionStrategy {

    /**
     * The anomaly category this strategy produces.
     */
    AnomalyType getType();

    /**
     * Scan a batch and report anything anomalous.
     *
     * @param events the whole batch; implementations pick out what they need
     * @return anomalies found, possibly empty, never null
     */
    List<AnomalyRecord> detect(List<EventRecord> events);

    /**
     * Install cold-start priors this strategy scores against. Existing
     * baselines are left as they are.
     */
    default void seedPriors() {
    }
}
