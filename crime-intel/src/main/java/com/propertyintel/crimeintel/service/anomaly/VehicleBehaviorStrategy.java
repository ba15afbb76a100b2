package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.geo.GeoMath;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.GeoLocation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Flags plates whose consecutive LPR sightings imply an impossible speed,
 * usually a cloned or misread plate.
 */
@Component
@Order(1)
@Slf4j
public class VehicleBehaviorStrategy implements DetectionStrategy {

    private static final double CONFIDENCE = 0.85;

    private final CrimeIntelProperties.Anomaly config;

    public VehicleBehaviorStrategy(CrimeIntelProperties properties) {
        this.config = properties.getAnomaly();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.VEHICLE_BEHAVIOR;
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        Map<String, List<EventRecord>> sightingsByPlate = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (isVehicleRead(event) && event.getPlate() != null && event.hasTimestamp()) {
                sightingsByPlate.computeIfAbsent(event.getPlate(), k -> new ArrayList<>()).add(event);
            }
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<EventRecord>> entry : sightingsByPlate.entrySet()) {
            List<EventRecord> sightings = entry.getValue();
            if (sightings.size() < 2) continue;

            sightings.sort(Comparator.comparing(e -> e.getTimestamp().toInstant()));
            for (int i = 1; i < sightings.size(); i++) {
                AnomalyRecord anomaly = checkLeg(entry.getKey(), sightings.get(i - 1), sightings.get(i));
                if (anomaly != null) anomalies.add(anomaly);
            }
        }
        return anomalies;
    }

    private AnomalyRecord checkLeg(String plate, EventRecord prev, EventRecord curr) {
        if (!prev.hasCoordinates() || !curr.hasCoordinates()) return null;

        double distanceKm = GeoMath.haversineKm(
                prev.getLatitude(), prev.getLongitude(), curr.getLatitude(), curr.getLongitude());
        double hours = Duration.between(prev.getTimestamp(), curr.getTimestamp()).toMillis() / 3_600_000.0;
        if (hours <= 0) return null;

        double speedKmh = distanceKm / hours;
        if (speedKmh <= config.getVehicleSpeedThresholdKmh()) return null;

        log.debug("Plate {} implied {} km/h over {} km", plate, speedKmh, distanceKm);
        return AnomalyRecords.start(AnomalyType.VEHICLE_BEHAVIOR)
                .severity(AnomalyRecords.cap(speedKmh / config.getVehicleSeverityScaleKmh()))
                .description(String.format(Locale.ROOT,
                        "Vehicle %s detected traveling at impossible speed (%.0f km/h implied)", plate, speedKmh))
                .location(new GeoLocation(curr.getLatitude(), curr.getLongitude()))
                .relatedEntity(plate)
                .metrics(AnomalyRecords.metrics(
                        "implied_speed_kmh", speedKmh,
                        "distance_km", distanceKm,
                        "time_hours", hours))
                .deviation(speedKmh / 100)
                .confidence(CONFIDENCE)
                .build();
    }

    static boolean isVehicleRead(EventRecord event) {
        return "flock".equals(event.getSource()) || "lpr_read".equals(event.getEventType());
    }
}
