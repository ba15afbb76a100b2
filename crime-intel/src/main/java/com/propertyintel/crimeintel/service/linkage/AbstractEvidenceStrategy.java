package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.LinkageEdge;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Weighs a strength factor into an edge and drops edges under the
 * configured confidence threshold or pointing back at their source.
 */
public abstract class AbstractEvidenceStrategy implements EvidenceStrategy {

    protected final CrimeIntelProperties.Linkage linkage;

    protected AbstractEvidenceStrategy(CrimeIntelProperties properties) {
        this.linkage = properties.getLinkage();
    }

    protected Optional<LinkageEdge> edge(String sourceId, String targetId, double strength,
                                         String explanation, Map<String, Object> metadata) {
        if (targetId == null || targetId.equals(sourceId)) return Optional.empty();

        double confidence = getType().weigh(strength);
        if (confidence < linkage.getMinConfidence()) return Optional.empty();

        return Optional.of(LinkageEdge.builder()
                .sourceIncidentId(sourceId)
                .targetIncidentId(targetId)
                .linkageType(getType())
                .confidence(confidence)
                .explanation(explanation)
                .metadata(metadata)
                .build());
    }

    /** Insertion-ordered, unmodifiable map from alternating keys and values; null values are skipped. */
    protected static Map<String, Object> metadata(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                map.put(keyValues[i].toString(), keyValues[i + 1]);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    protected static double number(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value == null) return 0.0;
        try {
            return Double.parseDouble(value.toString());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    protected static String text(Object value) {
        return value == null ? null : value.toString();
    }

    protected static boolean sameText(String a, String b) {
        return a != null && b != null && !a.isBlank() && a.trim().equalsIgnoreCase(b.trim());
    }
}
