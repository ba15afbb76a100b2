package com.propertyintel.crimeintel.client;

import java.util.Map;

public record SearchHit(String id, double score, Map<String, Object> source) {

    public String sourceText(String field) {
        Object value = source == null ? null : source.get(field);
        return value == null ? null : value.toString();
    }
}
