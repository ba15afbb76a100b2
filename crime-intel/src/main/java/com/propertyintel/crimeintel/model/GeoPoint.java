package com.propertyintel.crimeintel.model;

/**
 * Input point for spatial clustering: a coordinate plus whatever the caller
 * wants back in the resulting cluster.
 */
public record GeoPoint<T>(double latitude, double longitude, T payload) {}
