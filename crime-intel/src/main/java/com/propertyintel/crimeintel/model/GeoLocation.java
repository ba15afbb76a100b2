package com.propertyintel.crimeintel.model;

/**
 * A WGS84 latitude/longitude pair in decimal degrees.
 */
public record GeoLocation(double latitude, double longitude) {}
