package com.propertyintel.crimeintel.geo;

import com.propertyintel.crimeintel.model.GeoLocation;

/**
 * Great-circle distance, bearing and projection on a spherical Earth.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoMath() {}

    /**
     * Distance between two points using the haversine formula.
     *
     * @return distance in kilometres
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    public static double haversineKm(GeoLocation from, GeoLocation to) {
        return haversineKm(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Initial bearing from the first point towards the second.
     *
     * @return degrees clockwise from true north, in [0, 360)
     */
    public static double bearingDeg(double lat1, double lon1, double lat2, double lon2) {
        double phi1 = Math.toRadians(lat1);
        double phi2 = Math.toRadians(lat2);
        double dLon = Math.toRadians(lon2 - lon1);

        double y = Math.sin(dLon) * Math.cos(phi2);
        double x = Math.cos(phi1) * Math.sin(phi2)
                - Math.sin(phi1) * Math.cos(phi2) * Math.cos(dLon);

        return (Math.toDegrees(Math.atan2(y, x)) + 360.0) % 360.0;
    }

    /**
     * Destination reached by travelling {@code distanceKm} along a great circle
     * starting at the given bearing.
     */
    public static GeoLocation project(double lat, double lon, double bearingDeg, double distanceKm) {
        double delta = distanceKm / EARTH_RADIUS_KM;
        double theta = Math.toRadians(bearingDeg);
        double phi1 = Math.toRadians(lat);
        double lambda1 = Math.toRadians(lon);

        double phi2 = Math.asin(Math.sin(phi1) * Math.cos(delta)
                + Math.cos(phi1) * Math.sin(delta) * Math.cos(theta));
        double lambda2 = lambda1 + Math.atan2(
                Math.sin(theta) * Math.sin(delta) * Math.cos(phi1),
                Math.cos(delta) - Math.sin(phi1) * Math.sin(phi2));

        double lon2 = (Math.toDegrees(lambda2) + 540.0) % 360.0 - 180.0;
        return new GeoLocation(Math.toDegrees(phi2), lon2);
    }
}
