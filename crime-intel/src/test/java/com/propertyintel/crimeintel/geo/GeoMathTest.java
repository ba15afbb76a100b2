package com.propertyintel.crimeintel.geo;

import com.propertyintel.crimeintel.model.GeoLocation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GeoMathTest {

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        assertThat(GeoMath.haversineKm(0, 0, 1, 0)).isCloseTo(111.19, within(0.01));
    }

    @Test
    void distanceIsSymmetricAndZeroForSamePoint() {
        double ab = GeoMath.haversineKm(54.597, -5.930, 53.349, -6.260);
        double ba = GeoMath.haversineKm(53.349, -6.260, 54.597, -5.930);

        assertThat(ab).isCloseTo(ba, within(1e-9));
        assertThat(GeoMath.haversineKm(54.597, -5.930, 54.597, -5.930)).isZero();
    }

    @Test
    void belfastToDublinIsAbout140Km() {
        GeoLocation belfast = new GeoLocation(54.5973, -5.9301);
        GeoLocation dublin = new GeoLocation(53.3498, -6.2603);

        assertThat(GeoMath.haversineKm(belfast, dublin)).isBetween(138.0, 142.0);
    }

    @Test
    void bearingPointsNorthAndEast() {
        assertThat(GeoMath.bearingDeg(0, 0, 1, 0)).isCloseTo(0.0, within(1e-9));
        assertThat(GeoMath.bearingDeg(0, 0, 0, 1)).isCloseTo(90.0, within(1e-9));
        assertThat(GeoMath.bearingDeg(0, 0, 0, -1)).isCloseTo(270.0, within(1e-9));
    }

    @Test
    void projectedPointLiesAtRequestedDistanceAndBearing() {
        GeoLocation target = GeoMath.project(54.6, -5.9, 45.0, 10.0);

        assertThat(GeoMath.haversineKm(54.6, -5.9, target.latitude(), target.longitude()))
                .isCloseTo(10.0, within(1e-6));
        assertThat(GeoMath.bearingDeg(54.6, -5.9, target.latitude(), target.longitude()))
                .isCloseTo(45.0, within(0.01));
    }

    @Test
    void projectionWrapsAcrossTheAntimeridian() {
        GeoLocation target = GeoMath.project(0, 179.9, 90.0, 50.0);

        assertThat(target.longitude()).isBetween(-180.0, -179.0);
    }
}
