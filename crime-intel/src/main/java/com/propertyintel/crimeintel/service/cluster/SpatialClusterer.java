package com.propertyintel.crimeintel.service.cluster;

import com.propertyintel.crimeintel.geo.GeoMath;
import com.propertyintel.crimeintel.model.GeoPoint;
import com.propertyintel.crimeintel.model.SpatialCluster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * DBSCAN over geo-tagged points.
 *
 * A point is a core point when at least {@code minPoints} points, itself
 * included, lie within {@code epsilonMeters}. Clusters grow breadth-first
 * through core points; non-core points reached that way join as border
 * points. Points never reached from a core point are noise and do not appear
 * in the output.
 *
 * Neighbour search is a plain O(n²) scan, fine for the size of a single
 * detection window. A grid index can replace {@link #neighbours} without
 * changing the contract if batches grow.
 */
@Component
@Slf4j
public class SpatialClusterer {

    private static final int UNVISITED = 0;
    private static final int NOISE = -1;

    /** Added to the radius so single-point and coincident clusters have a finite density */
    private static final double RADIUS_EPSILON_KM = 0.001;

    public <T> List<SpatialCluster<T>> cluster(List<GeoPoint<T>> points, double epsilonMeters, int minPoints) {
        if (points == null || points.size() < minPoints) return List.of();

        double epsilonKm = epsilonMeters / 1000.0;
        int n = points.size();

        // 0 = unvisited, -1 = noise, k > 0 = member of the k-th cluster
        int[] labels = new int[n];
        List<SpatialCluster<T>> clusters = new ArrayList<>();
        int clusterLabel = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED) continue;

            List<Integer> seeds = neighbours(points, i, epsilonKm);
            if (seeds.size() + 1 < minPoints) {
                labels[i] = NOISE;
                continue;
            }

            clusterLabel++;
            List<Integer> memberIdx = expand(points, i, seeds, labels, clusterLabel, epsilonKm, minPoints);
            clusters.add(summarise(points, memberIdx));
        }

        log.debug("Clustered {} points into {} clusters (eps={}m, minPoints={}), {} noise",
                n, clusters.size(), epsilonMeters, minPoints,
                Arrays.stream(labels).filter(l -> l == NOISE).count());
        return clusters;
    }

    private <T> List<Integer> expand(List<GeoPoint<T>> points, int core, List<Integer> seeds,
                                     int[] labels, int clusterLabel, double epsilonKm, int minPoints) {
        List<Integer> members = new ArrayList<>();
        labels[core] = clusterLabel;
        members.add(core);

        Deque<Integer> frontier = new ArrayDeque<>(seeds);
        while (!frontier.isEmpty()) {
            int idx = frontier.pollFirst();

            if (labels[idx] == NOISE) {
                // Previously rejected as a seed, reachable now: border point
                labels[idx] = clusterLabel;
                members.add(idx);
                continue;
            }
            if (labels[idx] != UNVISITED) continue;

            labels[idx] = clusterLabel;
            members.add(idx);

            List<Integer> next = neighbours(points, idx, epsilonKm);
            if (next.size() + 1 >= minPoints) {
                for (int candidate : next) {
                    if (labels[candidate] == UNVISITED || labels[candidate] == NOISE) {
                        frontier.addLast(candidate);
                    }
                }
            }
        }
        return members;
    }

    /** Indices of all other points within epsilon of {@code idx}. */
    private <T> List<Integer> neighbours(List<GeoPoint<T>> points, int idx, double epsilonKm) {
        GeoPoint<T> p = points.get(idx);
        List<Integer> result = new ArrayList<>();
        for (int j = 0; j < points.size(); j++) {
            if (j == idx) continue;
            GeoPoint<T> q = points.get(j);
            if (GeoMath.haversineKm(p.latitude(), p.longitude(), q.latitude(), q.longitude()) <= epsilonKm) {
                result.add(j);
            }
        }
        return result;
    }

    private <T> SpatialCluster<T> summarise(List<GeoPoint<T>> points, List<Integer> memberIdx) {
        double sumLat = 0;
        double sumLon = 0;
        for (int idx : memberIdx) {
            sumLat += points.get(idx).latitude();
            sumLon += points.get(idx).longitude();
        }
        double centerLat = sumLat / memberIdx.size();
        double centerLon = sumLon / memberIdx.size();

        double radiusKm = 0;
        List<T> members = new ArrayList<>(memberIdx.size());
        for (int idx : memberIdx) {
            GeoPoint<T> p = points.get(idx);
            radiusKm = Math.max(radiusKm, GeoMath.haversineKm(centerLat, centerLon, p.latitude(), p.longitude()));
            members.add(p.payload());
        }

        double padded = radiusKm + RADIUS_EPSILON_KM;
        return SpatialCluster.<T>builder()
                .clusterId(UUID.randomUUID().toString())
                .centerLat(centerLat)
                .centerLon(centerLon)
                .radiusMeters(radiusKm * 1000)
                .pointCount(memberIdx.size())
                .density(memberIdx.size() / (Math.PI * padded * padded))
                .members(members)
                .build();
    }
}
