package com.propertyintel.crimeintel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "crime-intel")
@Data
public class CrimeIntelProperties {

    private Anomaly anomaly = new Anomaly();
    private Linkage linkage = new Linkage();
    private History history = new History();
    private Executor executor = new Executor();
    private Graph graph = new Graph();
    private Search search = new Search();
    private Output output = new Output();

    @Data
    public static class Anomaly {
        /** Absolute Z-score above which a count is anomalous */
        private double deviationThreshold = 2.5;
        private double highDeviationThreshold = 3.5;

        // ── Vehicle behaviour ───────────────────────────────────────────────
        private double vehicleSpeedThresholdKmh = 200;
        private double vehicleSeverityScaleKmh = 300;

        // ── Gunfire density ─────────────────────────────────────────────────
        /** Cold-start prior for events per 0.01° grid cell */
        private double gunfireBaselineMean = 2.0;
        private double gunfireBaselineStdDev = 1.5;

        // ── Offender clustering ─────────────────────────────────────────────
        private double clusterEpsilonMeters = 500;
        private int minClusterPoints = 3;
        private int offenderClusterMinSize = 5;

        // ── Timeline deviation ──────────────────────────────────────────────
        private double hourlyBaselineStdDev = 4.0;

        /** Expected event count for each hour of the day, 00:00 first */
        private List<Integer> expectedHourlyCounts = new ArrayList<>(List.of(
                3, 2, 2, 2, 2, 3,
                5, 7, 10, 12, 12, 12,
                12, 12, 12, 13, 14, 15,
                14, 13, 12, 10, 8, 5));

        // ── Crime signature shift ───────────────────────────────────────────
        private Map<String, Double> expectedCrimeShares = defaultCrimeShares();
        private double defaultCrimeShare = 0.05;
        private double signatureUpperRatio = 2.0;
        private double signatureLowerRatio = 0.3;

        // ── Repeat caller ───────────────────────────────────────────────────
        private int repeatCallerMinCalls = 5;
        private double repeatCallerRateThreshold = 2.0;

        private static Map<String, Double> defaultCrimeShares() {
            Map<String, Double> shares = new LinkedHashMap<>();
            shares.put("theft", 0.25);
            shares.put("assault", 0.15);
            shares.put("burglary", 0.12);
            shares.put("vandalism", 0.10);
            shares.put("drug", 0.08);
            shares.put("robbery", 0.05);
            shares.put("shooting", 0.03);
            shares.put("homicide", 0.01);
            return shares;
        }
    }

    @Data
    public static class Linkage {
        private double temporalWindowHours = 72;
        private double geographicRadiusKm = 2.0;
        private double minConfidence = 0.3;

        /** Upper bound for a single graph or search call */
        private Duration collaboratorTimeout = Duration.ofSeconds(5);

        /** Overall time limit for one link() call when the caller passes none */
        private Duration linkDeadline = Duration.ofSeconds(30);

        private String searchIndex = "incidents";
        private int narrativeResultSize = 10;
        private int moResultSize = 10;
        private int entityOverlapLimit = 20;
        private int moLookbackDays = 30;
    }

    @Data
    public static class History {
        private Duration retention = Duration.ofDays(30);
        private int maxEventsPerType = 50_000;
        private String evictionCron = "0 15 * * * ?";
    }

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 500;
    }

    @Data
    public static class Graph {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:7474";
        private String database = "neo4j";
        private String username = "neo4j";
        private String password = "";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Search {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:9200";
        private String username;
        private String password;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Output {
        private OutputMode mode = OutputMode.CLICKHOUSE;
        private Csv csv = new Csv();

        @Data
        public static class Csv {
            private String outputDir = "/data/output";
            private boolean includeHeader = true;
        }

        public enum OutputMode {
            CLICKHOUSE, CSV, BOTH
        }
    }
}
