package com.cloudcost.anomaly.config;

import com.cloudcost.anomaly.model.DataSourceMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "cost")
public class CostDetectionConfig {

    // MOCK serves generated series; LIVE aggregates ingested events from Aerospike.
    private DataSourceMode dataSource = DataSourceMode.MOCK;

    // Z-score threshold used when a request doesn't supply one.
    private double defaultThreshold = 2.0;

    // Request thresholds are clamped into [minThreshold, maxThreshold].
    private double minThreshold = 1.0;
    private double maxThreshold = 5.0;

    // Request windows are clamped into [1, maxDays].
    private int defaultDays = 30;
    private int maxDays = 90;

    private Generator generator = new Generator();

    private Nightly nightly = new Nightly();

    @Data
    public static class Generator {
        // Mean daily cost per service category, in USD.
        private Map<String, Double> baselineCosts = defaultBaselines();

        // Each service varies uniformly within +/- this percentage of its baseline.
        private double variationPct = 15.0;

        // Chance that a given day gets one service spiked.
        private double spikeProbability = 0.1;
        private double spikeFactorMin = 3.0;
        private double spikeFactorMax = 6.0;

        // Fixed seed for reproducible mock data. Null means a fresh random seed per start.
        private Long seed;

        private static Map<String, Double> defaultBaselines() {
            Map<String, Double> baselines = new LinkedHashMap<>();
            baselines.put("compute", 600.0);
            baselines.put("storage", 300.0);
            baselines.put("network", 200.0);
            baselines.put("database", 250.0);
            return baselines;
        }
    }

    @Data
    public static class Nightly {
        private boolean enabled = true;
        private String cron = "0 0 2 * * *";
        private int windowDays = 30;
    }
}
