package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.config.MetricsConfig;
import com.cloudcost.anomaly.engine.ZScoreAnomalyDetector;
import com.cloudcost.anomaly.model.AnomalyFinding;
import com.cloudcost.anomaly.model.AnomalyReport;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.Severity;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs the Z-score detector over the configured data source.
 *
 * Flow:
 * 1. Clamp the requested threshold and window
 * 2. Load the daily series (generated or aggregated from events)
 * 3. Detect anomalies over the whole window
 * 4. Record metrics and return the findings in date order
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    private final CostDataService costDataService;
    private final ZScoreAnomalyDetector detector;
    private final CostDetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyDetectionService(CostDataService costDataService,
                                   ZScoreAnomalyDetector detector,
                                   CostDetectionConfig config,
                                   MetricsConfig metricsConfig) {
        this.costDataService = costDataService;
        this.detector = detector;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "anomaly.detect", contextualName = "detect-cost-anomalies")
    public AnomalyReport detectAnomalies(Double threshold, Integer days) {
        double effectiveThreshold = resolveThreshold(threshold);
        int window = costDataService.resolveDays(days);

        List<DailyCostRecord> series = costDataService.getDailyCosts(window);
        List<AnomalyFinding> findings = detect(series, effectiveThreshold);

        return AnomalyReport.builder()
                .success(true)
                .data(findings)
                .count(findings.size())
                .threshold(effectiveThreshold)
                .mode(costDataService.getMode())
                .build();
    }

    /**
     * Detect over an already-loaded series and record metrics. Used by the nightly job too.
     */
    public List<AnomalyFinding> detect(List<DailyCostRecord> series, double threshold) {
        List<AnomalyFinding> findings = detector.detect(series, threshold);
        metricsConfig.recordDetection(costDataService.getMode(), series.size(), findings);

        long high = findings.stream().filter(f -> f.getSeverity() == Severity.HIGH).count();
        log.info("Anomaly detection complete: days={}, threshold={}, findings={}, high={}",
                series.size(), threshold, findings.size(), high);
        return findings;
    }

    /**
     * Clamp a requested threshold into [minThreshold, maxThreshold]; null means the default.
     */
    public double resolveThreshold(Double requested) {
        double threshold = requested != null ? requested : config.getDefaultThreshold();
        if (Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be a number");
        }
        return Math.min(Math.max(threshold, config.getMinThreshold()), config.getMaxThreshold());
    }
}
