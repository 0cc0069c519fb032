package com.cloudcost.anomaly.engine;

import com.cloudcost.anomaly.model.AnomalyFinding;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Flags days whose total cost deviates from the series mean by more than
 * {@code threshold} population standard deviations.
 *
 * The whole supplied series is both the baseline and the candidate pool: mean and
 * standard deviation are computed over every record, including the ones being scored.
 * A single large spike therefore inflates its own baseline, which can mask it on very
 * short series.
 *
 * Both directions qualify: a drop of the same magnitude as a spike is flagged the same way.
 * Findings keep the input order. The detector holds no state and is safe to share.
 */
@Component
public class ZScoreAnomalyDetector {

    public static final double DEFAULT_THRESHOLD = 2.0;

    private static final String UNKNOWN_SERVICE = "unknown";

    public List<AnomalyFinding> detect(List<DailyCostRecord> series) {
        return detect(series, DEFAULT_THRESHOLD);
    }

    public List<AnomalyFinding> detect(List<DailyCostRecord> series, double threshold) {
        if (series == null) {
            throw new IllegalArgumentException("Cost series must not be null");
        }
        if (Double.isNaN(threshold) || threshold < 0) {
            throw new IllegalArgumentException("Threshold must be >= 0, got " + threshold);
        }
        if (series.isEmpty()) {
            return Collections.emptyList();
        }

        double[] costs = new double[series.size()];
        for (int i = 0; i < costs.length; i++) {
            costs[i] = series.get(i).getTotalCost();
        }

        double mean = ZScoreStatistics.mean(costs);
        double stdDev = ZScoreStatistics.populationStdDev(costs, mean);

        // Zero variance: nothing deviates, so there is nothing to flag.
        if (stdDev == 0.0) {
            return Collections.emptyList();
        }

        List<AnomalyFinding> findings = new ArrayList<>();
        for (int i = 0; i < costs.length; i++) {
            double zScore = ZScoreStatistics.zScore(costs[i], mean, stdDev);
            if (Math.abs(zScore) > threshold) {
                findings.add(toFinding(series.get(i), zScore, mean));
            }
        }
        return findings;
    }

    private AnomalyFinding toFinding(DailyCostRecord record, double zScore, double mean) {
        String topService = topService(record.getServices());
        String direction = zScore >= 0 ? "spike" : "drop";

        return AnomalyFinding.builder()
                .date(record.getDate())
                .cost(record.getTotalCost())
                .zScore(zScore)
                .severity(Severity.fromZScore(zScore))
                .expectedCost(DailyCostRecord.roundCents(mean))
                .deviation(DailyCostRecord.roundCents(record.getTotalCost() - mean))
                .topService(topService)
                .reason(String.format("Unusual %s in %s costs", direction, topService))
                .build();
    }

    private String topService(Map<String, Double> services) {
        if (services == null || services.isEmpty()) {
            return UNKNOWN_SERVICE;
        }
        String top = null;
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : services.entrySet()) {
            if (entry.getValue() != null && entry.getValue() > max) {
                max = entry.getValue();
                top = entry.getKey();
            }
        }
        return top != null ? top : UNKNOWN_SERVICE;
    }
}
