package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.model.AnomalyFinding;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Nightly sweep over ingested events. Only meaningful in live mode; findings are logged,
 * not stored.
 */
@Service
public class NightlyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(NightlyDetectionService.class);

    private final CostDataService costDataService;
    private final AnomalyDetectionService detectionService;
    private final CostDetectionConfig config;

    public NightlyDetectionService(CostDataService costDataService,
                                   AnomalyDetectionService detectionService,
                                   CostDetectionConfig config) {
        this.costDataService = costDataService;
        this.detectionService = detectionService;
        this.config = config;
    }

    @Scheduled(cron = "${cost.nightly.cron:0 0 2 * * *}", zone = "UTC")
    public void runNightlyDetection() {
        if (!config.getNightly().isEnabled() || config.getDataSource() != DataSourceMode.LIVE) {
            return;
        }

        int window = costDataService.resolveDays(config.getNightly().getWindowDays());
        List<DailyCostRecord> series = costDataService.getDailyCosts(window);
        List<AnomalyFinding> findings = detectionService.detect(series, config.getDefaultThreshold());

        for (AnomalyFinding finding : findings) {
            if (finding.getSeverity() == Severity.HIGH) {
                log.warn("NIGHTLY ANOMALY [high]: {} cost={} z={} expected={} ({})",
                        finding.getDate(), finding.getCost(),
                        String.format("%.2f", finding.getZScore()), finding.getExpectedCost(), finding.getReason());
            } else {
                log.info("NIGHTLY ANOMALY [medium]: {} cost={} z={} expected={} ({})",
                        finding.getDate(), finding.getCost(),
                        String.format("%.2f", finding.getZScore()), finding.getExpectedCost(), finding.getReason());
            }
        }

        log.info("Nightly detection complete: window={} days, series={} days, findings={}",
                window, series.size(), findings.size());
    }
}
