package com.cloudcost.anomaly.config;

import com.cloudcost.anomaly.model.AnomalyFinding;
import com.cloudcost.anomaly.model.DataSourceMode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetection(DataSourceMode mode, int seriesLength, List<AnomalyFinding> findings) {
        Counter.builder("detection.count")
                .tag("mode", mode.label())
                .register(registry)
                .increment();

        DistributionSummary.builder("detection.series_length")
                .tag("mode", mode.label())
                .register(registry)
                .record(seriesLength);

        for (AnomalyFinding finding : findings) {
            Counter.builder("detection.findings")
                    .tag("severity", finding.getSeverity().label())
                    .register(registry)
                    .increment();
        }
    }

    public void recordEventIngested(String service, DataSourceMode mode) {
        Counter.builder("event.ingested.count")
                .tag("service", service)
                .tag("mode", mode.label())
                .register(registry)
                .increment();
    }
}
