package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.config.MetricsConfig;
import com.cloudcost.anomaly.engine.ZScoreAnomalyDetector;
import com.cloudcost.anomaly.model.AnomalyReport;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.model.Severity;
import com.cloudcost.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnomalyDetectionServiceTest {

    @Mock private CostDataService costDataService;

    private SimpleMeterRegistry registry;
    private AnomalyDetectionService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        service = new AnomalyDetectionService(costDataService, new ZScoreAnomalyDetector(),
                new CostDetectionConfig(), new MetricsConfig(registry));
    }

    @Test
    void resolveThreshold_defaultsAndClamps() {
        assertThat(service.resolveThreshold(null)).isEqualTo(2.0);
        assertThat(service.resolveThreshold(0.2)).isEqualTo(1.0);
        assertThat(service.resolveThreshold(2.5)).isEqualTo(2.5);
        assertThat(service.resolveThreshold(12.0)).isEqualTo(5.0);
    }

    @Test
    void resolveThreshold_nan_throws() {
        assertThatThrownBy(() -> service.resolveThreshold(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectAnomalies_buildsReportFromConfiguredSource() {
        List<DailyCostRecord> series = TestDataFactory.createSeriesWithSpike(30, 100.0, 14, 500.0);
        when(costDataService.resolveDays(null)).thenReturn(30);
        when(costDataService.getDailyCosts(30)).thenReturn(series);
        when(costDataService.getMode()).thenReturn(DataSourceMode.MOCK);

        AnomalyReport report = service.detectAnomalies(null, null);

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getThreshold()).isEqualTo(2.0);
        assertThat(report.getCount()).isEqualTo(1);
        assertThat(report.getMode()).isEqualTo(DataSourceMode.MOCK);
        assertThat(report.getData().get(0).getDate()).isEqualTo(series.get(14).getDate());
        assertThat(report.getData().get(0).getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    void detectAnomalies_appliesClampedThreshold() {
        // z of the spike is 2.23; a requested threshold of 0.1 is raised to 1.0, still flagging only the spike
        List<DailyCostRecord> series = TestDataFactory.createSeries(1000, 1050, 980, 1070, 2500, 1000);
        when(costDataService.resolveDays(6)).thenReturn(6);
        when(costDataService.getDailyCosts(6)).thenReturn(series);
        when(costDataService.getMode()).thenReturn(DataSourceMode.MOCK);

        AnomalyReport report = service.detectAnomalies(0.1, 6);

        assertThat(report.getThreshold()).isEqualTo(1.0);
        assertThat(report.getCount()).isEqualTo(1);
    }

    @Test
    void detect_recordsMetricsPerSeverity() {
        when(costDataService.getMode()).thenReturn(DataSourceMode.LIVE);

        service.detect(TestDataFactory.createSeriesWithSpike(30, 100.0, 3, 500.0), 2.0);

        assertThat(registry.get("detection.count").tag("mode", "live").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("detection.findings").tag("severity", "high").counter().count()).isEqualTo(1.0);
    }

    @Test
    void detect_emptySeries_returnsNoFindings() {
        when(costDataService.getMode()).thenReturn(DataSourceMode.LIVE);

        assertThat(service.detect(List.of(), 2.0)).isEmpty();
    }
}
