package com.cloudcost.anomaly.engine;

import com.cloudcost.anomaly.model.CostSummary;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static com.cloudcost.anomaly.testutil.TestDataFactory.START;
import static org.assertj.core.api.Assertions.assertThat;

class CostSummaryAggregatorTest {

    private final CostSummaryAggregator aggregator = new CostSummaryAggregator();

    @Test
    void summarize_totalsAverageAndPerService() {
        List<DailyCostRecord> series = List.of(
                TestDataFactory.createRecord(START, TestDataFactory.services("compute", 600.10, "storage", 300.20)),
                TestDataFactory.createRecord(START.plusDays(1), TestDataFactory.services("compute", 599.90, "storage", 299.80)),
                TestDataFactory.createRecord(START.plusDays(2), TestDataFactory.services("compute", 700.00, "network", 50.00)));

        CostSummary summary = aggregator.summarize(series);

        assertThat(summary.getDays()).isEqualTo(3);
        assertThat(summary.getTotalCost()).isEqualTo(2550.0);
        assertThat(summary.getDailyAverage()).isEqualTo(850.0);
        assertThat(summary.getServices())
                .containsEntry("compute", 1900.0)
                .containsEntry("storage", 600.0)
                .containsEntry("network", 50.0);
    }

    @Test
    void summarize_roundsToCents() {
        List<DailyCostRecord> series = TestDataFactory.createSeries(100.0, 100.0, 100.01);

        CostSummary summary = aggregator.summarize(series);

        assertThat(summary.getDailyAverage()).isEqualTo(100.0);
        assertThat(summary.getTotalCost()).isEqualTo(300.01);
    }

    @Test
    void summarize_emptySeries_returnsZeros() {
        CostSummary summary = aggregator.summarize(Collections.emptyList());

        assertThat(summary.getDays()).isZero();
        assertThat(summary.getTotalCost()).isEqualTo(0.0);
        assertThat(summary.getDailyAverage()).isEqualTo(0.0);
        assertThat(summary.getServices()).isEmpty();
    }
}
