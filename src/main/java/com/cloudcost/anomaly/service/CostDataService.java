package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.engine.CostSummaryAggregator;
import com.cloudcost.anomaly.generator.MockCostSeriesCache;
import com.cloudcost.anomaly.model.CostEventDocument;
import com.cloudcost.anomaly.model.CostSummary;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.repository.CostEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Supplies daily cost series from whichever source cost.data-source selects.
 *
 * In live mode the series is folded from stored events: one record per day that has at
 * least one event, services summed per day. Days without events are simply absent.
 */
@Service
public class CostDataService {

    private static final Logger log = LoggerFactory.getLogger(CostDataService.class);

    private final CostDetectionConfig config;
    private final MockCostSeriesCache mockCache;
    private final CostEventStore eventStore;
    private final CostSummaryAggregator summaryAggregator;
    private final Clock clock;

    @Autowired
    public CostDataService(CostDetectionConfig config,
                           MockCostSeriesCache mockCache,
                           CostEventStore eventStore,
                           CostSummaryAggregator summaryAggregator) {
        this(config, mockCache, eventStore, summaryAggregator, Clock.systemUTC());
    }

    CostDataService(CostDetectionConfig config,
                    MockCostSeriesCache mockCache,
                    CostEventStore eventStore,
                    CostSummaryAggregator summaryAggregator,
                    Clock clock) {
        this.config = config;
        this.mockCache = mockCache;
        this.eventStore = eventStore;
        this.summaryAggregator = summaryAggregator;
        this.clock = clock;
    }

    public DataSourceMode getMode() {
        return config.getDataSource();
    }

    /**
     * Clamp a requested window into [1, maxDays]; null means the configured default.
     */
    public int resolveDays(Integer requested) {
        int days = requested != null ? requested : config.getDefaultDays();
        return Math.min(Math.max(days, 1), config.getMaxDays());
    }

    public List<DailyCostRecord> getDailyCosts(int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive, got " + days);
        }
        if (config.getDataSource() == DataSourceMode.MOCK) {
            return mockCache.get(days);
        }
        return aggregateStoredEvents(days);
    }

    public CostSummary getSummary(int days) {
        return summaryAggregator.summarize(getDailyCosts(days));
    }

    private List<DailyCostRecord> aggregateStoredEvents(int days) {
        LocalDate to = LocalDate.now(clock);
        LocalDate from = to.minusDays(days - 1L);
        List<CostEventDocument> events = eventStore.findBetween(from, to);

        Map<LocalDate, Map<String, Double>> byDay = new TreeMap<>();
        for (CostEventDocument event : events) {
            byDay.computeIfAbsent(event.getDate(), d -> new LinkedHashMap<>())
                    .merge(event.getService(), event.getCostUsd(), Double::sum);
        }

        List<DailyCostRecord> series = new ArrayList<>(byDay.size());
        byDay.forEach((date, services) -> series.add(DailyCostRecord.fromServiceCosts(date, services)));

        log.debug("Aggregated {} cost events into {} days between {} and {}", events.size(), series.size(), from, to);
        return series;
    }
}
