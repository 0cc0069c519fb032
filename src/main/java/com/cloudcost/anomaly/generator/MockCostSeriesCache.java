package com.cloudcost.anomaly.generator;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.model.DailyCostRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Random;

/**
 * Holds the most recently generated mock series so that repeated reads of the same window
 * (costs, summary, anomalies) see the same numbers. A request for a different window
 * length regenerates.
 */
@Component
public class MockCostSeriesCache {

    private static final Logger log = LoggerFactory.getLogger(MockCostSeriesCache.class);

    private final CostSeriesGenerator generator;

    private List<DailyCostRecord> cached;

    @Autowired
    public MockCostSeriesCache(CostDetectionConfig config) {
        this(buildGenerator(config.getGenerator()));
    }

    MockCostSeriesCache(CostSeriesGenerator generator) {
        this.generator = generator;
    }

    public synchronized List<DailyCostRecord> get(int days) {
        if (cached == null || cached.size() != days) {
            cached = List.copyOf(generator.generate(days));
            log.debug("Generated mock cost series: days={}, from={}, to={}",
                    days, cached.get(0).getDate(), cached.get(cached.size() - 1).getDate());
        }
        return cached;
    }

    public synchronized void clear() {
        cached = null;
    }

    private static CostSeriesGenerator buildGenerator(CostDetectionConfig.Generator settings) {
        Random random;
        if (settings.getSeed() != null) {
            log.info("Mock cost generator using fixed seed {}", settings.getSeed());
            random = new Random(settings.getSeed());
        } else {
            random = new Random();
        }
        return new CostSeriesGenerator(settings, random, Clock.systemUTC());
    }
}
