package com.cloudcost.anomaly.generator;

import com.cloudcost.anomaly.config.CostDetectionConfig;
import com.cloudcost.anomaly.model.DailyCostRecord;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates synthetic daily cost series for development and demos.
 *
 * Each service cost is drawn uniformly within +/- variationPct of its baseline. With
 * probability spikeProbability a day gets one randomly chosen service multiplied by a
 * factor in [spikeFactorMin, spikeFactorMax], so the detector always has something to find.
 *
 * Output is fully determined by the injected {@link Random}: two generators built with
 * the same seed, settings and reference date produce identical series.
 */
public class CostSeriesGenerator {

    private final CostDetectionConfig.Generator settings;
    private final Random random;
    private final Clock clock;

    public CostSeriesGenerator(CostDetectionConfig.Generator settings, Random random, Clock clock) {
        if (settings.getBaselineCosts() == null || settings.getBaselineCosts().isEmpty()) {
            throw new IllegalArgumentException("At least one service baseline is required");
        }
        if (settings.getBaselineCosts().values().stream().anyMatch(v -> v == null || !(v >= 0.0))) {
            throw new IllegalArgumentException("Service baselines must be non-negative");
        }
        if (!(settings.getSpikeProbability() >= 0.0 && settings.getSpikeProbability() <= 1.0)) {
            throw new IllegalArgumentException("spikeProbability must be within [0, 1], got " + settings.getSpikeProbability());
        }
        if (!(settings.getSpikeFactorMin() >= 0.0)) {
            throw new IllegalArgumentException("spikeFactorMin must be >= 0, got " + settings.getSpikeFactorMin());
        }
        if (settings.getSpikeFactorMax() < settings.getSpikeFactorMin()) {
            throw new IllegalArgumentException("spikeFactorMax must be >= spikeFactorMin");
        }
        this.settings = settings;
        this.random = random;
        this.clock = clock;
    }

    public static CostSeriesGenerator seeded(CostDetectionConfig.Generator settings, long seed, Clock clock) {
        return new CostSeriesGenerator(settings, new Random(seed), clock);
    }

    /**
     * nDays consecutive days ending today (per the generator's clock), ascending.
     */
    public List<DailyCostRecord> generate(int nDays) {
        return generate(nDays, LocalDate.now(clock));
    }

    /**
     * nDays consecutive days ending at {@code endDate} inclusive, ascending.
     */
    public List<DailyCostRecord> generate(int nDays, LocalDate endDate) {
        if (nDays <= 0) {
            throw new IllegalArgumentException("nDays must be positive, got " + nDays);
        }

        List<DailyCostRecord> series = new ArrayList<>(nDays);
        LocalDate startDate = endDate.minusDays(nDays - 1L);
        for (int i = 0; i < nDays; i++) {
            series.add(generateDay(startDate.plusDays(i)));
        }
        return series;
    }

    private DailyCostRecord generateDay(LocalDate date) {
        double variation = settings.getVariationPct() / 100.0;

        Map<String, Double> services = new LinkedHashMap<>();
        for (Map.Entry<String, Double> baseline : settings.getBaselineCosts().entrySet()) {
            double factor = 1.0 + uniform(-variation, variation);
            services.put(baseline.getKey(), Math.max(0.0, baseline.getValue() * factor));
        }

        if (random.nextDouble() < settings.getSpikeProbability()) {
            List<String> names = new ArrayList<>(services.keySet());
            String spiked = names.get(random.nextInt(names.size()));
            double spikeFactor = uniform(settings.getSpikeFactorMin(), settings.getSpikeFactorMax());
            services.put(spiked, services.get(spiked) * spikeFactor);
        }

        // Rounding happens once, here, so totals match the rounded breakdown.
        return DailyCostRecord.fromServiceCosts(date, services);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
