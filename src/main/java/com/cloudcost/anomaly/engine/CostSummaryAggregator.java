package com.cloudcost.anomaly.engine;

import com.cloudcost.anomaly.model.CostSummary;
import com.cloudcost.anomaly.model.DailyCostRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a daily series into total spend, average daily spend and per-service totals.
 * Amounts are rounded to cents only on the way out.
 */
@Component
public class CostSummaryAggregator {

    public CostSummary summarize(List<DailyCostRecord> series) {
        if (series == null) {
            throw new IllegalArgumentException("Cost series must not be null");
        }

        double total = 0.0;
        Map<String, Double> serviceTotals = new LinkedHashMap<>();
        for (DailyCostRecord day : series) {
            total += day.getTotalCost();
            if (day.getServices() == null) continue;
            day.getServices().forEach((service, cost) -> serviceTotals.merge(service, cost, Double::sum));
        }

        double average = series.isEmpty() ? 0.0 : total / series.size();

        Map<String, Double> rounded = new LinkedHashMap<>();
        serviceTotals.forEach((service, cost) -> rounded.put(service, DailyCostRecord.roundCents(cost)));

        return CostSummary.builder()
                .totalCost(DailyCostRecord.roundCents(total))
                .dailyAverage(DailyCostRecord.roundCents(average))
                .days(series.size())
                .services(rounded)
                .build();
    }
}
