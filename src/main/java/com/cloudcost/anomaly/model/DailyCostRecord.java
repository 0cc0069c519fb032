package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Schema(description = "Total cloud spend for one calendar day, broken down by service category")
public class DailyCostRecord {

    @Schema(description = "Calendar day", example = "2024-01-05")
    LocalDate date;

    @Schema(description = "Sum of all service costs for the day in USD", example = "1362.48")
    double totalCost;

    @Schema(description = "Cost per service category in USD", example = "{\"compute\": 612.10, \"storage\": 298.33}")
    Map<String, Double> services;

    @Builder
    @Jacksonized
    private DailyCostRecord(LocalDate date, double totalCost, Map<String, Double> services) {
        this.date = date;
        this.totalCost = totalCost;
        this.services = services == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    /**
     * Builds a record from raw per-service costs. Each service cost is rounded to cents
     * and the total is the rounded sum of the rounded services, so the breakdown always
     * adds up to totalCost.
     */
    public static DailyCostRecord fromServiceCosts(LocalDate date, Map<String, Double> rawServiceCosts) {
        Map<String, Double> rounded = new LinkedHashMap<>();
        double total = 0.0;
        for (Map.Entry<String, Double> entry : rawServiceCosts.entrySet()) {
            double cost = roundCents(entry.getValue());
            rounded.put(entry.getKey(), cost);
            total += cost;
        }
        return DailyCostRecord.builder()
                .date(date)
                .totalCost(roundCents(total))
                .services(rounded)
                .build();
    }

    public static double roundCents(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
