package com.cloudcost.anomaly.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
@Schema(description = "A day whose total cost deviates from the series mean by more than the threshold")
public class AnomalyFinding {

    @Schema(description = "Flagged day", example = "2024-01-05")
    LocalDate date;

    @Schema(description = "Total cost that triggered the flag", example = "2500.00")
    double cost;

    @Schema(description = "Signed number of standard deviations from the series mean", example = "2.23")
    @JsonProperty("zScore")
    double zScore;

    @Schema(description = "medium when threshold < |z| <= 3, high when |z| > 3", example = "high")
    Severity severity;

    @Schema(description = "Series mean the day was compared against", example = "1266.67")
    double expectedCost;

    @Schema(description = "cost - expectedCost", example = "1233.33")
    double deviation;

    @Schema(description = "Service with the largest cost on the flagged day", example = "compute")
    String topService;

    @Schema(description = "Human-readable explanation", example = "Unusual spike in compute costs")
    String reason;

    // Lombok would name the accessor getZScore, which Jackson maps to "zscore".
    @JsonProperty("zScore")
    public double getZScore() {
        return zScore;
    }
}
