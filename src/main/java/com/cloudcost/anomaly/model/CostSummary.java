package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

@Value
@Builder
@Jacksonized
@Schema(description = "Aggregate spend over a window of daily cost records")
public class CostSummary {

    @Schema(description = "Total spend across the window", example = "40874.22")
    double totalCost;

    @Schema(description = "Average spend per day", example = "1362.47")
    double dailyAverage;

    @Schema(description = "Number of days in the window", example = "30")
    int days;

    @Schema(description = "Total spend per service category across the window")
    Map<String, Double> services;
}
