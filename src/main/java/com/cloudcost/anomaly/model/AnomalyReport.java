package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Anomalies detected over a window of daily costs")
public class AnomalyReport {

    @Schema(description = "Whether detection succeeded", example = "true")
    private boolean success;

    @Schema(description = "Flagged days in ascending date order")
    private List<AnomalyFinding> data;

    @Schema(description = "Number of flagged days", example = "2")
    private int count;

    @Schema(description = "Z-score threshold that was applied (after clamping)", example = "2.0")
    private double threshold;

    @Schema(description = "Data source the series came from", example = "mock")
    private DataSourceMode mode;
}
