package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A single billed usage event submitted for ingestion")
public class CostEvent {

    @Builder.Default
    @Schema(description = "Cloud subscription / account identifier", example = "demo")
    private String subscriptionId = "demo";

    @NotBlank
    @Schema(description = "ISO-8601 timestamp of the usage", example = "2024-01-05T13:45:00Z")
    private String ts;

    @NotBlank
    @Schema(description = "Service category", example = "compute")
    private String service;

    @NotBlank
    @Schema(description = "Resource group the cost belongs to", example = "rg-web")
    private String resourceGroup;

    @Builder.Default
    @Schema(description = "Cloud region", example = "eastus")
    private String region = "unknown";

    @NotNull
    @PositiveOrZero
    @Schema(description = "Cost in USD", example = "12.50")
    private Double costUsd;

    @PositiveOrZero
    @Schema(description = "Optional usage quantity", example = "3.0")
    private Double usageQty;

    @Builder.Default
    @Schema(description = "Free-form resource tags")
    private Map<String, String> tags = new HashMap<>();
}
