package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Outcome of a cost event ingestion")
public class IngestResult {

    @Schema(description = "Whether the event was stored", example = "true")
    private boolean ok;

    @Schema(description = "Stored event id", example = "evt_2024-01-05T13:45:00Z_compute_rg-web")
    private String id;

    @Schema(description = "Data source mode the event was stored under", example = "mock")
    private DataSourceMode mode;
}
