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
@Schema(description = "Service status and configured data source")
public class ServiceStatus {

    @Schema(example = "ok")
    private String status;

    @Schema(example = "mock")
    private DataSourceMode mode;

    @Schema(description = "Whether the Aerospike event store is in use", example = "false")
    private boolean liveConfigured;

    @Schema(description = "Number of cost events ingested so far", example = "3")
    private long eventCount;
}
