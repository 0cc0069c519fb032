package com.cloudcost.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Envelope for cost data responses")
public class DataResponse<T> {

    @Schema(description = "Whether the request succeeded", example = "true")
    private boolean success;

    private T data;

    @Schema(description = "Data source the payload came from", example = "mock")
    private DataSourceMode mode;

    public static <T> DataResponse<T> of(T data, DataSourceMode mode) {
        return new DataResponse<>(true, data, mode);
    }
}
