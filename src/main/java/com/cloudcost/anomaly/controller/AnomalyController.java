package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.model.AnomalyReport;
import com.cloudcost.anomaly.service.AnomalyDetectionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/anomalies")
@Tag(name = "Anomalies", description = "Z-score anomaly detection over daily costs")
public class AnomalyController {

    private final AnomalyDetectionService detectionService;

    public AnomalyController(AnomalyDetectionService detectionService) {
        this.detectionService = detectionService;
    }

    @Operation(summary = "Detect cost anomalies",
            description = "Scores every day in the window against the window's own mean and population " +
                    "standard deviation and returns the days with |z| above the threshold, in date order. " +
                    "Severity is high when |z| > 3, otherwise medium.")
    @GetMapping
    public ResponseEntity<AnomalyReport> getAnomalies(
            @Parameter(description = "Z-score threshold, clamped to 1.0-5.0", example = "2.0")
            @RequestParam(required = false) Double threshold,
            @Parameter(description = "Window length in days, clamped to 1-90", example = "30")
            @RequestParam(required = false) Integer days) {
        return ResponseEntity.ok(detectionService.detectAnomalies(threshold, days));
    }
}
