package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.model.CostSummary;
import com.cloudcost.anomaly.model.DailyCostRecord;
import com.cloudcost.anomaly.model.DataResponse;
import com.cloudcost.anomaly.service.CostDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Costs", description = "Daily cost series and aggregate spend")
public class CostController {

    private final CostDataService costDataService;

    public CostController(CostDataService costDataService) {
        this.costDataService = costDataService;
    }

    @Operation(summary = "Get daily costs",
            description = "Returns one record per day, ascending, ending today. " +
                    "In mock mode the series is generated; in live mode it is aggregated from ingested events.")
    @GetMapping("/costs")
    public ResponseEntity<DataResponse<List<DailyCostRecord>>> getCosts(
            @Parameter(description = "Window length in days, clamped to 1-90", example = "30")
            @RequestParam(required = false) Integer days) {
        int window = costDataService.resolveDays(days);
        return ResponseEntity.ok(DataResponse.of(costDataService.getDailyCosts(window), costDataService.getMode()));
    }

    @Operation(summary = "Get cost summary",
            description = "Total spend, average daily spend and per-service totals over the window.")
    @GetMapping("/summary")
    public ResponseEntity<DataResponse<CostSummary>> getSummary(
            @Parameter(description = "Window length in days, clamped to 1-90", example = "30")
            @RequestParam(required = false) Integer days) {
        int window = costDataService.resolveDays(days);
        return ResponseEntity.ok(DataResponse.of(costDataService.getSummary(window), costDataService.getMode()));
    }
}
