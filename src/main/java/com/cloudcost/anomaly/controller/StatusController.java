package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.model.ServiceStatus;
import com.cloudcost.anomaly.service.CostDataService;
import com.cloudcost.anomaly.service.CostEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/status")
@Tag(name = "Status", description = "Service status and data source mode")
public class StatusController {

    private final CostDataService costDataService;
    private final CostEventService eventService;

    public StatusController(CostDataService costDataService, CostEventService eventService) {
        this.costDataService = costDataService;
        this.eventService = eventService;
    }

    @Operation(summary = "Get service status")
    @GetMapping
    public ResponseEntity<ServiceStatus> getStatus() {
        DataSourceMode mode = costDataService.getMode();
        return ResponseEntity.ok(ServiceStatus.builder()
                .status("ok")
                .mode(mode)
                .liveConfigured(mode == DataSourceMode.LIVE)
                .eventCount(eventService.eventCount())
                .build());
    }
}
