package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.model.CostEvent;
import com.cloudcost.anomaly.model.IngestResult;
import com.cloudcost.anomaly.service.CostEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Ingest individual cost events")
public class EventController {

    private final CostEventService eventService;

    public EventController(CostEventService eventService) {
        this.eventService = eventService;
    }

    @Operation(summary = "Ingest a cost event",
            description = "Validates and stores one billed usage event. Re-posting the same ts/service/resourceGroup " +
                    "replaces the earlier event.")
    @PostMapping
    public ResponseEntity<IngestResult> ingest(@Valid @RequestBody CostEvent event) {
        return ResponseEntity.ok(eventService.ingest(event));
    }
}
