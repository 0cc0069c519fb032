package com.cloudcost.anomaly.service;

import com.cloudcost.anomaly.config.MetricsConfig;
import com.cloudcost.anomaly.model.CostEvent;
import com.cloudcost.anomaly.model.CostEventDocument;
import com.cloudcost.anomaly.model.DataSourceMode;
import com.cloudcost.anomaly.model.IngestResult;
import com.cloudcost.anomaly.repository.CostEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.HashMap;

/**
 * Ingests validated cost events. Field constraints are enforced at the HTTP boundary;
 * this service only derives the storage id and calendar date and hands the event to the store.
 */
@Service
public class CostEventService {

    private static final Logger log = LoggerFactory.getLogger(CostEventService.class);

    private final CostEventStore eventStore;
    private final CostDataService costDataService;
    private final MetricsConfig metricsConfig;

    public CostEventService(CostEventStore eventStore,
                            CostDataService costDataService,
                            MetricsConfig metricsConfig) {
        this.eventStore = eventStore;
        this.costDataService = costDataService;
        this.metricsConfig = metricsConfig;
    }

    public IngestResult ingest(CostEvent event) {
        LocalDate date = parseDate(event.getTs());
        String id = String.format("evt_%s_%s_%s", event.getTs(), event.getService(), event.getResourceGroup());

        CostEventDocument doc = CostEventDocument.builder()
                .id(id)
                .subscriptionId(event.getSubscriptionId() != null ? event.getSubscriptionId() : "demo")
                .ts(event.getTs())
                .date(date)
                .service(event.getService())
                .resourceGroup(event.getResourceGroup())
                .region(event.getRegion() != null ? event.getRegion() : "unknown")
                .costUsd(event.getCostUsd())
                .usageQty(event.getUsageQty())
                .tags(event.getTags() != null ? event.getTags() : new HashMap<>())
                .build();

        eventStore.save(doc);

        DataSourceMode mode = costDataService.getMode();
        metricsConfig.recordEventIngested(event.getService(), mode);
        log.debug("Ingested cost event {} ({} USD on {}) in {} mode", id, event.getCostUsd(), date, mode.label());

        return IngestResult.builder()
                .ok(true)
                .id(id)
                .mode(mode)
                .build();
    }

    public long eventCount() {
        return eventStore.count();
    }

    /**
     * Calendar date as written in an ISO-8601 timestamp. The offset, Z or zone is optional
     * and does not shift the date.
     */
    static LocalDate parseDate(String ts) {
        try {
            return LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(ts));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid ts, expected ISO-8601 date-time: " + ts, e);
        }
    }
}
