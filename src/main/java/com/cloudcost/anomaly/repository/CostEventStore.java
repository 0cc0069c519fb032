package com.cloudcost.anomaly.repository;

import com.cloudcost.anomaly.model.CostEventDocument;

import java.time.LocalDate;
import java.util.List;

/**
 * Storage for ingested cost events. Saving an event whose id already exists replaces it.
 */
public interface CostEventStore {

    void save(CostEventDocument event);

    /**
     * Events whose date falls within [from, to], both inclusive, in no particular order.
     */
    List<CostEventDocument> findBetween(LocalDate from, LocalDate to);

    long count();
}
