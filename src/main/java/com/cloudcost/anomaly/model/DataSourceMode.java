package com.cloudcost.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where daily cost series come from. Chosen once at startup via cost.data-source.
 */
public enum DataSourceMode {
    /** Series produced by the synthetic generator, events kept in memory. */
    MOCK,
    /** Series aggregated from cost events persisted in Aerospike. */
    LIVE;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }
}
