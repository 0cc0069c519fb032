package com.cloudcost.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * A validated cost event as stored, with its derived id and calendar date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostEventDocument {

    private String id;
    private String subscriptionId;
    private String ts;
    private LocalDate date;
    private String service;
    private String resourceGroup;
    private String region;
    private double costUsd;
    private Double usageQty;
    private Map<String, String> tags;
}
