package com.cloudcost.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.cloudcost.anomaly.config.AerospikeConfig;
import com.cloudcost.anomaly.model.CostEventDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

@Repository
@ConditionalOnProperty(prefix = "cost", name = "data-source", havingValue = "live")
public class AerospikeCostEventStore implements CostEventStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeCostEventStore.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;

    public AerospikeCostEventStore(AerospikeClient client,
                                   @Qualifier("aerospikeNamespace") String namespace,
                                   @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
    }

    @Override
    public void save(CostEventDocument event) {
        Key key = new Key(namespace, AerospikeConfig.SET_COST_EVENTS, event.getId());
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", event.getId()),
                new Bin("subscriptionId", event.getSubscriptionId()),
                new Bin("ts", event.getTs()),
                new Bin("date", event.getDate().toString()),
                new Bin("service", event.getService()),
                new Bin("resourceGroup", event.getResourceGroup()),
                new Bin("region", event.getRegion()),
                new Bin("costUsd", event.getCostUsd())));

        if (event.getUsageQty() != null) {
            bins.add(new Bin("usageQty", event.getUsageQty()));
        }
        if (event.getTags() != null && !event.getTags().isEmpty()) {
            bins.add(new Bin("tags", event.getTags()));
        }

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
        log.debug("Stored cost event {} for {}", event.getId(), event.getDate());
    }

    @Override
    public List<CostEventDocument> findBetween(LocalDate from, LocalDate to) {
        List<CostEventDocument> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        // ISO dates compare correctly as strings.
        String fromStr = from.toString();
        String toStr = to.toString();

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_COST_EVENTS,
                (key, record) -> {
                    String date = record.getString("date");
                    if (date == null || date.compareTo(fromStr) < 0 || date.compareTo(toStr) > 0) return;
                    CostEventDocument doc = mapRecord(record);
                    synchronized (results) {
                        results.add(doc);
                    }
                });
        return results;
    }

    @Override
    public long count() {
        AtomicLong count = new AtomicLong();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.includeBinData = false;
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_COST_EVENTS,
                (key, record) -> count.incrementAndGet());
        return count.get();
    }

    private CostEventDocument mapRecord(Record record) {
        Object usageQty = record.getValue("usageQty");
        return CostEventDocument.builder()
                .id(record.getString("id"))
                .subscriptionId(record.getString("subscriptionId"))
                .ts(record.getString("ts"))
                .date(LocalDate.parse(record.getString("date")))
                .service(record.getString("service"))
                .resourceGroup(record.getString("resourceGroup"))
                .region(record.getString("region"))
                .costUsd(record.getDouble("costUsd"))
                .usageQty(usageQty != null ? ((Number) usageQty).doubleValue() : null)
                .tags(readTags(record))
                .build();
    }

    private Map<String, String> readTags(Record record) {
        Map<?, ?> raw = record.getMap("tags");
        Map<String, String> tags = new HashMap<>();
        if (raw != null) {
            raw.forEach((k, v) -> tags.put(String.valueOf(k), String.valueOf(v)));
        }
        return tags;
    }
}
